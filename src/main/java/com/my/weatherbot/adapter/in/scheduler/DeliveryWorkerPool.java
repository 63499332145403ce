package com.my.weatherbot.adapter.in.scheduler;

import com.my.weatherbot.config.AppConfig;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 왜: 구독자별 발송 작업을 게이트웨이 요청 한도에 맞춘 고정 크기 풀에서 돌리기 위함.
 */
@ApplicationScoped
public class DeliveryWorkerPool {

    private static final Logger log = Logger.getLogger(DeliveryWorkerPool.class);

    private final ExecutorService workers;

    @Inject
    public DeliveryWorkerPool(AppConfig appConfig) {
        this(appConfig.delivery().workerThreads());
    }

    DeliveryWorkerPool(int workerThreads) {
        this.workers = Executors.newFixedThreadPool(workerThreads, namedFactory("delivery-worker-"));
    }

    public ExecutorService workers() {
        return workers;
    }

    /**
     * 진행 중인 발송이 끝나기를 최대 grace만큼 기다린 뒤 남은 작업을 인터럽트한다. 여러 번 불러도 된다.
     */
    public void drain(long graceSeconds) {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(graceSeconds, TimeUnit.SECONDS)) {
                log.warnf("발송 작업자가 %d초 안에 끝나지 않아 강제 종료합니다.", graceSeconds);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    @PreDestroy
    void stop() {
        if (!workers.isShutdown()) {
            drain(0);
        }
    }

    static ThreadFactory namedFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
