package com.my.weatherbot.adapter.in.scheduler;

import com.my.weatherbot.config.AppConfig;
import com.my.weatherbot.domain.model.DispatchReport;
import com.my.weatherbot.domain.model.FiringEvent;
import com.my.weatherbot.domain.port.in.DetectFiringsUseCase;
import com.my.weatherbot.domain.port.in.DispatchNotificationUseCase;
import com.my.weatherbot.domain.port.out.ClockPort;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 왜: 분 단위 발화 판정을 주기적으로 돌리고, 발화마다 발송 배치를 별도 스레드에서 시작해 틱 주기가 발송 시간에 묶이지 않도록 하기 위함.
 *
 * <p>틱 간격이 1분보다 짧으므로 같은 분을 여러 번 보게 되는데, 이미 처리한 분은 다시 판정하지 않는다.
 * 프로세스가 잠시 멈췄다면 최근 {@code catchUpMinutes}분까지만 거슬러 올라가 판정한다.</p>
 */
@Startup
@ApplicationScoped
public class NotificationTickLoop {

    private static final Logger log = Logger.getLogger(NotificationTickLoop.class);

    private final DetectFiringsUseCase detectFiringsUseCase;
    private final DispatchNotificationUseCase dispatchNotificationUseCase;
    private final ClockPort clockPort;
    private final DeliveryWorkerPool workerPool;
    private final ExecutorService dispatchPool;
    private final ScheduledExecutorService ticker;
    private final int tickIntervalSeconds;
    private final int catchUpMinutes;
    private final int shutdownGraceSeconds;

    private OffsetDateTime lastMinute;
    private volatile OffsetDateTime lastTickAt;
    private volatile boolean running;

    @Inject
    public NotificationTickLoop(DetectFiringsUseCase detectFiringsUseCase,
                                DispatchNotificationUseCase dispatchNotificationUseCase,
                                ClockPort clockPort,
                                DeliveryWorkerPool workerPool,
                                AppConfig appConfig) {
        this(detectFiringsUseCase, dispatchNotificationUseCase, clockPort, workerPool,
                Executors.newFixedThreadPool(appConfig.scheduler().dispatchThreads(), DeliveryWorkerPool.namedFactory("dispatch-")),
                appConfig.scheduler().tickIntervalSeconds(),
                appConfig.scheduler().catchUpMinutes(),
                appConfig.scheduler().shutdownGraceSeconds());
    }

    NotificationTickLoop(DetectFiringsUseCase detectFiringsUseCase,
                         DispatchNotificationUseCase dispatchNotificationUseCase,
                         ClockPort clockPort,
                         DeliveryWorkerPool workerPool,
                         ExecutorService dispatchPool,
                         int tickIntervalSeconds,
                         int catchUpMinutes,
                         int shutdownGraceSeconds) {
        this.detectFiringsUseCase = detectFiringsUseCase;
        this.dispatchNotificationUseCase = dispatchNotificationUseCase;
        this.clockPort = clockPort;
        this.workerPool = workerPool;
        this.dispatchPool = dispatchPool;
        this.ticker = Executors.newSingleThreadScheduledExecutor(DeliveryWorkerPool.namedFactory("notification-tick-"));
        this.tickIntervalSeconds = tickIntervalSeconds;
        this.catchUpMinutes = catchUpMinutes;
        this.shutdownGraceSeconds = shutdownGraceSeconds;
    }

    @PostConstruct
    void start() {
        running = true;
        ticker.scheduleWithFixedDelay(this::tickSafely, 0, tickIntervalSeconds, TimeUnit.SECONDS);
        log.infof("알림 틱 루프 시작: 간격 %d초, 따라잡기 %d분", tickIntervalSeconds, catchUpMinutes);
    }

    private void tickSafely() {
        try {
            runTick();
        } catch (Exception e) {
            log.warnf("알림 틱 처리 중 예외: %s", e.getMessage());
        }
    }

    /**
     * 아직 판정하지 않은 분들에 대해 발화를 찾고 발송 배치를 제출한다.
     *
     * @return 이번 틱에 제출한 발화
     */
    synchronized List<FiringEvent> runTick() {
        OffsetDateTime now = clockPort.now();
        lastTickAt = now;
        OffsetDateTime currentMinute = now.truncatedTo(ChronoUnit.MINUTES);
        List<FiringEvent> submitted = new ArrayList<>();
        for (OffsetDateTime minute : pendingMinutes(currentMinute)) {
            List<FiringEvent> events;
            try {
                events = detectFiringsUseCase.tick(minute);
            } catch (RuntimeException e) {
                log.errorf(e, "%s 발화 판정 실패", minute);
                continue;
            }
            for (FiringEvent event : events) {
                if (submit(event)) {
                    acknowledge(event);
                    submitted.add(event);
                }
            }
        }
        if (lastMinute == null || currentMinute.isAfter(lastMinute)) {
            lastMinute = currentMinute;
        }
        return submitted;
    }

    private List<OffsetDateTime> pendingMinutes(OffsetDateTime currentMinute) {
        if (lastMinute == null) {
            return List.of(currentMinute);
        }
        if (!currentMinute.isAfter(lastMinute)) {
            return List.of();
        }
        OffsetDateTime earliest = currentMinute.minusMinutes(catchUpMinutes);
        OffsetDateTime from = lastMinute.plusMinutes(1);
        if (from.isBefore(earliest)) {
            log.warnf("틱이 %s부터 %s까지 멈춰 있었습니다. %s 이전 분은 판정하지 않습니다.", lastMinute, currentMinute, earliest);
            from = earliest;
        }
        List<OffsetDateTime> minutes = new ArrayList<>();
        for (OffsetDateTime minute = from; !minute.isAfter(currentMinute); minute = minute.plusMinutes(1)) {
            minutes.add(minute);
        }
        return minutes;
    }

    private boolean submit(FiringEvent event) {
        try {
            dispatchPool.submit(() -> dispatchSafely(event));
            return true;
        } catch (RejectedExecutionException e) {
            log.warnf("종료 중이라 %s 발화(%s)를 제출하지 않습니다.", event.jobType(), event.triggerTimestamp());
            return false;
        }
    }

    private void acknowledge(FiringEvent event) {
        try {
            detectFiringsUseCase.acknowledge(event);
        } catch (RuntimeException e) {
            log.warnf("%s 발화(%s)는 제출했으나 발화 상태를 기록하지 못했습니다. 재시작 후 다시 발화할 수 있습니다: %s",
                    event.jobType(), event.triggerTimestamp(), e.getMessage());
        }
    }

    private void dispatchSafely(FiringEvent event) {
        try {
            DispatchReport report = dispatchNotificationUseCase.dispatch(event);
            if (report.aborted()) {
                log.errorf("%s 발화(%s) 배치가 중단되었습니다: %s", event.jobType(), event.triggerTimestamp(), report.abortReason());
            }
        } catch (Exception e) {
            log.errorf(e, "%s 발화(%s) 발송 중 예외", event.jobType(), event.triggerTimestamp());
        }
    }

    public boolean isRunning() {
        return running;
    }

    public OffsetDateTime lastTickAt() {
        return lastTickAt;
    }

    public int tickIntervalSeconds() {
        return tickIntervalSeconds;
    }

    @PreDestroy
    void stop() {
        running = false;
        ticker.shutdownNow();
        dispatchPool.shutdown();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(shutdownGraceSeconds);
        try {
            if (!dispatchPool.awaitTermination(shutdownGraceSeconds, TimeUnit.SECONDS)) {
                log.warnf("진행 중인 발송 배치가 %d초 안에 끝나지 않았습니다.", shutdownGraceSeconds);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        long remaining = Math.max(0, TimeUnit.NANOSECONDS.toSeconds(deadline - System.nanoTime()));
        workerPool.drain(remaining);
        dispatchPool.shutdownNow();
        log.info("알림 틱 루프를 종료했습니다.");
    }
}
