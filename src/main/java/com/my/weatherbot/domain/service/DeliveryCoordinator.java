package com.my.weatherbot.domain.service;

import com.my.weatherbot.domain.exception.StoreUnavailableException;
import com.my.weatherbot.domain.model.CallResult;
import com.my.weatherbot.domain.model.DedupKey;
import com.my.weatherbot.domain.model.DeliveryAttempt;
import com.my.weatherbot.domain.model.DeliveryOutcome;
import com.my.weatherbot.domain.model.DispatchReport;
import com.my.weatherbot.domain.model.FailureReason;
import com.my.weatherbot.domain.model.FiringEvent;
import com.my.weatherbot.domain.model.JobType;
import com.my.weatherbot.domain.model.OperatorAlert;
import com.my.weatherbot.domain.model.Payload;
import com.my.weatherbot.domain.model.Subscriber;
import com.my.weatherbot.domain.port.in.DispatchNotificationUseCase;
import com.my.weatherbot.domain.port.out.ClockPort;
import com.my.weatherbot.domain.port.out.ContentProviderPort;
import com.my.weatherbot.domain.port.out.DeliveryGatewayPort;
import com.my.weatherbot.domain.port.out.DeliveryLedgerPort;
import com.my.weatherbot.domain.port.out.OperatorAlertPort;
import com.my.weatherbot.domain.port.out.SubscriptionStorePort;
import io.smallrye.faulttolerance.api.FaultTolerance;
import org.eclipse.microprofile.faulttolerance.exceptions.TimeoutException;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 왜: 발화 하나를 구독자별 독립 작업으로 펼쳐 콘텐츠 조회, 재시도 전송, 중복 방지 기록까지 한 흐름으로 조율하기 위함.
 *
 * <p>구독자별 실패는 서로 격리된다. 구독자 목록 조회 실패만 배치 전체를 중단시키며,
 * 이 경우 누락된 알림으로 기록하고 운영 알림을 올린다. 게이트웨이가 수락한 뒤에만 원장에 기록하므로
 * 기록 전에 중단되면 미해결(PENDING)로 남고 재시도해도 안전하다.
 * 구독자 한 명의 시도 전체는 SmallRye Fault Tolerance 타임아웃으로 묶어, 마감 시각이 지나면 작업 스레드를 인터럽트한다.</p>
 */
public class DeliveryCoordinator implements DispatchNotificationUseCase {

    private static final Logger log = Logger.getLogger(DeliveryCoordinator.class);

    private final SubscriptionStorePort subscriptionStore;
    private final ContentProviderPort contentProvider;
    private final DeliveryGatewayPort deliveryGateway;
    private final DeliveryLedgerPort deliveryLedger;
    private final OperatorAlertPort operatorAlertPort;
    private final ClockPort clockPort;
    private final DeliveryPolicy policy;
    private final ExecutorService workers;
    private final RetryingCall<Payload> contentCall;
    private final RetryingCall<String> gatewayCall;
    private final FaultTolerance<DeliveryAttempt> deadlineGuard;
    private final Set<DedupKey> inFlight = ConcurrentHashMap.newKeySet();

    public DeliveryCoordinator(SubscriptionStorePort subscriptionStore,
                               ContentProviderPort contentProvider,
                               DeliveryGatewayPort deliveryGateway,
                               DeliveryLedgerPort deliveryLedger,
                               OperatorAlertPort operatorAlertPort,
                               ClockPort clockPort,
                               DeliveryPolicy policy,
                               ExecutorService workers) {
        this.subscriptionStore = subscriptionStore;
        this.contentProvider = contentProvider;
        this.deliveryGateway = deliveryGateway;
        this.deliveryLedger = deliveryLedger;
        this.operatorAlertPort = operatorAlertPort;
        this.clockPort = clockPort;
        this.policy = policy;
        this.workers = workers;
        this.contentCall = new RetryingCall<>(policy.contentRetry());
        this.gatewayCall = new RetryingCall<>(policy.gatewayRetry());
        this.deadlineGuard = FaultTolerance.<DeliveryAttempt>create()
                .withTimeout()
                .duration(policy.attemptDeadline().toMillis(), ChronoUnit.MILLIS)
                .done()
                .build();
    }

    @Override
    public DispatchReport dispatch(FiringEvent event) {
        List<Subscriber> eligible;
        try {
            eligible = subscriptionStore.findEligible(event.jobType());
        } catch (StoreUnavailableException e) {
            String reason = "구독자 조회 실패: " + e.getMessage();
            log.errorf(e, "%s 발송 배치를 중단합니다. 발화 시각 %s의 알림은 누락됩니다.",
                    event.jobType(), event.triggerTimestamp());
            raiseMissedNotification(event, reason);
            return DispatchReport.aborted(event, reason);
        }
        if (eligible.isEmpty()) {
            log.infof("%s 발화(%s)의 대상 구독자가 없습니다.", event.jobType(), event.triggerTimestamp());
            return DispatchReport.completed(event, List.of());
        }
        log.infof("%s 발화(%s) 발송 시작: 대상 %d명", event.jobType(), event.triggerTimestamp(), eligible.size());

        ContentCache contentCache = new ContentCache(event.jobType());
        List<DedupKey> keys = new ArrayList<>(eligible.size());
        List<Future<DeliveryAttempt>> futures = new ArrayList<>(eligible.size());
        for (Subscriber subscriber : eligible) {
            DedupKey key = new DedupKey(subscriber.subscriberId(), event.jobType(), event.triggerTimestamp());
            keys.add(key);
            try {
                futures.add(workers.submit(() -> deliverWithDeadline(key, contentCache)));
            } catch (RejectedExecutionException e) {
                futures.add(null);
            }
        }

        List<DeliveryAttempt> attempts = new ArrayList<>(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            attempts.add(await(keys.get(i), futures.get(i)));
        }
        DispatchReport report = DispatchReport.completed(event, attempts);
        log.infof("%s 발화(%s) 발송 종료: delivered=%d, failed=%d, skipped=%d, pending=%d",
                event.jobType(), event.triggerTimestamp(),
                report.count(DeliveryOutcome.DELIVERED), report.count(DeliveryOutcome.FAILED),
                report.count(DeliveryOutcome.SKIPPED), report.count(DeliveryOutcome.PENDING));
        return report;
    }

    private DeliveryAttempt await(DedupKey key, Future<DeliveryAttempt> future) {
        if (future == null) {
            return DeliveryAttempt.skipped(key, 0, FailureReason.SHUTDOWN, "발송 작업자 풀이 종료되었습니다.");
        }
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return DeliveryAttempt.failed(key, 0, FailureReason.SHUTDOWN, "발송 결과 대기 중 중단되었습니다.");
        } catch (CancellationException e) {
            return DeliveryAttempt.failed(key, 0, FailureReason.DEADLINE_EXCEEDED, "발송 작업이 취소되었습니다.");
        } catch (ExecutionException e) {
            log.errorf(e.getCause(), "구독자 %s 발송 중 예기치 못한 오류", Subscriber.shortId(key.subscriberId()));
            return DeliveryAttempt.failed(key, 0, FailureReason.UNEXPECTED_ERROR, String.valueOf(e.getCause()));
        }
    }

    private DeliveryAttempt deliverWithDeadline(DedupKey key, ContentCache contentCache) {
        DeliveryProgress progress = new DeliveryProgress();
        MDC.put("subscriberId", Subscriber.shortId(key.subscriberId()));
        MDC.put("jobType", key.jobType().name());
        try {
            return deadlineGuard.call(() -> deliver(key, contentCache, progress));
        } catch (TimeoutException e) {
            // 가드가 남긴 인터럽트가 풀의 다음 작업으로 넘어가지 않게 지운다.
            Thread.interrupted();
            return deadlineExceeded(key, progress);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return DeliveryAttempt.failed(key, progress.sendAttempts.get(), FailureReason.SHUTDOWN, String.valueOf(e));
        } finally {
            MDC.remove("subscriberId");
            MDC.remove("jobType");
        }
    }

    private DeliveryAttempt deadlineExceeded(DedupKey key, DeliveryProgress progress) {
        String message = "마감 시각 " + policy.attemptDeadline().toSeconds() + "초를 넘겼습니다.";
        if (!progress.contentObtained) {
            log.warnf("구독자 %s 콘텐츠 준비 중 마감 시각을 넘겼습니다.", Subscriber.shortId(key.subscriberId()));
            return DeliveryAttempt.skipped(key, 0, FailureReason.DEADLINE_EXCEEDED, message);
        }
        log.warnf("구독자 %s 전송이 마감 시각을 넘겨 중단되었습니다.", Subscriber.shortId(key.subscriberId()));
        return DeliveryAttempt.failed(key, progress.sendAttempts.get(), FailureReason.DEADLINE_EXCEEDED, message);
    }

    private DeliveryAttempt deliver(DedupKey key, ContentCache contentCache, DeliveryProgress progress) {
        String who = Subscriber.shortId(key.subscriberId());
        if (!inFlight.add(key)) {
            return DeliveryAttempt.skipped(key, 0, FailureReason.DEDUP_CONFLICT, "같은 키의 발송이 진행 중입니다.");
        }
        try {
            Subscriber current;
            try {
                if (deliveryLedger.isDelivered(key)) {
                    log.debugf("구독자 %s는 이번 발화에 이미 발송되었습니다.", who);
                    return DeliveryAttempt.skipped(key, 0, FailureReason.DEDUP_CONFLICT, "이미 발송되었습니다.");
                }
                current = subscriptionStore.getSettings(key.subscriberId());
            } catch (StoreUnavailableException e) {
                log.warnf("구독자 %s 발송 전 저장소 조회 실패: %s", who, e.getMessage());
                return DeliveryAttempt.skipped(key, 0, FailureReason.STORE_UNAVAILABLE, e.getMessage());
            }
            if (!current.isEnabled(key.jobType())) {
                log.debugf("구독자 %s가 %s 푸시를 꺼 두어 건너뜁니다.", who, key.jobType());
                return DeliveryAttempt.skipped(key, 0, FailureReason.UNSUBSCRIBED, "발송 직전 설정에서 꺼져 있습니다.");
            }

            RetryResult<Payload> content;
            try {
                content = contentCache.get(current.preferredCity());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return DeliveryAttempt.skipped(key, 0, FailureReason.DEADLINE_EXCEEDED, "콘텐츠 대기 중 마감 시각을 넘겼습니다.");
            }
            if (!content.result().isSuccess()) {
                FailureReason reason = content.interrupted() ? FailureReason.DEADLINE_EXCEEDED : FailureReason.CONTENT_UNAVAILABLE;
                log.warnf("%s(%s) 콘텐츠를 가져오지 못해 구독자 %s를 건너뜁니다: %s",
                        key.jobType(), current.preferredCity(), who, content.result().reason());
                return DeliveryAttempt.skipped(key, 0, reason, content.result().reason());
            }
            progress.contentObtained = true;
            return send(key, content.result().value(), progress);
        } finally {
            inFlight.remove(key);
        }
    }

    private DeliveryAttempt send(DedupKey key, Payload payload, DeliveryProgress progress) {
        String who = Subscriber.shortId(key.subscriberId());
        RetryResult<String> sent = gatewayCall.execute(() -> {
            progress.sendAttempts.incrementAndGet();
            return deliveryGateway.send(key.subscriberId(), payload, key.retryKey());
        });
        CallResult<String> result = sent.result();
        if (result.isSuccess()) {
            return record(key, sent.attempts());
        }
        if (sent.interrupted()) {
            log.warnf("구독자 %s 전송이 마감 시각을 넘겨 중단되었습니다.", who);
            return DeliveryAttempt.failed(key, sent.attempts(), FailureReason.DEADLINE_EXCEEDED, result.reason());
        }
        if (result.isPermanent()) {
            log.warnf("게이트웨이가 구독자 %s 전송을 거부했습니다: %s", who, result.reason());
            return DeliveryAttempt.failed(key, sent.attempts(), FailureReason.GATEWAY_REJECTED, result.reason());
        }
        log.warnf("구독자 %s 전송이 %d회 시도 후 실패했습니다: %s", who, sent.attempts(), result.reason());
        return DeliveryAttempt.failed(key, sent.attempts(), FailureReason.GATEWAY_UNAVAILABLE, result.reason());
    }

    private DeliveryAttempt record(DedupKey key, int attempts) {
        try {
            if (deliveryLedger.markIfAbsent(key)) {
                log.infof("구독자 %s에게 %s 발송 완료", Subscriber.shortId(key.subscriberId()), key.jobType());
                return DeliveryAttempt.delivered(key, attempts);
            }
            log.infof("구독자 %s의 %s 발송은 다른 시도가 먼저 기록했습니다.", Subscriber.shortId(key.subscriberId()), key.jobType());
            return DeliveryAttempt.skipped(key, attempts, FailureReason.DEDUP_CONFLICT, "다른 시도가 먼저 기록했습니다.");
        } catch (StoreUnavailableException e) {
            log.errorf(e, "구독자 %s 전송은 수락되었으나 원장 기록에 실패했습니다.", Subscriber.shortId(key.subscriberId()));
            return DeliveryAttempt.unresolved(key, attempts, e.getMessage());
        }
    }

    private void raiseMissedNotification(FiringEvent event, String reason) {
        try {
            operatorAlertPort.raise(new OperatorAlert(OperatorAlert.MISSED_NOTIFICATION, event.jobType(),
                    event.triggerTimestamp(), reason, clockPort.now()));
        } catch (RuntimeException e) {
            log.warnf("운영 알림 발행 실패: %s", e.getMessage());
        }
    }

    /**
     * 마감 시각에 걸렸을 때 어느 단계까지 왔는지 판단하는 데 쓴다.
     */
    private static final class DeliveryProgress {
        private volatile boolean contentObtained;
        private final AtomicInteger sendAttempts = new AtomicInteger();
    }

    /**
     * 한 번의 발화 안에서 도시별 콘텐츠를 한 번만 가져와 같은 도시 구독자들이 공유한다.
     */
    private final class ContentCache {

        private final JobType jobType;
        private final ConcurrentMap<String, FutureTask<RetryResult<Payload>>> byCity = new ConcurrentHashMap<>();

        private ContentCache(JobType jobType) {
            this.jobType = jobType;
        }

        RetryResult<Payload> get(String city) throws InterruptedException {
            while (true) {
                FutureTask<RetryResult<Payload>> task = new FutureTask<>(
                        () -> contentCall.execute(() -> contentProvider.fetch(jobType, city)));
                FutureTask<RetryResult<Payload>> existing = byCity.putIfAbsent(city, task);
                if (existing == null) {
                    task.run();
                    existing = task;
                }
                RetryResult<Payload> result;
                try {
                    result = existing.get();
                } catch (ExecutionException e) {
                    return new RetryResult<>(CallResult.permanentFailure(String.valueOf(e.getCause())), 0, false);
                }
                // 다른 구독자의 마감 시각 때문에 중단된 결과는 공유하지 않고 다시 가져온다.
                if (result.interrupted() && existing != task) {
                    byCity.remove(city, existing);
                    continue;
                }
                return result;
            }
        }
    }
}
