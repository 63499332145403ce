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
import com.my.weatherbot.domain.port.out.ClockPort;
import com.my.weatherbot.domain.port.out.ContentProviderPort;
import com.my.weatherbot.domain.port.out.DeliveryGatewayPort;
import com.my.weatherbot.domain.port.out.DeliveryLedgerPort;
import com.my.weatherbot.domain.port.out.OperatorAlertPort;
import com.my.weatherbot.domain.port.out.SubscriptionStorePort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DeliveryCoordinatorTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2026-07-04T08:00:00+08:00");
    // 2026-07-04 is a Saturday
    private static final FiringEvent WEEKEND = new FiringEvent(JobType.WEEKEND_FORECAST, NOW);
    private static final Payload PAYLOAD = new Payload("週末天氣", "[{\"type\":\"text\",\"text\":\"週末晴\"}]");

    private SubscriptionStorePort store;
    private ContentProviderPort content;
    private DeliveryGatewayPort gateway;
    private MapLedger ledger;
    private OperatorAlertPort alerts;
    private ClockPort clock;
    private List<Long> sentAt;
    private ExecutorService workers;

    @BeforeEach
    void setUp() {
        store = mock(SubscriptionStorePort.class);
        content = mock(ContentProviderPort.class);
        gateway = mock(DeliveryGatewayPort.class);
        ledger = new MapLedger();
        alerts = mock(OperatorAlertPort.class);
        clock = mock(ClockPort.class);
        when(clock.now()).thenReturn(NOW);
        sentAt = new CopyOnWriteArrayList<>();
        workers = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    @Test
    void saturdayWeekendForecastReachesOnlyEnabledSubscriber() {
        Subscriber a = new Subscriber("A", "Taipei", Set.of(JobType.WEEKEND_FORECAST));
        givenEligible(JobType.WEEKEND_FORECAST, a);
        when(content.fetch(JobType.WEEKEND_FORECAST, "Taipei")).thenReturn(CallResult.success(PAYLOAD));
        when(gateway.send(eq("A"), eq(PAYLOAD), any())).thenReturn(CallResult.success("req-1"));

        DispatchReport report = coordinator().dispatch(WEEKEND);

        assertThat(report.attempts()).hasSize(1);
        assertThat(report.attemptsFor("A")).extracting(DeliveryAttempt::outcome).containsExactly(DeliveryOutcome.DELIVERED);
        assertThat(report.attemptsFor("B")).isEmpty();
        verify(content).fetch(JobType.WEEKEND_FORECAST, "Taipei");
        verify(gateway, never()).send(eq("B"), any(), any());
        assertThat(ledger.isDelivered(new DedupKey("A", JobType.WEEKEND_FORECAST, NOW))).isTrue();
    }

    @Test
    void contentThatFailsTwiceThenSucceedsIsDelivered() {
        givenEligible(JobType.WEEKEND_FORECAST, subscriber("A", "Taipei"));
        when(content.fetch(JobType.WEEKEND_FORECAST, "Taipei")).thenReturn(
                CallResult.transientFailure("timeout"),
                CallResult.transientFailure("timeout"),
                CallResult.success(PAYLOAD));
        when(gateway.send(anyString(), any(), any())).thenReturn(CallResult.success("req-1"));

        DispatchReport report = coordinator().dispatch(WEEKEND);

        assertThat(report.attempts()).extracting(DeliveryAttempt::outcome).containsExactly(DeliveryOutcome.DELIVERED);
        verify(content, times(3)).fetch(JobType.WEEKEND_FORECAST, "Taipei");
    }

    @Test
    void contentThatNeverArrivesIsSkippedWithoutGatewayCall() {
        givenEligible(JobType.WEEKEND_FORECAST, subscriber("A", "Taipei"));
        when(content.fetch(any(), anyString())).thenReturn(CallResult.transientFailure("503"));

        DispatchReport report = coordinator().dispatch(WEEKEND);

        DeliveryAttempt attempt = report.attempts().get(0);
        assertThat(attempt.outcome()).isEqualTo(DeliveryOutcome.SKIPPED);
        assertThat(attempt.reason()).isEqualTo(FailureReason.CONTENT_UNAVAILABLE);
        verify(content, times(3)).fetch(JobType.WEEKEND_FORECAST, "Taipei");
        verify(gateway, never()).send(anyString(), any(), any());
    }

    @Test
    void permanentRejectionIsNotRetried() {
        givenEligible(JobType.WEEKEND_FORECAST, subscriber("A", "Taipei"));
        when(content.fetch(any(), anyString())).thenReturn(CallResult.success(PAYLOAD));
        when(gateway.send(anyString(), any(), any())).thenReturn(CallResult.permanentFailure("status=400"));

        DispatchReport report = coordinator().dispatch(WEEKEND);

        DeliveryAttempt attempt = report.attempts().get(0);
        assertThat(attempt.outcome()).isEqualTo(DeliveryOutcome.FAILED);
        assertThat(attempt.reason()).isEqualTo(FailureReason.GATEWAY_REJECTED);
        assertThat(attempt.attemptCount()).isEqualTo(1);
        verify(gateway, times(1)).send(anyString(), any(), any());
        assertThat(ledger.size()).isZero();
    }

    @Test
    void transientGatewayErrorsBackOffLongerBeforeThirdAttempt() {
        givenEligible(JobType.WEEKEND_FORECAST, subscriber("A", "Taipei"));
        when(content.fetch(any(), anyString())).thenReturn(CallResult.success(PAYLOAD));
        List<CallResult<String>> replies = List.of(
                CallResult.transientFailure("status=503"),
                CallResult.transientFailure("status=429"),
                CallResult.success("req-3"));
        when(gateway.send(anyString(), any(), any())).thenAnswer(invocation -> {
            sentAt.add(System.nanoTime());
            return replies.get(sentAt.size() - 1);
        });

        DispatchReport report = coordinator().dispatch(WEEKEND);

        DeliveryAttempt attempt = report.attempts().get(0);
        assertThat(attempt.outcome()).isEqualTo(DeliveryOutcome.DELIVERED);
        assertThat(attempt.attemptCount()).isEqualTo(3);
        assertThat(sentAt).hasSize(3);
        assertThat(Duration.ofNanos(sentAt.get(1) - sentAt.get(0))).isGreaterThanOrEqualTo(Duration.ofMillis(20));
        assertThat(Duration.ofNanos(sentAt.get(2) - sentAt.get(1))).isGreaterThanOrEqualTo(Duration.ofMillis(40));
    }

    @Test
    void transientGatewayErrorsExhaustedFailAsUnavailable() {
        givenEligible(JobType.WEEKEND_FORECAST, subscriber("A", "Taipei"));
        when(content.fetch(any(), anyString())).thenReturn(CallResult.success(PAYLOAD));
        when(gateway.send(anyString(), any(), any())).thenReturn(CallResult.transientFailure("status=503"));

        DispatchReport report = coordinator().dispatch(WEEKEND);

        assertThat(report.attempts().get(0).reason()).isEqualTo(FailureReason.GATEWAY_UNAVAILABLE);
        verify(gateway, times(3)).send(anyString(), any(), any());
    }

    @Test
    void retriesReuseTheSameRetryKey() {
        givenEligible(JobType.WEEKEND_FORECAST, subscriber("A", "Taipei"));
        when(content.fetch(any(), anyString())).thenReturn(CallResult.success(PAYLOAD));
        when(gateway.send(anyString(), any(), any())).thenReturn(
                CallResult.transientFailure("status=500"),
                CallResult.success("req-2"));

        coordinator().dispatch(WEEKEND);

        ArgumentCaptor<UUID> keys = ArgumentCaptor.forClass(UUID.class);
        verify(gateway, times(2)).send(eq("A"), eq(PAYLOAD), keys.capture());
        assertThat(keys.getAllValues()).containsOnly(new DedupKey("A", JobType.WEEKEND_FORECAST, NOW).retryKey());
    }

    @Test
    void concurrentDuplicateDispatchRecordsOneDeliveryPerSubscriber() throws Exception {
        givenEligible(JobType.WEEKEND_FORECAST,
                subscriber("A", "Taipei"), subscriber("B", "Taipei"), subscriber("C", "臺中市"));
        when(content.fetch(any(), anyString())).thenReturn(CallResult.success(PAYLOAD));
        when(gateway.send(anyString(), any(), any())).thenReturn(CallResult.success("req"));
        DeliveryCoordinator first = coordinator();
        DeliveryCoordinator second = coordinator();
        ExecutorService callers = Executors.newFixedThreadPool(3);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<DispatchReport>> reports = List.of(
                    callers.submit(() -> {
                        start.await();
                        return first.dispatch(WEEKEND);
                    }),
                    callers.submit(() -> {
                        start.await();
                        return first.dispatch(WEEKEND);
                    }),
                    callers.submit(() -> {
                        start.await();
                        return second.dispatch(WEEKEND);
                    }));
            start.countDown();

            Map<String, Integer> delivered = new ConcurrentHashMap<>();
            for (Future<DispatchReport> report : reports) {
                for (DeliveryAttempt attempt : report.get(10, TimeUnit.SECONDS).attempts()) {
                    if (attempt.outcome() == DeliveryOutcome.DELIVERED) {
                        delivered.merge(attempt.subscriberId(), 1, Integer::sum);
                    } else {
                        assertThat(attempt.reason()).isEqualTo(FailureReason.DEDUP_CONFLICT);
                    }
                }
            }

            assertThat(delivered).containsOnly(Map.entry("A", 1), Map.entry("B", 1), Map.entry("C", 1));
            assertThat(ledger.size()).isEqualTo(3);
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void alreadyDeliveredSubscriberIsSkipped() {
        givenEligible(JobType.WEEKEND_FORECAST, subscriber("A", "Taipei"));
        ledger.markIfAbsent(new DedupKey("A", JobType.WEEKEND_FORECAST, NOW));

        DispatchReport report = coordinator().dispatch(WEEKEND);

        assertThat(report.attempts().get(0).reason()).isEqualTo(FailureReason.DEDUP_CONFLICT);
        verify(content, never()).fetch(any(), anyString());
        verify(gateway, never()).send(anyString(), any(), any());
    }

    @Test
    void subscriberWhoDisabledJobBeforeSendIsSkipped() {
        when(store.findEligible(JobType.WEEKEND_FORECAST)).thenReturn(List.of(subscriber("A", "Taipei")));
        when(store.getSettings("A")).thenReturn(new Subscriber("A", "Taipei", Set.of()));

        DispatchReport report = coordinator().dispatch(WEEKEND);

        assertThat(report.attempts().get(0).outcome()).isEqualTo(DeliveryOutcome.SKIPPED);
        assertThat(report.attempts().get(0).reason()).isEqualTo(FailureReason.UNSUBSCRIBED);
        verify(content, never()).fetch(any(), anyString());
    }

    @Test
    void subscribersInSameCityShareOneContentFetch() {
        givenEligible(JobType.WEEKEND_FORECAST,
                subscriber("A", "Taipei"), subscriber("B", "Taipei"), subscriber("C", "Tainan"));
        when(content.fetch(any(), anyString())).thenReturn(CallResult.success(PAYLOAD));
        when(gateway.send(anyString(), any(), any())).thenReturn(CallResult.success("req"));

        DispatchReport report = coordinator().dispatch(WEEKEND);

        assertThat(report.count(DeliveryOutcome.DELIVERED)).isEqualTo(3);
        verify(content, times(1)).fetch(JobType.WEEKEND_FORECAST, "Taipei");
        verify(content, times(1)).fetch(JobType.WEEKEND_FORECAST, "Tainan");
    }

    @Test
    void oneSubscriberFailureDoesNotAffectOthers() {
        givenEligible(JobType.WEEKEND_FORECAST, subscriber("A", "Taipei"), subscriber("B", "Taipei"));
        when(content.fetch(any(), anyString())).thenReturn(CallResult.success(PAYLOAD));
        when(gateway.send(eq("A"), any(), any())).thenReturn(CallResult.permanentFailure("status=400"));
        when(gateway.send(eq("B"), any(), any())).thenReturn(CallResult.success("req"));

        DispatchReport report = coordinator().dispatch(WEEKEND);

        assertThat(report.attemptsFor("A")).extracting(DeliveryAttempt::outcome).containsExactly(DeliveryOutcome.FAILED);
        assertThat(report.attemptsFor("B")).extracting(DeliveryAttempt::outcome).containsExactly(DeliveryOutcome.DELIVERED);
    }

    @Test
    void unavailableSubscriberStoreAbortsBatchAndAlertsOperator() {
        when(store.findEligible(JobType.WEEKEND_FORECAST)).thenThrow(new StoreUnavailableException("db locked", null));

        DispatchReport report = coordinator().dispatch(WEEKEND);

        assertThat(report.aborted()).isTrue();
        assertThat(report.attempts()).isEmpty();
        ArgumentCaptor<OperatorAlert> alert = ArgumentCaptor.forClass(OperatorAlert.class);
        verify(alerts).raise(alert.capture());
        assertThat(alert.getValue().kind()).isEqualTo(OperatorAlert.MISSED_NOTIFICATION);
        assertThat(alert.getValue().jobType()).isEqualTo(JobType.WEEKEND_FORECAST);
        assertThat(alert.getValue().triggerTimestamp()).isEqualTo(NOW);
        verify(content, never()).fetch(any(), anyString());
    }

    @Test
    void ledgerFailureAfterAcceptedSendLeavesAttemptPending() {
        givenEligible(JobType.WEEKEND_FORECAST, subscriber("A", "Taipei"));
        when(content.fetch(any(), anyString())).thenReturn(CallResult.success(PAYLOAD));
        when(gateway.send(anyString(), any(), any())).thenReturn(CallResult.success("req"));
        ledger.failWrites = true;

        DispatchReport report = coordinator().dispatch(WEEKEND);

        DeliveryAttempt attempt = report.attempts().get(0);
        assertThat(attempt.outcome()).isEqualTo(DeliveryOutcome.PENDING);
        assertThat(attempt.reason()).isEqualTo(FailureReason.LEDGER_WRITE_FAILED);
    }

    @Test
    void sendStuckPastDeadlineFails() {
        givenEligible(JobType.WEEKEND_FORECAST, subscriber("A", "Taipei"));
        when(content.fetch(any(), anyString())).thenReturn(CallResult.success(PAYLOAD));
        when(gateway.send(anyString(), any(), any())).thenAnswer(invocation -> {
            try {
                TimeUnit.SECONDS.sleep(30);
                return CallResult.success("late");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return CallResult.transientFailure("interrupted");
            }
        });
        DispatchReport report = coordinator(shortDeadline()).dispatch(WEEKEND);

        DeliveryAttempt attempt = report.attempts().get(0);
        assertThat(attempt.outcome()).isEqualTo(DeliveryOutcome.FAILED);
        assertThat(attempt.reason()).isEqualTo(FailureReason.DEADLINE_EXCEEDED);
        verify(gateway, times(1)).send(anyString(), any(), any());
        assertThat(ledger.size()).isZero();
    }

    @Test
    void contentStuckPastDeadlineSkipsWithoutGatewayCall() {
        givenEligible(JobType.WEEKEND_FORECAST, subscriber("A", "Taipei"));
        when(content.fetch(any(), anyString())).thenAnswer(invocation -> {
            try {
                TimeUnit.SECONDS.sleep(30);
                return CallResult.success(PAYLOAD);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return CallResult.transientFailure("interrupted");
            }
        });

        DispatchReport report = coordinator(shortDeadline()).dispatch(WEEKEND);

        DeliveryAttempt attempt = report.attempts().get(0);
        assertThat(attempt.outcome()).isEqualTo(DeliveryOutcome.SKIPPED);
        assertThat(attempt.reason()).isEqualTo(FailureReason.DEADLINE_EXCEEDED);
        verify(gateway, never()).send(anyString(), any(), any());
    }

    @Test
    void timedOutTaskDoesNotInterruptNextTaskOnSameWorker() {
        workers.shutdownNow();
        workers = Executors.newSingleThreadExecutor();
        givenEligible(JobType.WEEKEND_FORECAST, subscriber("A", "Taipei"), subscriber("B", "Taipei"));
        when(content.fetch(any(), anyString())).thenReturn(CallResult.success(PAYLOAD));
        when(gateway.send(eq("A"), any(), any())).thenAnswer(invocation -> {
            try {
                TimeUnit.SECONDS.sleep(30);
                return CallResult.success("late");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return CallResult.transientFailure("interrupted");
            }
        });
        when(gateway.send(eq("B"), any(), any())).thenAnswer(invocation -> {
            TimeUnit.MILLISECONDS.sleep(50);
            return CallResult.success("req-b");
        });

        DispatchReport report = coordinator(shortDeadline()).dispatch(WEEKEND);

        assertThat(report.attemptsFor("A")).extracting(DeliveryAttempt::reason).containsExactly(FailureReason.DEADLINE_EXCEEDED);
        assertThat(report.attemptsFor("B")).extracting(DeliveryAttempt::outcome).containsExactly(DeliveryOutcome.DELIVERED);
        assertThat(ledger.isDelivered(new DedupKey("B", JobType.WEEKEND_FORECAST, NOW))).isTrue();
    }

    @Test
    void noEligibleSubscribersCompletesEmpty() {
        when(store.findEligible(JobType.WEEKEND_FORECAST)).thenReturn(List.of());

        DispatchReport report = coordinator().dispatch(WEEKEND);

        assertThat(report.aborted()).isFalse();
        assertThat(report.attempts()).isEmpty();
    }

    private DeliveryCoordinator coordinator() {
        return coordinator(new DeliveryPolicy(RetryPolicy.fixed(3, Duration.ofMillis(10)),
                RetryPolicy.exponential(3, Duration.ofMillis(20), Duration.ofMillis(160)),
                Duration.ofSeconds(10)));
    }

    private DeliveryCoordinator coordinator(DeliveryPolicy policy) {
        return new DeliveryCoordinator(store, content, gateway, ledger, alerts, clock, policy, workers);
    }

    private static DeliveryPolicy shortDeadline() {
        return new DeliveryPolicy(RetryPolicy.fixed(3, Duration.ofMillis(10)),
                RetryPolicy.exponential(3, Duration.ofMillis(10), Duration.ofMillis(40)), Duration.ofMillis(200));
    }

    private void givenEligible(JobType jobType, Subscriber... subscribers) {
        when(store.findEligible(jobType)).thenReturn(List.of(subscribers));
        for (Subscriber subscriber : subscribers) {
            when(store.getSettings(subscriber.subscriberId())).thenReturn(subscriber);
        }
    }

    private static Subscriber subscriber(String id, String city) {
        return new Subscriber(id, city, Set.of(JobType.WEEKEND_FORECAST));
    }

    private static final class MapLedger implements DeliveryLedgerPort {
        private final Map<DedupKey, Boolean> entries = new ConcurrentHashMap<>();
        private volatile boolean failWrites;

        @Override
        public boolean isDelivered(DedupKey key) {
            return entries.containsKey(key);
        }

        @Override
        public boolean markIfAbsent(DedupKey key) {
            if (failWrites) {
                throw new StoreUnavailableException("disk full", null);
            }
            return entries.putIfAbsent(key, Boolean.TRUE) == null;
        }

        int size() {
            return entries.size();
        }
    }
}
