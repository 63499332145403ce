package com.my.weatherbot.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * 왜: 발화 하나를 처리한 결과(구독자별 결과, 배치 중단 여부)를 운영 로그와 테스트가 같은 형태로 보도록 하기 위함.
 */
public record DispatchReport(FiringEvent event,
                             List<DeliveryAttempt> attempts,
                             boolean aborted,
                             String abortReason) {

    public DispatchReport {
        Objects.requireNonNull(event, "event");
        attempts = List.copyOf(Objects.requireNonNull(attempts, "attempts"));
    }

    public static DispatchReport completed(FiringEvent event, List<DeliveryAttempt> attempts) {
        return new DispatchReport(event, attempts, false, null);
    }

    public static DispatchReport aborted(FiringEvent event, String abortReason) {
        return new DispatchReport(event, List.of(), true, abortReason);
    }

    public long count(DeliveryOutcome outcome) {
        return attempts.stream().filter(attempt -> attempt.outcome() == outcome).count();
    }

    public List<DeliveryAttempt> attemptsFor(String subscriberId) {
        return attempts.stream()
                .filter(attempt -> attempt.subscriberId().equals(subscriberId))
                .toList();
    }
}
