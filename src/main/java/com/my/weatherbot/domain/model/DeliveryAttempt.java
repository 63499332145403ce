package com.my.weatherbot.domain.model;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * 왜: 구독자 한 명에 대한 발송 시도의 최종 결과를 보고서에 남기기 위함. 프로세스 밖으로 영속화하지 않는다.
 *
 * @param attemptCount 게이트웨이 호출 횟수
 */
public record DeliveryAttempt(String subscriberId,
                              JobType jobType,
                              OffsetDateTime triggerTimestamp,
                              int attemptCount,
                              DeliveryOutcome outcome,
                              FailureReason reason,
                              String detail) {

    public DeliveryAttempt {
        Objects.requireNonNull(subscriberId, "subscriberId");
        Objects.requireNonNull(jobType, "jobType");
        Objects.requireNonNull(triggerTimestamp, "triggerTimestamp");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(reason, "reason");
        if (attemptCount < 0) {
            throw new IllegalArgumentException("attemptCount는 음수일 수 없습니다.");
        }
    }

    public static DeliveryAttempt delivered(DedupKey key, int attemptCount) {
        return new DeliveryAttempt(key.subscriberId(), key.jobType(), key.triggerTimestamp(),
                attemptCount, DeliveryOutcome.DELIVERED, FailureReason.NONE, null);
    }

    public static DeliveryAttempt skipped(DedupKey key, int attemptCount, FailureReason reason, String detail) {
        return new DeliveryAttempt(key.subscriberId(), key.jobType(), key.triggerTimestamp(),
                attemptCount, DeliveryOutcome.SKIPPED, reason, detail);
    }

    public static DeliveryAttempt failed(DedupKey key, int attemptCount, FailureReason reason, String detail) {
        return new DeliveryAttempt(key.subscriberId(), key.jobType(), key.triggerTimestamp(),
                attemptCount, DeliveryOutcome.FAILED, reason, detail);
    }

    public static DeliveryAttempt unresolved(DedupKey key, int attemptCount, String detail) {
        return new DeliveryAttempt(key.subscriberId(), key.jobType(), key.triggerTimestamp(),
                attemptCount, DeliveryOutcome.PENDING, FailureReason.LEDGER_WRITE_FAILED, detail);
    }
}
