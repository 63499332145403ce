package com.my.weatherbot.domain.model;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * 왜: 스케줄러가 만든 발화 하나를 (작업, 논리적 발화 시각) 쌍으로 고정해 발송 단위의 기준으로 삼기 위함.
 *
 * @param conditionRef 발화 조건을 만족시킨 외부 식별자(태풍 특보 ID 등). 조건 없는 작업은 null
 */
public record FiringEvent(JobType jobType, OffsetDateTime triggerTimestamp, String conditionRef) {
    public FiringEvent {
        Objects.requireNonNull(jobType, "jobType");
        Objects.requireNonNull(triggerTimestamp, "triggerTimestamp");
    }

    public FiringEvent(JobType jobType, OffsetDateTime triggerTimestamp) {
        this(jobType, triggerTimestamp, null);
    }

    public Optional<String> condition() {
        return Optional.ofNullable(conditionRef);
    }
}
