package com.my.weatherbot.domain.model;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * 왜: 배치 단위 실패(누락된 알림)를 운영자에게 알리는 계약을 고정하기 위함.
 */
public record OperatorAlert(String kind,
                            JobType jobType,
                            OffsetDateTime triggerTimestamp,
                            String message,
                            OffsetDateTime raisedAt) {

    public static final String MISSED_NOTIFICATION = "MISSED_NOTIFICATION";

    public OperatorAlert {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(jobType, "jobType");
        Objects.requireNonNull(triggerTimestamp, "triggerTimestamp");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(raisedAt, "raisedAt");
    }
}
