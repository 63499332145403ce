package com.my.weatherbot.domain.service;

import java.time.Duration;
import java.util.Objects;

/**
 * @param attemptDeadline 구독자 한 명의 시도(콘텐츠 조회 + 전송) 전체에 허용되는 시간
 */
public record DeliveryPolicy(RetryPolicy contentRetry, RetryPolicy gatewayRetry, Duration attemptDeadline) {

    public DeliveryPolicy {
        Objects.requireNonNull(contentRetry, "contentRetry");
        Objects.requireNonNull(gatewayRetry, "gatewayRetry");
        Objects.requireNonNull(attemptDeadline, "attemptDeadline");
        if (attemptDeadline.isZero() || attemptDeadline.isNegative()) {
            throw new IllegalArgumentException("attemptDeadline은 0보다 커야 합니다.");
        }
    }

    public static DeliveryPolicy defaults() {
        return new DeliveryPolicy(
                RetryPolicy.fixed(3, Duration.ofMillis(500)),
                RetryPolicy.exponential(3, Duration.ofSeconds(1), Duration.ofSeconds(8)),
                Duration.ofSeconds(60));
    }
}
