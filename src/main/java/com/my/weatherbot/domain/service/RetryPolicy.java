package com.my.weatherbot.domain.service;

import java.time.Duration;
import java.util.Objects;

/**
 * 왜: 콘텐츠 조회와 게이트웨이 전송의 재시도 규칙을 설정에서 읽은 값 객체 하나로 고정하기 위함.
 *
 * <p>두 번째 시도 전 대기는 {@code initialDelay}, 이후 매 시도마다 {@code multiplier}배로 늘어나며
 * {@code maxDelay}를 넘지 않는다. 실제 실행은 {@link RetryingCall}이 맡는다.</p>
 */
public record RetryPolicy(int maxAttempts, Duration initialDelay, int multiplier, Duration maxDelay) {

    public RetryPolicy {
        Objects.requireNonNull(initialDelay, "initialDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts는 1 이상이어야 합니다.");
        }
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("대기 시간은 음수일 수 없습니다.");
        }
        if (multiplier < 1) {
            throw new IllegalArgumentException("multiplier는 1 이상이어야 합니다.");
        }
    }

    public static RetryPolicy fixed(int maxAttempts, Duration delay) {
        return new RetryPolicy(maxAttempts, delay, 1, delay);
    }

    public static RetryPolicy exponential(int maxAttempts, Duration initialDelay, Duration maxDelay) {
        return new RetryPolicy(maxAttempts, initialDelay, 2, maxDelay);
    }

    public int maxRetries() {
        return maxAttempts - 1;
    }

    public boolean backsOff() {
        return multiplier > 1;
    }
}
