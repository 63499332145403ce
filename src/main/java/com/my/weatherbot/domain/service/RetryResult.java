package com.my.weatherbot.domain.service;

import com.my.weatherbot.domain.model.CallResult;

import java.util.Objects;

/**
 * @param attempts    실제로 수행한 호출 횟수
 * @param interrupted 마감 시각 초과 등으로 작업 스레드가 인터럽트되어 중단되었는지 여부
 */
public record RetryResult<T>(CallResult<T> result, int attempts, boolean interrupted) {

    public RetryResult {
        Objects.requireNonNull(result, "result");
    }
}
