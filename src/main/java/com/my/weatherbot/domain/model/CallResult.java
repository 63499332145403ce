package com.my.weatherbot.domain.model;

import java.util.Objects;

/**
 * 왜: 외부 호출 결과를 예외 흐름 대신 값으로 돌려받아 재시도 가능 여부를 호출부가 명시적으로 판단하도록 하기 위함.
 */
public final class CallResult<T> {

    public enum Status {
        SUCCESS,
        TRANSIENT_FAILURE,
        PERMANENT_FAILURE
    }

    private final Status status;
    private final T value;
    private final String reason;

    private CallResult(Status status, T value, String reason) {
        this.status = status;
        this.value = value;
        this.reason = reason;
    }

    public static <T> CallResult<T> success(T value) {
        return new CallResult<>(Status.SUCCESS, Objects.requireNonNull(value, "value"), null);
    }

    public static <T> CallResult<T> transientFailure(String reason) {
        return new CallResult<>(Status.TRANSIENT_FAILURE, null, reason);
    }

    public static <T> CallResult<T> permanentFailure(String reason) {
        return new CallResult<>(Status.PERMANENT_FAILURE, null, reason);
    }

    public Status status() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isTransient() {
        return status == Status.TRANSIENT_FAILURE;
    }

    public boolean isPermanent() {
        return status == Status.PERMANENT_FAILURE;
    }

    public T value() {
        if (!isSuccess()) {
            throw new IllegalStateException("실패한 호출에는 값이 없습니다: " + reason);
        }
        return value;
    }

    public String reason() {
        return reason;
    }

    @Override
    public String toString() {
        return isSuccess() ? "CallResult[SUCCESS]" : "CallResult[" + status + ", " + reason + "]";
    }
}
