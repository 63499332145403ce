package com.my.weatherbot.domain.exception;

/**
 * 조건형 작업(태풍 특보, 절기)의 판정 실패. 해당 틱의 발화만 건너뛴다.
 */
public class ConditionCheckException extends RuntimeException {
    public ConditionCheckException(String message) {
        super(message);
    }

    public ConditionCheckException(String message, Throwable cause) {
        super(message, cause);
    }
}
