package com.my.weatherbot.domain.exception;

/**
 * 왜: 구독/원장 저장소 접근 실패를 배치 중단 사유로 도메인에 그대로 드러내기 위함.
 */
public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
