package com.my.weatherbot.domain.exception;

/**
 * 왜: 설정 변경 명령 등 외부 입력이 계약을 위반했을 때 도메인 진입 전에 거부하기 위함.
 */
public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
