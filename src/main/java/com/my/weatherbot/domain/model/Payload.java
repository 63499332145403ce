package com.my.weatherbot.domain.model;

import java.util.Objects;

/**
 * 왜: 콘텐츠 제공자가 만든 발송 단위를 해석하지 않고 그대로 게이트웨이에 넘기기 위함.
 * messagesJson은 메시징 플랫폼의 메시지 객체 JSON 배열이다.
 */
public record Payload(String summary, String messagesJson) {

    public Payload {
        Objects.requireNonNull(summary, "summary");
        Objects.requireNonNull(messagesJson, "messagesJson");
        if (messagesJson.isBlank()) {
            throw new IllegalArgumentException("messagesJson은 비어 있을 수 없습니다.");
        }
    }
}
