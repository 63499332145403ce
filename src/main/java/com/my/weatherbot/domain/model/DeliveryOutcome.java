package com.my.weatherbot.domain.model;

public enum DeliveryOutcome {
    /** 게이트웨이는 수락했지만 원장 기록이 끝나지 않은 미해결 상태. 재시도해도 안전하다. */
    PENDING,
    DELIVERED,
    FAILED,
    SKIPPED
}
