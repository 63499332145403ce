package com.my.weatherbot.domain.model;

public enum FailureReason {
    NONE,
    CONTENT_UNAVAILABLE,
    GATEWAY_REJECTED,
    GATEWAY_UNAVAILABLE,
    DEDUP_CONFLICT,
    UNSUBSCRIBED,
    STORE_UNAVAILABLE,
    LEDGER_WRITE_FAILED,
    DEADLINE_EXCEEDED,
    SHUTDOWN,
    UNEXPECTED_ERROR
}
