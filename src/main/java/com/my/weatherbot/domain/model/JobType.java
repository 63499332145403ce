package com.my.weatherbot.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * 왜: 푸시 작업 종류를 닫힌 집합으로 고정하고, 저장소에 쓰이는 기능 ID와 1:1로 대응시키기 위함.
 */
public enum JobType {
    DAILY_WEATHER("daily_reminder_push", "每日天氣"),
    WEEKEND_FORECAST("weekend_weather_push", "週末天氣"),
    TYPHOON_WATCH("typhoon_notification_push", "颱風通知"),
    SOLAR_TERM_REMINDER("solar_terms_push", "節氣小知識");

    private final String featureId;
    private final String displayName;

    JobType(String featureId, String displayName) {
        this.featureId = featureId;
        this.displayName = displayName;
    }

    public String featureId() {
        return featureId;
    }

    public String displayName() {
        return displayName;
    }

    public static Optional<JobType> fromFeatureId(String featureId) {
        return Arrays.stream(values())
                .filter(type -> type.featureId.equals(featureId))
                .findFirst();
    }

    /**
     * enum 이름 또는 기능 ID 어느 쪽이든 받아들인다.
     */
    public static Optional<JobType> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(type -> type.name().equalsIgnoreCase(trimmed) || type.featureId.equals(trimmed))
                .findFirst();
    }
}
