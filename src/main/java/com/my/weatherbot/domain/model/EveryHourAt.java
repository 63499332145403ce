package com.my.weatherbot.domain.model;

import java.time.LocalDateTime;

public record EveryHourAt(int minuteOfHour) implements TriggerRule {

    public EveryHourAt {
        if (minuteOfHour < 0 || minuteOfHour > 59) {
            throw new IllegalArgumentException("minuteOfHour는 0~59 사이여야 합니다: " + minuteOfHour);
        }
    }

    @Override
    public boolean matches(LocalDateTime localMinute) {
        return localMinute.getMinute() == minuteOfHour;
    }
}
