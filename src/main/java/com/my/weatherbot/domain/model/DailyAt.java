package com.my.weatherbot.domain.model;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Objects;

public record DailyAt(LocalTime time) implements TriggerRule {

    public DailyAt {
        Objects.requireNonNull(time, "time");
        time = time.withSecond(0).withNano(0);
    }

    @Override
    public boolean matches(LocalDateTime localMinute) {
        return localMinute.toLocalTime().equals(time);
    }
}
