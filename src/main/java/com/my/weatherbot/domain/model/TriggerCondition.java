package com.my.weatherbot.domain.model;

public enum TriggerCondition {
    NONE,
    ACTIVE_TYPHOON_ADVISORY,
    SOLAR_TERM_DAY
}
