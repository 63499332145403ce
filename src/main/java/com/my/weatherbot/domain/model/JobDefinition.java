package com.my.weatherbot.domain.model;

import java.time.DayOfWeek;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * 왜: 작업별 발화 규칙(시각, 요일 필터, 외부 조건)을 프로세스 시작 시 한 번 고정하기 위함.
 * dayFilter가 비어 있으면 매일 발화한다.
 */
public record JobDefinition(JobType jobType,
                            TriggerRule triggerRule,
                            Set<DayOfWeek> dayFilter,
                            TriggerCondition condition) {

    public JobDefinition {
        Objects.requireNonNull(jobType, "jobType");
        Objects.requireNonNull(triggerRule, "triggerRule");
        Objects.requireNonNull(dayFilter, "dayFilter");
        Objects.requireNonNull(condition, "condition");
        dayFilter = dayFilter.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(dayFilter));
    }

    public static JobDefinition of(JobType jobType, TriggerRule triggerRule) {
        return new JobDefinition(jobType, triggerRule, Set.of(), TriggerCondition.NONE);
    }

    public boolean appliesOn(DayOfWeek day) {
        return dayFilter.isEmpty() || dayFilter.contains(day);
    }
}
