package com.my.weatherbot.config;

import com.my.weatherbot.domain.model.DailyAt;
import com.my.weatherbot.domain.model.EveryHourAt;
import com.my.weatherbot.domain.model.JobDefinition;
import com.my.weatherbot.domain.model.JobType;
import com.my.weatherbot.domain.model.TriggerCondition;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 왜: 설정 값을 프로세스 수명 동안 바뀌지 않는 작업 정의 목록으로 한 번에 변환하기 위함.
 */
public final class JobCatalogFactory {

    private JobCatalogFactory() {
    }

    public static List<JobDefinition> fromConfig(AppConfig.JobsConfig jobs) {
        List<JobDefinition> definitions = new ArrayList<>();
        if (jobs.dailyWeather().enabled()) {
            definitions.add(JobDefinition.of(JobType.DAILY_WEATHER, new DailyAt(parseTime("daily-weather", jobs.dailyWeather().time()))));
        }
        if (jobs.weekendForecast().enabled()) {
            definitions.add(new JobDefinition(JobType.WEEKEND_FORECAST,
                    new DailyAt(parseTime("weekend-forecast", jobs.weekendForecast().time())),
                    parseDays(jobs.weekendForecast().days()),
                    TriggerCondition.NONE));
        }
        if (jobs.typhoonWatch().enabled()) {
            definitions.add(new JobDefinition(JobType.TYPHOON_WATCH,
                    new EveryHourAt(jobs.typhoonWatch().minuteOfHour()),
                    Set.of(),
                    TriggerCondition.ACTIVE_TYPHOON_ADVISORY));
        }
        if (jobs.solarTermReminder().enabled()) {
            definitions.add(new JobDefinition(JobType.SOLAR_TERM_REMINDER,
                    new DailyAt(parseTime("solar-term-reminder", jobs.solarTermReminder().time())),
                    Set.of(),
                    TriggerCondition.SOLAR_TERM_DAY));
        }
        return List.copyOf(definitions);
    }

    static LocalTime parseTime(String job, String value) {
        try {
            return LocalTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalStateException("작업 시각 형식이 올바르지 않습니다: app.jobs." + job + ".time=" + value, e);
        }
    }

    static Set<DayOfWeek> parseDays(List<String> values) {
        EnumSet<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (String value : values) {
            try {
                days.add(DayOfWeek.valueOf(value.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("요일 형식이 올바르지 않습니다: " + value, e);
            }
        }
        return days;
    }
}
