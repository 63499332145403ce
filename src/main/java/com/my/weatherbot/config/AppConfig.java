package com.my.weatherbot.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.List;
import java.util.Optional;

@StaticInitSafe
@ConfigMapping(prefix = "app")
public interface AppConfig {

    @WithDefault("Asia/Taipei")
    String zone();

    @WithName("default-city")
    @WithDefault("臺中市")
    String defaultCity();

    StorageConfig storage();

    LineConfig line();

    ContentConfig content();

    SchedulerConfig scheduler();

    DeliveryConfig delivery();

    JobsConfig jobs();

    interface StorageConfig {
        @WithName("backend")
        @WithDefault("sqlite")
        String backend();

        @WithName("sqlite-path")
        @WithDefault("./data/weather-push.db")
        String sqlitePath();

        @WithName("ledger-retention-hours")
        @WithDefault("72")
        int ledgerRetentionHours();
    }

    interface LineConfig {
        @WithName("channel-access-token")
        Optional<String> channelAccessToken();

        @WithName("api-base")
        @WithDefault("https://api.line.me")
        String apiBase();

        @WithName("connect-timeout-seconds")
        @WithDefault("5")
        int connectTimeoutSeconds();

        @WithName("request-timeout-seconds")
        @WithDefault("10")
        int requestTimeoutSeconds();
    }

    interface ContentConfig {
        @WithName("base-url")
        @WithDefault("http://localhost:8081")
        String baseUrl();

        @WithName("request-timeout-seconds")
        @WithDefault("10")
        int requestTimeoutSeconds();
    }

    interface SchedulerConfig {
        @WithName("tick-interval-seconds")
        @WithDefault("15")
        int tickIntervalSeconds();

        @WithName("catch-up-minutes")
        @WithDefault("5")
        int catchUpMinutes();

        @WithName("dispatch-threads")
        @WithDefault("2")
        int dispatchThreads();

        @WithName("shutdown-grace-seconds")
        @WithDefault("30")
        int shutdownGraceSeconds();
    }

    interface DeliveryConfig {
        @WithName("worker-threads")
        @WithDefault("4")
        int workerThreads();

        @WithName("attempt-deadline-seconds")
        @WithDefault("60")
        int attemptDeadlineSeconds();

        @WithName("content-max-attempts")
        @WithDefault("3")
        int contentMaxAttempts();

        @WithName("content-retry-delay-millis")
        @WithDefault("500")
        long contentRetryDelayMillis();

        @WithName("gateway-max-attempts")
        @WithDefault("3")
        int gatewayMaxAttempts();

        @WithName("gateway-initial-backoff-millis")
        @WithDefault("1000")
        long gatewayInitialBackoffMillis();

        @WithName("gateway-max-backoff-millis")
        @WithDefault("8000")
        long gatewayMaxBackoffMillis();
    }

    interface JobsConfig {
        @WithName("daily-weather")
        TimedJobConfig dailyWeather();

        @WithName("weekend-forecast")
        WeeklyJobConfig weekendForecast();

        @WithName("typhoon-watch")
        HourlyJobConfig typhoonWatch();

        @WithName("solar-term-reminder")
        SolarTermJobConfig solarTermReminder();
    }

    interface TimedJobConfig {
        @WithDefault("true")
        boolean enabled();

        @WithDefault("08:00")
        String time();
    }

    interface WeeklyJobConfig {
        @WithDefault("true")
        boolean enabled();

        @WithDefault("19:00")
        String time();

        @WithDefault("FRIDAY")
        List<String> days();
    }

    interface HourlyJobConfig {
        @WithDefault("true")
        boolean enabled();

        @WithName("minute-of-hour")
        @WithDefault("0")
        int minuteOfHour();
    }

    interface SolarTermJobConfig {
        @WithDefault("true")
        boolean enabled();

        @WithDefault("07:30")
        String time();
    }
}
