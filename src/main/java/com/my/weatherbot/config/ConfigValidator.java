package com.my.weatherbot.config;

import io.quarkus.runtime.Startup;
import io.quarkus.runtime.configuration.ConfigUtils;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.net.URI;
import java.time.DateTimeException;
import java.time.ZoneId;

@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        boolean isProd = ConfigUtils.isProfileActive("prod");
        validateRequired("LINE_CHANNEL_ACCESS_TOKEN", appConfig.line().channelAccessToken().orElse(null), isProd);
        validateZone(appConfig.zone());
        validateUrl("app.content.base-url", appConfig.content().baseUrl(), isProd);
        // 시각/요일 형식 오류는 여기서 바로 드러나도록 한 번 변환해 본다.
        JobCatalogFactory.fromConfig(appConfig.jobs());
        validatePositive("app.delivery.worker-threads", appConfig.delivery().workerThreads());
        validatePositive("app.scheduler.tick-interval-seconds", appConfig.scheduler().tickIntervalSeconds());
    }

    private void validateRequired(String name, String value, boolean strict) {
        if (value == null || value.isBlank()) {
            String message = "필수 설정이 비어 있습니다: " + name;
            if (strict) {
                throw new IllegalStateException(message);
            }
            log.warn(message);
        }
    }

    private void validateZone(String zone) {
        try {
            ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new IllegalStateException("시간대 설정이 올바르지 않습니다: app.zone=" + zone, e);
        }
    }

    private void validateUrl(String name, String url, boolean strict) {
        try {
            URI uri = URI.create(url);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("scheme/host 없음");
            }
        } catch (IllegalArgumentException e) {
            String message = "URL 형식이 올바르지 않습니다: " + name + "=" + url;
            if (strict) {
                throw new IllegalStateException(message, e);
            }
            log.warn(message);
        }
    }

    private void validatePositive(String name, int value) {
        if (value < 1) {
            throw new IllegalStateException("1 이상이어야 합니다: " + name + "=" + value);
        }
    }
}
