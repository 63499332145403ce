package com.my.weatherbot.domain.model;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * 왜: 구독자 설정을 고정된 형태로 다뤄 저장소/발송 계층이 같은 계약을 보도록 하기 위함.
 */
public record Subscriber(String subscriberId, String preferredCity, Set<JobType> enabledJobs) {

    public Subscriber {
        Objects.requireNonNull(subscriberId, "subscriberId");
        Objects.requireNonNull(preferredCity, "preferredCity");
        Objects.requireNonNull(enabledJobs, "enabledJobs");
        if (subscriberId.isBlank()) {
            throw new IllegalArgumentException("subscriberId는 비어 있을 수 없습니다.");
        }
        enabledJobs = enabledJobs.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(enabledJobs));
    }

    /**
     * 처음 상호작용한 사용자의 기본 설정. 모든 작업이 꺼져 있다.
     */
    public static Subscriber newcomer(String subscriberId, String defaultCity) {
        return new Subscriber(subscriberId, defaultCity, Set.of());
    }

    public boolean isEnabled(JobType jobType) {
        return enabledJobs.contains(jobType);
    }

    public Subscriber withJob(JobType jobType, boolean enabled) {
        EnumSet<JobType> next = enabledJobs.isEmpty() ? EnumSet.noneOf(JobType.class) : EnumSet.copyOf(enabledJobs);
        if (enabled) {
            next.add(jobType);
        } else {
            next.remove(jobType);
        }
        return new Subscriber(subscriberId, preferredCity, next);
    }

    public Subscriber withCity(String city) {
        return new Subscriber(subscriberId, city, enabledJobs);
    }

    /**
     * 로그와 MDC에 남기는 구독자 ID. 앞 8자만 남긴다.
     */
    public static String shortId(String subscriberId) {
        if (subscriberId == null) {
            return "";
        }
        return subscriberId.length() <= 8 ? subscriberId : subscriberId.substring(0, 8) + "...";
    }
}
