package com.my.weatherbot.domain.port.out;

import com.my.weatherbot.domain.model.JobType;
import com.my.weatherbot.domain.model.Subscriber;

import java.util.List;

/**
 * 왜: 구독 설정 저장 방식(SQLite, 메모리)을 도메인에서 분리하고 쓰기 직후 읽기 일관성을 계약으로 고정하기 위함.
 * 모든 메서드는 저장소 접근 실패 시 StoreUnavailableException을 던진다.
 */
public interface SubscriptionStorePort {

    List<Subscriber> findEligible(JobType jobType);

    /**
     * 기록이 없는 구독자는 기본 도시, 모든 작업 꺼짐 상태로 돌려준다.
     */
    Subscriber getSettings(String subscriberId);

    void setJobEnabled(String subscriberId, JobType jobType, boolean enabled);

    void setPreferredCity(String subscriberId, String city);
}
