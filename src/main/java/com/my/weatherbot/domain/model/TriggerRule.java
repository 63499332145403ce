package com.my.weatherbot.domain.model;

import java.time.LocalDateTime;

/**
 * 왜: 시각 기반 트리거를 설정된 시간대의 분 단위 시각 하나로 판정하기 위함.
 */
public interface TriggerRule {

    /**
     * @param localMinute 설정 시간대 기준, 분 단위로 절삭된 현재 시각
     */
    boolean matches(LocalDateTime localMinute);
}
