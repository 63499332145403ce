package com.my.weatherbot.domain.port.out;

import java.time.LocalDate;
import java.util.Optional;

/**
 * 왜: 조건형 작업의 발화 여부를 콘텐츠 제공자 경계에서 판정받기 위함.
 * 판정 실패 시 ConditionCheckException을 던진다.
 */
public interface TriggerConditionPort {

    /**
     * @return 현재 유효한 태풍 특보 ID, 없으면 empty
     */
    Optional<String> activeTyphoonAdvisory();

    boolean isSolarTermDay(LocalDate date);
}
