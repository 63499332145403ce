package com.my.weatherbot.domain.port.out;

import java.time.OffsetDateTime;
import java.time.ZoneId;

/**
 * 왜: 현재 시각과 서비스 기준 시간대를 주입형으로 분리해 스케줄 판정을 테스트 가능하게 하기 위함.
 */
public interface ClockPort {
    OffsetDateTime now();

    ZoneId zone();
}
