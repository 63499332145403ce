package com.my.weatherbot.adapter.out.clock;

import com.my.weatherbot.domain.port.out.ClockPort;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneId;

/**
 * 왜: 서비스 기준 시간대의 현재 시각을 한 곳에서 제공해 스케줄 판정과 마감 시각 계산이 같은 시계를 쓰도록 하기 위함.
 */
public class OffsetClockAdapter implements ClockPort {

    private final Clock clock;

    private OffsetClockAdapter(Clock clock) {
        this.clock = clock;
    }

    public static OffsetClockAdapter system(ZoneId zoneId) {
        return new OffsetClockAdapter(Clock.system(zoneId));
    }

    public static OffsetClockAdapter of(Clock clock) {
        return new OffsetClockAdapter(clock);
    }

    @Override
    public OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    @Override
    public ZoneId zone() {
        return clock.getZone();
    }
}
