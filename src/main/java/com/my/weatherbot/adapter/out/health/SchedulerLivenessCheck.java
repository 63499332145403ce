package com.my.weatherbot.adapter.out.health;

import com.my.weatherbot.adapter.in.scheduler.NotificationTickLoop;
import com.my.weatherbot.domain.port.out.ClockPort;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * 왜: 틱 루프가 멈추면 발송이 조용히 끊기므로, 최근 틱 시각으로 살아 있음을 판단하기 위함.
 */
@Liveness
@ApplicationScoped
public class SchedulerLivenessCheck implements HealthCheck {

    private static final int STALE_TICK_MULTIPLIER = 4;

    private final NotificationTickLoop tickLoop;
    private final ClockPort clockPort;

    public SchedulerLivenessCheck(NotificationTickLoop tickLoop, ClockPort clockPort) {
        this.tickLoop = tickLoop;
        this.clockPort = clockPort;
    }

    @Override
    public HealthCheckResponse call() {
        OffsetDateTime lastTickAt = tickLoop.lastTickAt();
        Duration staleAfter = Duration.ofSeconds((long) tickLoop.tickIntervalSeconds() * STALE_TICK_MULTIPLIER);
        boolean recent = lastTickAt != null
                && !lastTickAt.plus(staleAfter).isBefore(clockPort.now());
        return HealthCheckResponse.named("notification-scheduler")
                .withData("running", tickLoop.isRunning())
                .withData("lastTickAt", lastTickAt == null ? "never" : lastTickAt.toString())
                .status(tickLoop.isRunning() && recent)
                .build();
    }
}
