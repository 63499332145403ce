package com.my.weatherbot.domain.service;

import com.my.weatherbot.domain.exception.ConditionCheckException;
import com.my.weatherbot.domain.exception.StoreUnavailableException;
import com.my.weatherbot.domain.model.FiringEvent;
import com.my.weatherbot.domain.model.JobDefinition;
import com.my.weatherbot.domain.model.JobType;
import com.my.weatherbot.domain.port.in.DetectFiringsUseCase;
import com.my.weatherbot.domain.port.out.TriggerConditionPort;
import com.my.weatherbot.domain.port.out.TriggerStatePort;
import org.jboss.logging.Logger;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 왜: 고정된 작업 정의를 설정 시간대의 달력/시각으로 해석해 분 단위 발화 이벤트로 바꾸기 위함.
 *
 * <p>발화 시각은 분 단위로 절삭하므로 같은 분에 여러 번 호출해도 서로 다른 발화 시각이 나오지 않는다.
 * 태풍 특보는 마지막으로 발화한 특보 ID를 기억해 같은 특보로 다시 발화하지 않는다.
 * 특보 ID는 발송 배치가 발화를 받아들인 뒤 {@link #acknowledge(FiringEvent)}에서 기록한다.</p>
 */
public class JobScheduler implements DetectFiringsUseCase {

    static final String LAST_TYPHOON_ADVISORY_KEY = "last_typhoon_advisory_id";

    private static final Logger log = Logger.getLogger(JobScheduler.class);

    private final List<JobDefinition> definitions;
    private final TriggerConditionPort triggerConditionPort;
    private final TriggerStatePort triggerStatePort;
    private final ZoneId zone;

    public JobScheduler(List<JobDefinition> definitions,
                        TriggerConditionPort triggerConditionPort,
                        TriggerStatePort triggerStatePort,
                        ZoneId zone) {
        this.definitions = List.copyOf(definitions);
        this.triggerConditionPort = Objects.requireNonNull(triggerConditionPort, "triggerConditionPort");
        this.triggerStatePort = Objects.requireNonNull(triggerStatePort, "triggerStatePort");
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    @Override
    public List<FiringEvent> tick(OffsetDateTime now) {
        ZonedDateTime local = now.atZoneSameInstant(zone).truncatedTo(ChronoUnit.MINUTES);
        OffsetDateTime triggerTimestamp = local.toOffsetDateTime();
        List<FiringEvent> events = new ArrayList<>();
        for (JobDefinition definition : definitions) {
            if (!definition.triggerRule().matches(local.toLocalDateTime())
                    || !definition.appliesOn(local.getDayOfWeek())) {
                continue;
            }
            try {
                evaluate(definition, local.toLocalDate(), triggerTimestamp).ifPresent(events::add);
            } catch (ConditionCheckException | StoreUnavailableException e) {
                log.warnf("조건 판정 실패로 이번 틱(%s)의 %s 발화를 건너뜁니다: %s",
                        triggerTimestamp, definition.jobType(), e.getMessage());
            } catch (RuntimeException e) {
                log.errorf(e, "조건 판정 중 예기치 못한 오류로 이번 틱(%s)의 %s 발화를 건너뜁니다.",
                        triggerTimestamp, definition.jobType());
            }
        }
        return events;
    }

    @Override
    public void acknowledge(FiringEvent event) {
        if (event.jobType() != JobType.TYPHOON_WATCH) {
            return;
        }
        event.condition().ifPresent(advisoryId -> {
            triggerStatePort.put(LAST_TYPHOON_ADVISORY_KEY, advisoryId);
            log.infof("태풍 특보 %s 발화를 기록했습니다.", advisoryId);
        });
    }

    private Optional<FiringEvent> evaluate(JobDefinition definition, LocalDate localDate, OffsetDateTime triggerTimestamp) {
        return switch (definition.condition()) {
            case NONE -> Optional.of(new FiringEvent(definition.jobType(), triggerTimestamp));
            case SOLAR_TERM_DAY -> isSolarTermDay(localDate)
                    ? Optional.of(new FiringEvent(definition.jobType(), triggerTimestamp))
                    : Optional.empty();
            case ACTIVE_TYPHOON_ADVISORY -> newTyphoonAdvisory()
                    .map(advisoryId -> new FiringEvent(definition.jobType(), triggerTimestamp, advisoryId));
        };
    }

    private boolean isSolarTermDay(LocalDate localDate) {
        boolean solarTermDay = triggerConditionPort.isSolarTermDay(localDate);
        if (!solarTermDay) {
            log.debugf("%s은 절기일이 아니므로 절기 알림을 건너뜁니다.", localDate);
        }
        return solarTermDay;
    }

    private Optional<String> newTyphoonAdvisory() {
        Optional<String> advisory = triggerConditionPort.activeTyphoonAdvisory();
        if (advisory.isEmpty()) {
            log.debug("유효한 태풍 특보가 없습니다.");
            return Optional.empty();
        }
        String advisoryId = advisory.get();
        boolean alreadyFired = triggerStatePort.get(LAST_TYPHOON_ADVISORY_KEY)
                .filter(advisoryId::equals)
                .isPresent();
        if (alreadyFired) {
            log.debugf("태풍 특보 %s는 이미 발화했습니다.", advisoryId);
            return Optional.empty();
        }
        log.infof("새 태풍 특보 %s를 발견해 발화합니다.", advisoryId);
        return Optional.of(advisoryId);
    }
}
