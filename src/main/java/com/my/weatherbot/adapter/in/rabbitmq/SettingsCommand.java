package com.my.weatherbot.adapter.in.rabbitmq;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.my.weatherbot.domain.exception.InvalidRequestException;
import com.my.weatherbot.domain.model.JobType;
import com.my.weatherbot.domain.model.Subscriber;
import com.my.weatherbot.domain.port.in.UpdateSubscriptionUseCase;

import java.util.Locale;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SettingsCommand(String commandId,
                              String subscriberId,
                              String action,
                              String jobType,
                              Boolean enabled,
                              String city) {

    public enum Action {
        SET_ENABLED,
        SET_CITY
    }

    public SettingsCommand {
        Objects.requireNonNull(commandId, "commandId");
        Objects.requireNonNull(subscriberId, "subscriberId");
        Objects.requireNonNull(action, "action");
        if (commandId.isBlank() || subscriberId.isBlank() || action.isBlank()) {
            throw new InvalidRequestException("설정 명령 필드가 비어 있습니다.");
        }
    }

    public Action parsedAction() {
        try {
            return Action.valueOf(action.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("알 수 없는 설정 명령입니다: " + action, e);
        }
    }

    public Subscriber applyTo(UpdateSubscriptionUseCase useCase) {
        return switch (parsedAction()) {
            case SET_ENABLED -> {
                JobType type = JobType.parse(jobType)
                        .orElseThrow(() -> new InvalidRequestException("알 수 없는 작업 종류입니다: " + jobType));
                if (enabled == null) {
                    throw new InvalidRequestException("enabled 값이 없습니다.");
                }
                yield useCase.setEnabled(subscriberId, type, enabled);
            }
            case SET_CITY -> useCase.setCity(subscriberId, city);
        };
    }
}
