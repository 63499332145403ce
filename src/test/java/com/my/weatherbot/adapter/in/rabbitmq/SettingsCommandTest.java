package com.my.weatherbot.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.my.weatherbot.domain.exception.InvalidRequestException;
import com.my.weatherbot.domain.model.JobType;
import com.my.weatherbot.domain.port.in.UpdateSubscriptionUseCase;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class SettingsCommandTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void setEnabledAcceptsStoredFeatureId() throws Exception {
        SettingsCommand command = objectMapper.readValue("{" +
                "\"commandId\":\"cmd-1\"," +
                "\"subscriberId\":\"U1\"," +
                "\"action\":\"set_enabled\"," +
                "\"jobType\":\"typhoon_notification_push\"," +
                "\"enabled\":true" +
                "}", SettingsCommand.class);
        UpdateSubscriptionUseCase useCase = mock(UpdateSubscriptionUseCase.class);

        command.applyTo(useCase);

        assertThat(command.parsedAction()).isEqualTo(SettingsCommand.Action.SET_ENABLED);
        verify(useCase).setEnabled("U1", JobType.TYPHOON_WATCH, true);
    }

    @Test
    void setCityDelegatesRawCity() throws Exception {
        SettingsCommand command = objectMapper.readValue(
                "{\"commandId\":\"cmd-2\",\"subscriberId\":\"U1\",\"action\":\"SET_CITY\",\"city\":\"台南市\"}",
                SettingsCommand.class);
        UpdateSubscriptionUseCase useCase = mock(UpdateSubscriptionUseCase.class);

        command.applyTo(useCase);

        verify(useCase).setCity("U1", "台南市");
    }

    @Test
    void rejectsMissingFields() {
        assertThrows(ValueInstantiationException.class, () -> objectMapper.readValue(
                "{\"subscriberId\":\"U1\",\"action\":\"SET_CITY\"}", SettingsCommand.class));
    }

    @Test
    void rejectsUnknownActionOrJob() {
        UpdateSubscriptionUseCase useCase = mock(UpdateSubscriptionUseCase.class);

        assertThatThrownBy(() -> new SettingsCommand("c", "U1", "DELETE", null, null, null).applyTo(useCase))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> new SettingsCommand("c", "U1", "SET_ENABLED", "earthquake", true, null).applyTo(useCase))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> new SettingsCommand("c", "U1", "SET_ENABLED", "DAILY_WEATHER", null, null).applyTo(useCase))
                .isInstanceOf(InvalidRequestException.class);
        verifyNoInteractions(useCase);
    }
}
