package com.my.weatherbot.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.weatherbot.domain.exception.InvalidRequestException;
import com.my.weatherbot.domain.exception.StoreUnavailableException;
import com.my.weatherbot.domain.model.JobType;
import com.my.weatherbot.domain.model.Subscriber;
import com.my.weatherbot.domain.port.in.UpdateSubscriptionUseCase;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SettingsCommandConsumerTest {

    private UpdateSubscriptionUseCase useCase;
    private SettingsCommandConsumer consumer;

    @BeforeEach
    void setUp() {
        useCase = mock(UpdateSubscriptionUseCase.class);
        consumer = new SettingsCommandConsumer(useCase, new ObjectMapper());
    }

    @Test
    void appliesValidCommand() {
        when(useCase.setEnabled("U1", JobType.DAILY_WEATHER, true))
                .thenReturn(new Subscriber("U1", "臺中市", Set.of(JobType.DAILY_WEATHER)));

        consumer.consume(Message.of("{\"commandId\":\"c1\",\"subscriberId\":\"U1\",\"action\":\"SET_ENABLED\"," +
                "\"jobType\":\"DAILY_WEATHER\",\"enabled\":true}")).await().indefinitely();

        verify(useCase).setEnabled("U1", JobType.DAILY_WEATHER, true);
    }

    @Test
    void dropsMalformedPayload() {
        consumer.consume(Message.of("not json")).await().indefinitely();

        verifyNoInteractions(useCase);
    }

    @Test
    void dropsCommandRejectedByValidation() {
        when(useCase.setCity("U1", " ")).thenThrow(new InvalidRequestException("도시 이름이 비어 있습니다."));

        consumer.consume(Message.of("{\"commandId\":\"c2\",\"subscriberId\":\"U1\",\"action\":\"SET_CITY\",\"city\":\" \"}"))
                .await().indefinitely();

        verify(useCase).setCity("U1", " ");
    }

    @Test
    void storeFailurePropagatesSoMessageIsNacked() {
        when(useCase.setCity(anyString(), anyString())).thenThrow(new StoreUnavailableException("locked", null));

        assertThatThrownBy(() -> consumer.consume(Message.of(
                "{\"commandId\":\"c3\",\"subscriberId\":\"U1\",\"action\":\"SET_CITY\",\"city\":\"臺北市\"}"))
                .await().indefinitely())
                .isInstanceOf(StoreUnavailableException.class);
    }
}
