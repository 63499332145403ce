package com.my.weatherbot.adapter.out.health;

import com.my.weatherbot.config.AppConfig;
import com.my.weatherbot.domain.exception.StoreUnavailableException;
import com.my.weatherbot.domain.model.Subscriber;
import com.my.weatherbot.domain.port.out.SubscriptionStorePort;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StorageReadinessCheckTest {

    private SubscriptionStorePort store;
    private StorageReadinessCheck check;

    @BeforeEach
    void setUp() {
        store = mock(SubscriptionStorePort.class);
        AppConfig appConfig = mock(AppConfig.class, RETURNS_DEEP_STUBS);
        when(appConfig.storage().backend()).thenReturn("sqlite");
        check = new StorageReadinessCheck(store, appConfig);
    }

    @Test
    void upWhenStoreAnswers() {
        when(store.getSettings(StorageReadinessCheck.PROBE_SUBSCRIBER_ID))
                .thenReturn(Subscriber.newcomer(StorageReadinessCheck.PROBE_SUBSCRIBER_ID, "臺中市"));

        assertThat(check.call().getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
    }

    @Test
    void downWhenStoreUnavailable() {
        when(store.getSettings(StorageReadinessCheck.PROBE_SUBSCRIBER_ID))
                .thenThrow(new StoreUnavailableException("locked", null));

        HealthCheckResponse response = check.call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
        assertThat(response.getData()).hasValueSatisfying(data -> assertThat(data).containsKey("error"));
    }
}
