package com.my.weatherbot.adapter.out.health;

import com.my.weatherbot.config.AppConfig;
import com.my.weatherbot.domain.exception.StoreUnavailableException;
import com.my.weatherbot.domain.port.out.SubscriptionStorePort;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class StorageReadinessCheck implements HealthCheck {

    static final String PROBE_SUBSCRIBER_ID = "__readiness_probe__";

    private final SubscriptionStorePort subscriptionStore;
    private final AppConfig appConfig;

    public StorageReadinessCheck(SubscriptionStorePort subscriptionStore, AppConfig appConfig) {
        this.subscriptionStore = subscriptionStore;
        this.appConfig = appConfig;
    }

    @Override
    public HealthCheckResponse call() {
        var builder = HealthCheckResponse.named("storage-readiness")
                .withData("backend", appConfig.storage().backend());
        try {
            subscriptionStore.getSettings(PROBE_SUBSCRIBER_ID);
            return builder.up().build();
        } catch (StoreUnavailableException e) {
            return builder.withData("error", e.getMessage()).down().build();
        }
    }
}
