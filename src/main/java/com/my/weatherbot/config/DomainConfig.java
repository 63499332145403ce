package com.my.weatherbot.config;

import com.my.weatherbot.adapter.in.scheduler.DeliveryWorkerPool;
import com.my.weatherbot.adapter.out.clock.OffsetClockAdapter;
import com.my.weatherbot.domain.port.in.DetectFiringsUseCase;
import com.my.weatherbot.domain.port.in.DispatchNotificationUseCase;
import com.my.weatherbot.domain.port.in.UpdateSubscriptionUseCase;
import com.my.weatherbot.domain.port.out.ClockPort;
import com.my.weatherbot.domain.port.out.ContentProviderPort;
import com.my.weatherbot.domain.port.out.DeliveryGatewayPort;
import com.my.weatherbot.domain.port.out.DeliveryLedgerPort;
import com.my.weatherbot.domain.port.out.OperatorAlertPort;
import com.my.weatherbot.domain.port.out.SubscriptionStorePort;
import com.my.weatherbot.domain.port.out.TriggerConditionPort;
import com.my.weatherbot.domain.port.out.TriggerStatePort;
import com.my.weatherbot.domain.service.DeliveryCoordinator;
import com.my.weatherbot.domain.service.DeliveryPolicy;
import com.my.weatherbot.domain.service.JobScheduler;
import com.my.weatherbot.domain.service.RetryPolicy;
import com.my.weatherbot.domain.service.SubscriptionSettingsService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import java.time.Duration;
import java.time.ZoneId;

/**
 * 왜: 도메인 서비스와 포트 구현을 명시적으로 연결하여 헥사고날 구조를 보장하기 위함.
 */
@ApplicationScoped
public class DomainConfig {

    @Produces
    @ApplicationScoped
    public ClockPort clockPort(AppConfig appConfig) {
        return OffsetClockAdapter.system(ZoneId.of(appConfig.zone()));
    }

    @Produces
    @ApplicationScoped
    public DetectFiringsUseCase detectFiringsUseCase(AppConfig appConfig,
                                                     TriggerConditionPort triggerConditionPort,
                                                     TriggerStatePort triggerStatePort) {
        return new JobScheduler(JobCatalogFactory.fromConfig(appConfig.jobs()),
                triggerConditionPort,
                triggerStatePort,
                ZoneId.of(appConfig.zone()));
    }

    @Produces
    @ApplicationScoped
    public DispatchNotificationUseCase dispatchNotificationUseCase(AppConfig appConfig,
                                                                   SubscriptionStorePort subscriptionStorePort,
                                                                   ContentProviderPort contentProviderPort,
                                                                   DeliveryGatewayPort deliveryGatewayPort,
                                                                   DeliveryLedgerPort deliveryLedgerPort,
                                                                   OperatorAlertPort operatorAlertPort,
                                                                   ClockPort clockPort,
                                                                   DeliveryWorkerPool workerPool) {
        return new DeliveryCoordinator(subscriptionStorePort,
                contentProviderPort,
                deliveryGatewayPort,
                deliveryLedgerPort,
                operatorAlertPort,
                clockPort,
                deliveryPolicy(appConfig.delivery()),
                workerPool.workers());
    }

    @Produces
    @ApplicationScoped
    public UpdateSubscriptionUseCase updateSubscriptionUseCase(SubscriptionStorePort subscriptionStorePort) {
        return new SubscriptionSettingsService(subscriptionStorePort);
    }

    static DeliveryPolicy deliveryPolicy(AppConfig.DeliveryConfig delivery) {
        return new DeliveryPolicy(
                RetryPolicy.fixed(delivery.contentMaxAttempts(), Duration.ofMillis(delivery.contentRetryDelayMillis())),
                RetryPolicy.exponential(delivery.gatewayMaxAttempts(),
                        Duration.ofMillis(delivery.gatewayInitialBackoffMillis()),
                        Duration.ofMillis(delivery.gatewayMaxBackoffMillis())),
                Duration.ofSeconds(delivery.attemptDeadlineSeconds()));
    }
}
