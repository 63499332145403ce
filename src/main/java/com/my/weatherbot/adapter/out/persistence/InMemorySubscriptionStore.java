package com.my.weatherbot.adapter.out.persistence;

import com.my.weatherbot.config.AppConfig;
import com.my.weatherbot.domain.model.JobType;
import com.my.weatherbot.domain.model.Subscriber;
import com.my.weatherbot.domain.port.out.SubscriptionStorePort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@IfBuildProperty(name = "app.storage.backend", stringValue = "memory")
@ApplicationScoped
public class InMemorySubscriptionStore implements SubscriptionStorePort {

    private final String defaultCity;
    private final ConcurrentMap<String, Subscriber> subscribers = new ConcurrentHashMap<>();

    @Inject
    public InMemorySubscriptionStore(AppConfig appConfig) {
        this(appConfig.defaultCity());
    }

    public InMemorySubscriptionStore(String defaultCity) {
        this.defaultCity = defaultCity;
    }

    @Override
    public List<Subscriber> findEligible(JobType jobType) {
        return subscribers.values().stream()
                .filter(subscriber -> subscriber.isEnabled(jobType))
                .sorted(Comparator.comparing(Subscriber::subscriberId))
                .toList();
    }

    @Override
    public Subscriber getSettings(String subscriberId) {
        return subscribers.getOrDefault(subscriberId, Subscriber.newcomer(subscriberId, defaultCity));
    }

    @Override
    public void setJobEnabled(String subscriberId, JobType jobType, boolean enabled) {
        subscribers.compute(subscriberId, (id, current) ->
                (current != null ? current : Subscriber.newcomer(id, defaultCity)).withJob(jobType, enabled));
    }

    @Override
    public void setPreferredCity(String subscriberId, String city) {
        subscribers.compute(subscriberId, (id, current) ->
                (current != null ? current : Subscriber.newcomer(id, defaultCity)).withCity(city));
    }
}
