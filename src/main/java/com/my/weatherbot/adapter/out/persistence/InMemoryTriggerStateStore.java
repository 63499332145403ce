package com.my.weatherbot.adapter.out.persistence;

import com.my.weatherbot.domain.port.out.TriggerStatePort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@IfBuildProperty(name = "app.storage.backend", stringValue = "memory")
@ApplicationScoped
public class InMemoryTriggerStateStore implements TriggerStatePort {

    private final Map<String, String> state = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(state.get(key));
    }

    @Override
    public void put(String key, String value) {
        state.put(key, value);
    }
}
