package com.my.weatherbot.adapter.out.persistence;

import com.my.weatherbot.config.AppConfig;
import com.my.weatherbot.domain.model.DedupKey;
import com.my.weatherbot.domain.port.out.DeliveryLedgerPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 왜: 로컬 실행과 테스트에서 파일 없이도 같은 원자적 기록 계약을 쓰기 위함. 재시작하면 기록이 사라진다.
 */
@IfBuildProperty(name = "app.storage.backend", stringValue = "memory")
@ApplicationScoped
public class InMemoryDeliveryLedger implements DeliveryLedgerPort {

    private final Duration retention;
    private final Map<DedupKey, Instant> delivered = new ConcurrentHashMap<>();

    @Inject
    public InMemoryDeliveryLedger(AppConfig appConfig) {
        this(Duration.ofHours(appConfig.storage().ledgerRetentionHours()));
    }

    public InMemoryDeliveryLedger(Duration retention) {
        this.retention = retention;
    }

    @Override
    public boolean isDelivered(DedupKey key) {
        return delivered.containsKey(key);
    }

    @Override
    public boolean markIfAbsent(DedupKey key) {
        cleanup();
        return delivered.putIfAbsent(key, Instant.now()) == null;
    }

    public int size() {
        return delivered.size();
    }

    private void cleanup() {
        Instant cutoff = Instant.now().minus(retention);
        delivered.entrySet().removeIf(entry -> entry.getValue().isBefore(cutoff));
    }
}
