package com.my.weatherbot.adapter.out.persistence;

import com.my.weatherbot.domain.exception.StoreUnavailableException;
import com.my.weatherbot.domain.port.out.TriggerStatePort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.Optional;

@IfBuildProperty(name = "app.storage.backend", stringValue = "sqlite")
@ApplicationScoped
public class SqliteTriggerStateStore implements TriggerStatePort {

    private static final String TABLE_DDL = """
            CREATE TABLE IF NOT EXISTS trigger_state (
                state_key TEXT PRIMARY KEY,
                state_value TEXT NOT NULL,
                updated_at INTEGER NOT NULL
            )
            """;

    private static final String SELECT_SQL = "SELECT state_value FROM trigger_state WHERE state_key = ?";
    private static final String UPSERT_SQL = """
            INSERT INTO trigger_state(state_key, state_value, updated_at) VALUES (?, ?, ?)
            ON CONFLICT(state_key) DO UPDATE SET state_value = excluded.state_value, updated_at = excluded.updated_at
            """;

    private final DataSource dataSource;

    public SqliteTriggerStateStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @PostConstruct
    void init() {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(TABLE_DDL);
        } catch (SQLException e) {
            throw new IllegalStateException("트리거 상태 테이블 초기화 실패", e);
        }
    }

    @Override
    public Optional<String> get(String key) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_SQL)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("트리거 상태 조회 실패: " + key, e);
        }
    }

    @Override
    public void put(String key, String value) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {
            ps.setString(1, key);
            ps.setString(2, value);
            ps.setLong(3, Instant.now().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreUnavailableException("트리거 상태 저장 실패: " + key, e);
        }
    }
}
