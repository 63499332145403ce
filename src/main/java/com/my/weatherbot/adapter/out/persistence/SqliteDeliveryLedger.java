package com.my.weatherbot.adapter.out.persistence;

import com.my.weatherbot.config.AppConfig;
import com.my.weatherbot.domain.exception.StoreUnavailableException;
import com.my.weatherbot.domain.model.DedupKey;
import com.my.weatherbot.domain.port.out.DeliveryLedgerPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 왜: 재시작 후에도 같은 발화에 두 번 기록하지 않도록 (구독자, 작업, 발화 시각)을 기본 키로 둔 원장을 파일 DB에 남기기 위함.
 */
@IfBuildProperty(name = "app.storage.backend", stringValue = "sqlite")
@ApplicationScoped
public class SqliteDeliveryLedger implements DeliveryLedgerPort {

    private static final Logger log = Logger.getLogger(SqliteDeliveryLedger.class);

    private static final String TABLE_DDL = """
            CREATE TABLE IF NOT EXISTS delivery_ledger (
                subscriber_id TEXT NOT NULL,
                job_type TEXT NOT NULL,
                trigger_at INTEGER NOT NULL,
                delivered_at INTEGER NOT NULL,
                PRIMARY KEY (subscriber_id, job_type, trigger_at)
            )
            """;

    private static final String INSERT_SQL =
            "INSERT OR IGNORE INTO delivery_ledger(subscriber_id, job_type, trigger_at, delivered_at) VALUES (?, ?, ?, ?)";
    private static final String SELECT_SQL =
            "SELECT 1 FROM delivery_ledger WHERE subscriber_id = ? AND job_type = ? AND trigger_at = ?";
    private static final String CLEANUP_SQL = "DELETE FROM delivery_ledger WHERE delivered_at < ?";
    private static final long CLEANUP_INTERVAL_MILLIS = Duration.ofHours(1).toMillis();

    private final DataSource dataSource;
    private final Duration retention;
    private final AtomicLong lastCleanupMillis = new AtomicLong();

    @Inject
    public SqliteDeliveryLedger(DataSource dataSource, AppConfig appConfig) {
        this(dataSource, Duration.ofHours(appConfig.storage().ledgerRetentionHours()));
    }

    SqliteDeliveryLedger(DataSource dataSource, Duration retention) {
        this.dataSource = dataSource;
        this.retention = retention;
    }

    @PostConstruct
    void init() {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(TABLE_DDL);
        } catch (SQLException e) {
            throw new IllegalStateException("발송 원장 테이블 초기화 실패", e);
        }
        lastCleanupMillis.set(System.currentTimeMillis());
        cleanup();
    }

    @Override
    public boolean isDelivered(DedupKey key) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_SQL)) {
            bindKey(ps, key);
            return ps.executeQuery().next();
        } catch (SQLException e) {
            throw new StoreUnavailableException("발송 원장 조회 실패", e);
        }
    }

    @Override
    public boolean markIfAbsent(DedupKey key) {
        cleanupIfDue();
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
            bindKey(ps, key);
            ps.setLong(4, Instant.now().toEpochMilli());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreUnavailableException("발송 원장 기록 실패", e);
        }
    }

    /**
     * 보존 기간이 지난 기록을 지운다. 발화 시각이 그보다 오래된 이벤트는 다시 발송되지 않는다.
     */
    public int cleanup() {
        Instant cutoff = Instant.now().minus(retention);
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(CLEANUP_SQL)) {
            ps.setLong(1, cutoff.toEpochMilli());
            int removed = ps.executeUpdate();
            if (removed > 0) {
                log.infof("보존 기간이 지난 발송 기록 %d건을 정리했습니다.", removed);
            }
            return removed;
        } catch (SQLException e) {
            throw new StoreUnavailableException("발송 원장 정리 실패", e);
        }
    }

    private void cleanupIfDue() {
        long now = System.currentTimeMillis();
        long last = lastCleanupMillis.get();
        if (now - last >= CLEANUP_INTERVAL_MILLIS && lastCleanupMillis.compareAndSet(last, now)) {
            cleanup();
        }
    }

    private static void bindKey(PreparedStatement ps, DedupKey key) throws SQLException {
        ps.setString(1, key.subscriberId());
        ps.setString(2, key.jobType().name());
        ps.setLong(3, key.triggerEpochSecond());
    }
}
