package com.my.weatherbot.adapter.out.persistence;

import com.my.weatherbot.config.AppConfig;
import com.my.weatherbot.domain.exception.StoreUnavailableException;
import com.my.weatherbot.domain.model.JobType;
import com.my.weatherbot.domain.model.Subscriber;
import com.my.weatherbot.domain.port.out.SubscriptionStorePort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 왜: 구독 설정을 발송 계층과 설정 변경 계층이 같은 파일 DB에서 읽고 써서 변경이 다음 발송에 바로 보이도록 하기 위함.
 */
@IfBuildProperty(name = "app.storage.backend", stringValue = "sqlite")
@ApplicationScoped
public class SqliteSubscriptionStore implements SubscriptionStorePort {

    private static final Logger log = Logger.getLogger(SqliteSubscriptionStore.class);

    private static final String SUBSCRIBERS_DDL = """
            CREATE TABLE IF NOT EXISTS subscribers (
                subscriber_id TEXT PRIMARY KEY,
                preferred_city TEXT NOT NULL,
                updated_at INTEGER NOT NULL
            )
            """;

    private static final String SUBSCRIBER_JOBS_DDL = """
            CREATE TABLE IF NOT EXISTS subscriber_jobs (
                subscriber_id TEXT NOT NULL,
                job_type TEXT NOT NULL,
                PRIMARY KEY (subscriber_id, job_type)
            )
            """;

    private static final String JOB_INDEX_DDL = "CREATE INDEX IF NOT EXISTS idx_subscriber_jobs_job ON subscriber_jobs(job_type)";

    private static final String ELIGIBLE_SQL = """
            SELECT s.subscriber_id, s.preferred_city, j.job_type
            FROM subscribers s
            JOIN subscriber_jobs j ON j.subscriber_id = s.subscriber_id
            WHERE s.subscriber_id IN (SELECT subscriber_id FROM subscriber_jobs WHERE job_type = ?)
            ORDER BY s.subscriber_id
            """;

    private static final String SELECT_SUBSCRIBER_SQL = "SELECT preferred_city FROM subscribers WHERE subscriber_id = ?";
    private static final String SELECT_JOBS_SQL = "SELECT job_type FROM subscriber_jobs WHERE subscriber_id = ?";
    private static final String ENSURE_SUBSCRIBER_SQL =
            "INSERT OR IGNORE INTO subscribers(subscriber_id, preferred_city, updated_at) VALUES (?, ?, ?)";
    private static final String UPSERT_CITY_SQL = """
            INSERT INTO subscribers(subscriber_id, preferred_city, updated_at) VALUES (?, ?, ?)
            ON CONFLICT(subscriber_id) DO UPDATE SET preferred_city = excluded.preferred_city, updated_at = excluded.updated_at
            """;
    private static final String TOUCH_SQL = "UPDATE subscribers SET updated_at = ? WHERE subscriber_id = ?";
    private static final String ENABLE_JOB_SQL = "INSERT OR IGNORE INTO subscriber_jobs(subscriber_id, job_type) VALUES (?, ?)";
    private static final String DISABLE_JOB_SQL = "DELETE FROM subscriber_jobs WHERE subscriber_id = ? AND job_type = ?";

    private final DataSource dataSource;
    private final String defaultCity;

    @Inject
    public SqliteSubscriptionStore(DataSource dataSource, AppConfig appConfig) {
        this(dataSource, appConfig.defaultCity());
    }

    SqliteSubscriptionStore(DataSource dataSource, String defaultCity) {
        this.dataSource = dataSource;
        this.defaultCity = defaultCity;
    }

    @PostConstruct
    void init() {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(SUBSCRIBERS_DDL);
            stmt.execute(SUBSCRIBER_JOBS_DDL);
            stmt.execute(JOB_INDEX_DDL);
        } catch (SQLException e) {
            throw new IllegalStateException("구독 테이블 초기화 실패", e);
        }
    }

    @Override
    public List<Subscriber> findEligible(JobType jobType) {
        Map<String, String> cities = new LinkedHashMap<>();
        Map<String, EnumSet<JobType>> jobs = new LinkedHashMap<>();
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(ELIGIBLE_SQL)) {
            ps.setString(1, jobType.name());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String subscriberId = rs.getString(1);
                    cities.putIfAbsent(subscriberId, rs.getString(2));
                    EnumSet<JobType> enabled = jobs.computeIfAbsent(subscriberId, id -> EnumSet.noneOf(JobType.class));
                    toJobType(subscriberId, rs.getString(3)).ifPresent(enabled::add);
                }
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("구독자 목록 조회 실패", e);
        }
        List<Subscriber> eligible = new ArrayList<>(cities.size());
        cities.forEach((id, city) -> eligible.add(new Subscriber(id, city, jobs.get(id))));
        return eligible;
    }

    @Override
    public Subscriber getSettings(String subscriberId) {
        try (Connection conn = dataSource.getConnection()) {
            String city;
            try (PreparedStatement ps = conn.prepareStatement(SELECT_SUBSCRIBER_SQL)) {
                ps.setString(1, subscriberId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Subscriber.newcomer(subscriberId, defaultCity);
                    }
                    city = rs.getString(1);
                }
            }
            EnumSet<JobType> enabled = EnumSet.noneOf(JobType.class);
            try (PreparedStatement ps = conn.prepareStatement(SELECT_JOBS_SQL)) {
                ps.setString(1, subscriberId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        toJobType(subscriberId, rs.getString(1)).ifPresent(enabled::add);
                    }
                }
            }
            return new Subscriber(subscriberId, city, enabled);
        } catch (SQLException e) {
            throw new StoreUnavailableException("구독 설정 조회 실패", e);
        }
    }

    @Override
    public void setJobEnabled(String subscriberId, JobType jobType, boolean enabled) {
        long now = Instant.now().toEpochMilli();
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement ps = conn.prepareStatement(ENSURE_SUBSCRIBER_SQL)) {
                    ps.setString(1, subscriberId);
                    ps.setString(2, defaultCity);
                    ps.setLong(3, now);
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement(enabled ? ENABLE_JOB_SQL : DISABLE_JOB_SQL)) {
                    ps.setString(1, subscriberId);
                    ps.setString(2, jobType.name());
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement(TOUCH_SQL)) {
                    ps.setLong(1, now);
                    ps.setString(2, subscriberId);
                    ps.executeUpdate();
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("구독 작업 설정 저장 실패", e);
        }
    }

    @Override
    public void setPreferredCity(String subscriberId, String city) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(UPSERT_CITY_SQL)) {
            ps.setString(1, subscriberId);
            ps.setString(2, city);
            ps.setLong(3, Instant.now().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreUnavailableException("기본 도시 저장 실패", e);
        }
    }

    private static Optional<JobType> toJobType(String subscriberId, String value) {
        try {
            return Optional.of(JobType.valueOf(value));
        } catch (IllegalArgumentException e) {
            log.warnf("구독자 %s의 알 수 없는 작업 종류 %s를 무시합니다.", subscriberId, value);
            return Optional.empty();
        }
    }
}
