package com.my.weatherbot.config;

import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 왜: 구독 설정, 발송 원장, 트리거 상태가 재시작 후에도 남도록 하나의 파일 기반 SQLite를 공유하기 위함.
 */
@IfBuildProperty(name = "app.storage.backend", stringValue = "sqlite")
@ApplicationScoped
public class SqliteDataSourceProducer {

    private static final int BUSY_TIMEOUT_MILLIS = 5000;

    @Produces
    @ApplicationScoped
    public DataSource dataSource(AppConfig appConfig) {
        Path sqlitePath = Path.of(appConfig.storage().sqlitePath());
        try {
            Path parent = sqlitePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new IllegalStateException("SQLite 경로 생성 실패", e);
        }
        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(BUSY_TIMEOUT_MILLIS);
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + sqlitePath.toAbsolutePath());
        return dataSource;
    }
}
