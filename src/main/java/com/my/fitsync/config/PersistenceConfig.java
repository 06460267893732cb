package com.my.fitsync.config;

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
 * 왜: 단일 프로세스 배포에서도 재시작 후 자격 증명이 남도록 파일 기반 SQLite 데이터소스를 한곳에서 만들기 위함.
 */
@ApplicationScoped
public class PersistenceConfig {

    static final int BUSY_TIMEOUT_MILLIS = 5000;

    @Produces
    @ApplicationScoped
    @IfBuildProperty(name = "app.credential.backend", stringValue = "sqlite")
    public DataSource credentialDataSource(AppConfig appConfig) {
        return sqliteDataSource(Path.of(appConfig.credential().sqlitePath()));
    }

    public static DataSource sqliteDataSource(Path sqlitePath) {
        try {
            Path parent = sqlitePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new IllegalStateException("SQLite 경로 생성 실패: " + sqlitePath, e);
        }
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setBusyTimeout(BUSY_TIMEOUT_MILLIS);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + sqlitePath.toAbsolutePath());
        return dataSource;
    }
}
