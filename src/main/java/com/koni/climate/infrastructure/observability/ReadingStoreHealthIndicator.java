package com.koni.climate.infrastructure.observability;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;

/**
 * Health indicator for the SQLite reading store.
 *
 * Opens a connection, checks that write-ahead logging is active and counts the
 * stored readings. Returns UP with those details, DOWN if the store cannot be read.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReadingStoreHealthIndicator implements HealthIndicator {

    private static final String EXPECTED_JOURNAL_MODE = "wal";

    private final DataSource dataSource;

    @Override
    public Health health() {
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {

            String journalMode;
            try (ResultSet rs = statement.executeQuery("PRAGMA journal_mode")) {
                journalMode = rs.next() ? rs.getString(1) : "unknown";
            }
            long readings;
            try (ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM readings")) {
                readings = rs.next() ? rs.getLong(1) : 0L;
            }
            String version = connection.getMetaData().getDatabaseProductVersion();

            if (!EXPECTED_JOURNAL_MODE.equalsIgnoreCase(journalMode)) {
                log.warn("Reading store health check: journal mode is {}, expected {}", journalMode,
                        EXPECTED_JOURNAL_MODE);
                return Health.down()
                        .withDetail("error", "JournalModeMismatch")
                        .withDetail("journalMode", journalMode)
                        .withDetail("readings", readings)
                        .build();
            }

            log.debug("Reading store health check passed: version={}, readings={}", version, readings);
            return Health.up()
                    .withDetail("database", "SQLite")
                    .withDetail("version", version)
                    .withDetail("journalMode", journalMode)
                    .withDetail("readings", readings)
                    .build();

        } catch (Exception e) {
            log.error("Reading store health check failed", e);

            return Health.down()
                    .withDetail("error", e.getClass().getSimpleName())
                    .withDetail("message", e.getMessage())
                    .build();
        }
    }
}
