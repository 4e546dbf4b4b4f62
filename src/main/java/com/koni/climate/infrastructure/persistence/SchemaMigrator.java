package com.koni.climate.infrastructure.persistence;

import com.koni.climate.domain.exception.SchemaMigrationException;
import com.koni.climate.domain.exception.StorageException;
import com.koni.climate.infrastructure.resilience.ErrorClassifier;
import com.koni.climate.infrastructure.resilience.RetryPolicy;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Creates the readings table and brings it up to the current column set at start-up.
 *
 * The base table holds only the columns every row has always had; each secondary
 * field is an additive, nullable column listed in {@link #OPTIONAL_COLUMNS}.
 * Missing columns are added with {@code ALTER TABLE}, so rows written under an
 * older schema simply read back null for them.
 *
 * The whole check-and-alter runs in one IMMEDIATE transaction, so two collectors
 * starting together cannot both try to add the same column.
 */
@Slf4j
@RequiredArgsConstructor
public class SchemaMigrator {

    static final String TABLE = "readings";

    private static final String CREATE_BASE_TABLE = "CREATE TABLE IF NOT EXISTS " + TABLE + " ("
            + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
            + "timestamp TEXT NOT NULL, "
            + "device_id TEXT NOT NULL, "
            + "temperature_celsius REAL NOT NULL, "
            + "location TEXT NOT NULL, "
            + "source_kind TEXT NOT NULL)";

    static final List<ColumnDefinition> OPTIONAL_COLUMNS = List.of(
            new ColumnDefinition("device_name", "TEXT"),
            new ColumnDefinition("is_anomalous", "INTEGER NOT NULL DEFAULT 0"),
            new ColumnDefinition("humidity_percent",
                    "REAL CHECK(humidity_percent IS NULL OR (humidity_percent >= 0 AND humidity_percent <= 100))"),
            new ColumnDefinition("battery_level",
                    "INTEGER CHECK(battery_level IS NULL OR (battery_level >= 0 AND battery_level <= 100))"),
            new ColumnDefinition("signal_strength",
                    "INTEGER CHECK(signal_strength IS NULL OR (signal_strength >= 0 AND signal_strength <= 100))"),
            new ColumnDefinition("pm25_ugm3", "REAL CHECK(pm25_ugm3 IS NULL OR pm25_ugm3 >= 0)"),
            new ColumnDefinition("voc_ppb", "REAL CHECK(voc_ppb IS NULL OR voc_ppb >= 0)"),
            new ColumnDefinition("co_ppm", "REAL CHECK(co_ppm IS NULL OR co_ppm >= 0)"),
            new ColumnDefinition("co2_ppm", "REAL CHECK(co2_ppm IS NULL OR co2_ppm >= 0)"),
            new ColumnDefinition("iaq_score",
                    "REAL CHECK(iaq_score IS NULL OR (iaq_score >= 0 AND iaq_score <= 100))"),
            new ColumnDefinition("thermostat_mode", "TEXT"),
            new ColumnDefinition("thermostat_state", "TEXT"),
            new ColumnDefinition("vendor_updated_at", "TEXT"),
            new ColumnDefinition("raw_response", "TEXT"),
            new ColumnDefinition("inserted_at", "TEXT")
    );

    private static final List<String> INDEXES = List.of(
            "CREATE UNIQUE INDEX IF NOT EXISTS idx_readings_device_timestamp ON " + TABLE + "(device_id, timestamp)",
            "CREATE INDEX IF NOT EXISTS idx_readings_timestamp ON " + TABLE + "(timestamp)",
            "CREATE INDEX IF NOT EXISTS idx_readings_device_id ON " + TABLE + "(device_id)",
            "CREATE INDEX IF NOT EXISTS idx_readings_inserted_at ON " + TABLE + "(inserted_at)",
            "CREATE INDEX IF NOT EXISTS idx_readings_anomalous ON " + TABLE + "(is_anomalous) WHERE is_anomalous = 1"
    );

    private final DataSource dataSource;
    private final RetryPolicy retryPolicy;

    /**
     * Applies pending schema changes.
     *
     * @return names of the columns added by this run (empty when already current)
     * @throws SchemaMigrationException if the schema cannot be brought up to date
     */
    public List<String> migrate() {
        try {
            List<String> added = retryPolicy.execute("schema-migration", this::migrateOnce, ErrorClassifier.storage());
            if (added.isEmpty()) {
                log.info("Reading store schema is current");
            } else {
                log.info("Reading store schema migrated, added columns: {}", added);
            }
            return added;
        } catch (StorageException e) {
            log.error("Schema migration failed, refusing to continue", e);
            throw new SchemaMigrationException("Schema migration failed: " + e.getMessage(), e);
        }
    }

    private List<String> migrateOnce() {
        try (Connection connection = dataSource.getConnection()) {
            connection.setAutoCommit(false);
            try (Statement statement = connection.createStatement()) {
                statement.execute(CREATE_BASE_TABLE);

                Set<String> existing = existingColumns(connection);
                List<String> added = new ArrayList<>();
                for (ColumnDefinition column : OPTIONAL_COLUMNS) {
                    if (!existing.contains(column.getName())) {
                        statement.execute("ALTER TABLE " + TABLE + " ADD COLUMN "
                                + column.getName() + " " + column.getDefinition());
                        added.add(column.getName());
                    }
                }
                for (String index : INDEXES) {
                    statement.execute(index);
                }
                connection.commit();
                return added;
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw SqliteErrors.translate("migrate schema", e);
        }
    }

    private Set<String> existingColumns(Connection connection) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery("PRAGMA table_info(" + TABLE + ")")) {
            while (rs.next()) {
                columns.add(rs.getString("name"));
            }
        }
        return columns;
    }

    @Getter
    @RequiredArgsConstructor
    static final class ColumnDefinition {
        private final String name;
        private final String definition;
    }
}
