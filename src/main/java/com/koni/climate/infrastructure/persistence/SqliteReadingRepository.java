package com.koni.climate.infrastructure.persistence;

import com.koni.climate.domain.model.InsertOutcome;
import com.koni.climate.domain.model.Reading;
import com.koni.climate.domain.model.ReadingQuery;
import com.koni.climate.domain.repository.ReadingRepository;
import com.koni.climate.domain.repository.ReadingSequence;
import com.koni.climate.infrastructure.resilience.ErrorClassifier;
import com.koni.climate.infrastructure.resilience.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * SQLite adapter for ReadingRepository.
 *
 * Every operation opens its own connection, runs in its own transaction and closes
 * the connection before returning. Lock contention surfaces as
 * {@link com.koni.climate.domain.exception.StoreBusyException} and is retried by the
 * {@link RetryPolicy}; all other failures propagate as
 * {@link com.koni.climate.domain.exception.StorageException} after one attempt.
 */
@Slf4j
public class SqliteReadingRepository implements ReadingRepository {

    private static final String REWRITE_SQL = "UPDATE " + SchemaMigrator.TABLE
            + " SET device_name = ?, location = COALESCE(?, location) WHERE device_id = ?";

    private final DataSource dataSource;
    private final RetryPolicy retryPolicy;
    private final int pageSize;

    public SqliteReadingRepository(DataSource dataSource, RetryPolicy retryPolicy, int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be positive, was " + pageSize);
        }
        this.dataSource = dataSource;
        this.retryPolicy = retryPolicy;
        this.pageSize = pageSize;
    }

    @Override
    public InsertOutcome insert(Reading reading) {
        if (reading == null) {
            throw new IllegalArgumentException("Reading cannot be null");
        }
        return retryPolicy.execute("insert reading", () -> insertOnce(reading), ErrorClassifier.storage());
    }

    private InsertOutcome insertOnce(Reading reading) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = connection.prepareStatement(ReadingRowMapper.INSERT_SQL)) {
            ReadingRowMapper.bindInsert(ps, reading);
            ps.executeUpdate();
            log.debug("Stored reading: deviceId={}, timestamp={}", reading.getDeviceId(), reading.getTimestamp());
            return InsertOutcome.INSERTED;
        } catch (SQLException e) {
            if (SqliteErrors.isUniqueViolation(e)) {
                log.debug("Duplicate reading skipped: deviceId={}, timestamp={}",
                        reading.getDeviceId(), reading.getTimestamp());
                return InsertOutcome.DUPLICATE_SKIPPED;
            }
            throw SqliteErrors.translate("insert reading for " + reading.getDeviceId(), e);
        }
    }

    @Override
    public ReadingSequence query(ReadingQuery query) {
        return new PagedReadingSequence(dataSource, retryPolicy, query == null ? ReadingQuery.all() : query, pageSize);
    }

    @Override
    public long count(ReadingQuery query) {
        ReadingFilter filter = ReadingFilter.of(query == null ? ReadingQuery.all() : query);
        String sql = "SELECT COUNT(*) FROM " + SchemaMigrator.TABLE + filter.whereClause();
        return retryPolicy.execute("count readings", () -> countOnce(sql, filter.parameters()),
                ErrorClassifier.storage());
    }

    private long countOnce(String sql, List<Object> params) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.size(); i++) {
                ps.setObject(i + 1, params.get(i));
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw SqliteErrors.translate("count readings", e);
        }
    }

    @Override
    public int rewriteDisplayFields(String deviceId, String deviceName, String location) {
        if (deviceId == null || deviceName == null) {
            throw new IllegalArgumentException("DeviceId and deviceName cannot be null");
        }
        int updated = retryPolicy.execute("rewrite display fields",
                () -> rewriteOnce(deviceId, deviceName, location), ErrorClassifier.storage());
        log.info("Rewrote display fields of {} readings: deviceId={}, name={}", updated, deviceId, deviceName);
        return updated;
    }

    private int rewriteOnce(String deviceId, String deviceName, String location) {
        try (Connection connection = dataSource.getConnection()) {
            connection.setAutoCommit(false);
            try (PreparedStatement ps = connection.prepareStatement(REWRITE_SQL)) {
                ps.setString(1, deviceName);
                ps.setString(2, location);
                ps.setString(3, deviceId);
                int updated = ps.executeUpdate();
                connection.commit();
                return updated;
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw SqliteErrors.translate("rewrite readings of " + deviceId, e);
        }
    }
}
