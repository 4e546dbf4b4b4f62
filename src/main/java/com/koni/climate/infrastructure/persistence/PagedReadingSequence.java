package com.koni.climate.infrastructure.persistence;

import com.koni.climate.domain.model.Reading;
import com.koni.climate.domain.model.ReadingQuery;
import com.koni.climate.domain.repository.ReadingSequence;
import com.koni.climate.infrastructure.resilience.ErrorClassifier;
import com.koni.climate.infrastructure.resilience.RetryPolicy;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Reads matching rows page by page using keyset pagination on (timestamp, id).
 *
 * No connection is held between pages: each page is fetched with its own short-lived
 * connection, so a slow consumer never blocks writers or checkpoints. Rows inserted
 * behind the cursor while iterating are not seen by the current pass.
 */
class PagedReadingSequence implements ReadingSequence {

    private final DataSource dataSource;
    private final RetryPolicy retryPolicy;
    private final ReadingQuery query;
    private final int pageSize;

    PagedReadingSequence(DataSource dataSource, RetryPolicy retryPolicy, ReadingQuery query, int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be positive, was " + pageSize);
        }
        this.dataSource = dataSource;
        this.retryPolicy = retryPolicy;
        this.query = query;
        this.pageSize = pageSize;
    }

    @Override
    public Iterator<Reading> iterator() {
        return new PageIterator();
    }

    private List<Reading> fetchPage(Reading after, int size) {
        ReadingFilter filter = ReadingFilter.of(query);
        String where = filter.whereClause();
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(SchemaMigrator.TABLE).append(where);
        List<Object> params = new ArrayList<>(filter.parameters());
        if (after != null) {
            sql.append(where.isEmpty() ? " WHERE " : " AND ")
                    .append("(timestamp > ? OR (timestamp = ? AND id > ?))");
            String cursor = TimestampCodec.format(after.getTimestamp());
            params.add(cursor);
            params.add(cursor);
            params.add(after.getId());
        }
        sql.append(" ORDER BY timestamp, id LIMIT ?");
        params.add(size);

        return retryPolicy.execute("query readings", () -> readPage(sql.toString(), params),
                ErrorClassifier.storage());
    }

    private List<Reading> readPage(String sql, List<Object> params) {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.size(); i++) {
                ps.setObject(i + 1, params.get(i));
            }
            List<Reading> page = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    page.add(ReadingRowMapper.map(rs));
                }
            }
            return page;
        } catch (SQLException e) {
            throw SqliteErrors.translate("query readings", e);
        }
    }

    private class PageIterator implements Iterator<Reading> {

        private final Deque<Reading> buffer = new ArrayDeque<>();
        private Reading last;
        private int yielded;
        private boolean exhausted;

        @Override
        public boolean hasNext() {
            if (!buffer.isEmpty()) {
                return true;
            }
            if (exhausted) {
                return false;
            }
            int size = nextPageSize();
            if (size == 0) {
                exhausted = true;
                return false;
            }
            List<Reading> page = fetchPage(last, size);
            if (page.size() < size) {
                exhausted = true;
            }
            buffer.addAll(page);
            return !buffer.isEmpty();
        }

        @Override
        public Reading next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            last = buffer.poll();
            yielded++;
            return last;
        }

        private int nextPageSize() {
            if (query.getLimit() == null) {
                return pageSize;
            }
            return Math.max(0, Math.min(pageSize, query.getLimit() - yielded - buffer.size()));
        }
    }
}
