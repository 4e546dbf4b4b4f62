package com.koni.climate.infrastructure.persistence;

import com.koni.climate.domain.model.ReadingQuery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * WHERE clause and bind parameters for the optional filters of a {@link ReadingQuery}.
 */
final class ReadingFilter {

    private final List<String> conditions;
    private final List<Object> parameters;

    private ReadingFilter(List<String> conditions, List<Object> parameters) {
        this.conditions = conditions;
        this.parameters = parameters;
    }

    static ReadingFilter of(ReadingQuery query) {
        List<String> conditions = new ArrayList<>();
        List<Object> parameters = new ArrayList<>();
        if (query.getDeviceId() != null) {
            conditions.add("device_id = ?");
            parameters.add(query.getDeviceId());
        }
        if (query.getSourceKind() != null) {
            conditions.add("source_kind = ?");
            parameters.add(query.getSourceKind().getTag());
        }
        if (query.getFrom() != null) {
            conditions.add("timestamp >= ?");
            parameters.add(TimestampCodec.format(query.getFrom()));
        }
        if (query.getTo() != null) {
            conditions.add("timestamp < ?");
            parameters.add(TimestampCodec.format(query.getTo()));
        }
        if (query.isAnomalousOnly()) {
            conditions.add("is_anomalous = 1");
        }
        return new ReadingFilter(conditions, parameters);
    }

    /**
     * @return the clause with a leading space, or an empty string when nothing is filtered
     */
    String whereClause() {
        return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    }

    List<Object> parameters() {
        return Collections.unmodifiableList(parameters);
    }
}
