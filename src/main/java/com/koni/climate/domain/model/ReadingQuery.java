package com.koni.climate.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.time.OffsetDateTime;

/**
 * Filters for read-back queries. Every filter is optional; results are always
 * ordered by timestamp, then insertion id.
 */
@Getter
@Builder
public class ReadingQuery {

    private final String deviceId;
    private final SourceKind sourceKind;

    /** Inclusive lower bound. */
    private final OffsetDateTime from;

    /** Exclusive upper bound. */
    private final OffsetDateTime to;

    private final boolean anomalousOnly;

    /** Maximum number of readings to yield, or null for no limit. */
    private final Integer limit;

    public static ReadingQuery all() {
        return ReadingQuery.builder().build();
    }

    public static ReadingQuery forDevice(String deviceId) {
        return ReadingQuery.builder().deviceId(deviceId).build();
    }
}
