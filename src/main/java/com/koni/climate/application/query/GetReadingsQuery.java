package com.koni.climate.application.query;

import com.koni.climate.domain.model.SourceKind;
import lombok.Builder;
import lombok.Getter;

import java.time.OffsetDateTime;

/**
 * Query for stored readings. All filters are optional.
 */
@Getter
@Builder
public class GetReadingsQuery {

    private final String deviceId;
    private final SourceKind sourceKind;

    /** Inclusive. */
    private final OffsetDateTime from;

    /** Exclusive. */
    private final OffsetDateTime to;

    private final boolean anomalousOnly;

    /** Maximum number of readings; the handler applies a default and a cap. */
    private final Integer limit;
}
