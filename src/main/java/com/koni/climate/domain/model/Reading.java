package com.koni.climate.domain.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * Canonical measurement record produced by the normalizer and committed by the store.
 * Immutable: derived copies are made with {@link #toBuilder()}.
 *
 * Identity is the pair (deviceId, timestamp), mirroring the store's unique index.
 */
@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode(of = {"deviceId", "timestamp"})
public class Reading {

    /** Store-assigned surrogate id, null until read back from the store. */
    private final Long id;

    /** When the value was measured, on the collecting system's clock (UTC). */
    private final OffsetDateTime timestamp;

    private final String deviceId;
    private final BigDecimal valueCelsius;
    private final String location;
    private final String deviceName;
    private final SourceKind sourceKind;

    /** Set by the validator only. */
    private final boolean anomalous;

    private final Double humidityPercent;
    private final Integer batteryLevel;
    private final Integer signalStrength;
    private final Double pm25;
    private final Double vocPpb;
    private final Double coPpm;
    private final Double co2Ppm;
    private final Double airQualityIndex;
    private final String thermostatMode;
    private final String thermostatState;

    /** The vendor's own "last updated" stamp. Advisory only. */
    private final OffsetDateTime vendorUpdatedAt;

    private final String rawPayload;

    /** Store-assigned insertion stamp; null for rows written before the column existed. */
    private final OffsetDateTime insertedAt;

    @Override
    public String toString() {
        return "Reading{" +
                "deviceId=" + deviceId +
                ", timestamp=" + timestamp +
                ", valueCelsius=" + valueCelsius +
                ", location=" + location +
                ", sourceKind=" + sourceKind +
                ", anomalous=" + anomalous +
                '}';
    }
}
