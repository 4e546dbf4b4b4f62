package com.koni.climate.application.command;

import com.koni.climate.domain.model.Reading;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * What happened to one reading, returned to the collector.
 */
@Getter
@AllArgsConstructor
public class IngestionResult {

    private final IngestionStatus status;

    /** The composite device id, when the payload got far enough to have one. */
    private final String deviceId;

    /** The reading as stored (or as it would have been stored), null when rejected before normalization. */
    private final Reading reading;

    /** Validation errors for cleared secondary fields, or the failure message. */
    private final List<String> messages;

    static IngestionResult inserted(Reading reading, List<String> warnings) {
        return new IngestionResult(IngestionStatus.INSERTED, reading.getDeviceId(), reading, warnings);
    }

    static IngestionResult duplicate(Reading reading) {
        return new IngestionResult(IngestionStatus.DUPLICATE, reading.getDeviceId(), reading, List.of());
    }

    static IngestionResult rejected(String deviceId, String reason) {
        return new IngestionResult(IngestionStatus.REJECTED, deviceId, null, List.of(String.valueOf(reason)));
    }

    static IngestionResult failed(Reading reading, String reason) {
        return new IngestionResult(IngestionStatus.FAILED, reading.getDeviceId(), reading, List.of(String.valueOf(reason)));
    }
}
