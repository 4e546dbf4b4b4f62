package com.koni.climate.application.command;

import com.fasterxml.jackson.databind.JsonNode;
import com.koni.climate.domain.model.DeviceMetadata;
import com.koni.climate.domain.model.SourceKind;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Command to record one raw reading fetched by a collector.
 * This command represents the intent to normalize, validate and persist a vendor payload.
 */
@Getter
@AllArgsConstructor
public class RecordReadingCommand {

    /**
     * The ecosystem the payload came from.
     */
    private final SourceKind sourceKind;

    /**
     * The vendor payload as fetched, in one of the shapes {@code ReadingNormalizer} understands.
     */
    private final JsonNode payload;

    /**
     * Identity and placement of the device as known to the collector.
     */
    private final DeviceMetadata metadata;
}
