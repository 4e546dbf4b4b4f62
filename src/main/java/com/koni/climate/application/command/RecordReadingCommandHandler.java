package com.koni.climate.application.command;

import com.koni.climate.application.ingest.ReadingNormalizer;
import com.koni.climate.application.ingest.ReadingValidator;
import com.koni.climate.application.ingest.ValidationResult;
import com.koni.climate.domain.exception.DeviceRegistryException;
import com.koni.climate.domain.exception.MalformedPayloadException;
import com.koni.climate.domain.exception.StorageException;
import com.koni.climate.domain.exception.ValidationException;
import com.koni.climate.domain.model.InsertOutcome;
import com.koni.climate.domain.model.Reading;
import com.koni.climate.domain.model.RegistryEntry;
import com.koni.climate.domain.repository.DeviceRegistry;
import com.koni.climate.domain.repository.ReadingRepository;
import com.koni.climate.infrastructure.observability.IngestionMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Command handler for recording readings.
 * This handler implements the write side of the CQRS pattern.
 *
 * Responsibilities:
 * - Normalize the vendor payload into a canonical reading
 * - Validate it and flag anomalies
 * - Resolve the display name through the device registry, registering new devices
 * - Persist the reading (idempotent on device and timestamp)
 *
 * A failing reading never throws to the collector; the outcome is reported
 * through {@link IngestionResult} so the cycle can move on to the next device.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecordReadingCommandHandler {

    static final String MDC_DEVICE_ID = "deviceId";

    private final ReadingNormalizer normalizer;
    private final ReadingValidator validator;
    private final DeviceRegistry deviceRegistry;
    private final ReadingRepository readingRepository;
    private final IngestionMetrics metrics;

    /**
     * Handles the RecordReadingCommand.
     *
     * @param command the raw reading to record
     * @return the outcome for this reading
     */
    public IngestionResult handle(RecordReadingCommand command) {
        return metrics.recordIngestTime(() -> {
            metrics.recordReceived();
            try {
                return ingest(command);
            } finally {
                MDC.remove(MDC_DEVICE_ID);
            }
        });
    }

    private IngestionResult ingest(RecordReadingCommand command) {
        String provisionalId = provisionalDeviceId(command);
        if (provisionalId != null) {
            MDC.put(MDC_DEVICE_ID, provisionalId);
        }

        // 1. Normalize and validate
        ValidationResult validation;
        try {
            Reading normalized = normalizer.normalize(command.getPayload(), command.getSourceKind(), command.getMetadata());
            validation = validator.validate(normalized);
        } catch (MalformedPayloadException | ValidationException e) {
            log.warn("Reading rejected: deviceId={}, reason={}", provisionalId, e.getMessage());
            metrics.recordRejected();
            return IngestionResult.rejected(provisionalId, e.getMessage());
        }

        // 2. Resolve display name and location through the registry
        Reading reading = applyRegistry(validation.getReading(), command);

        // 3. Persist
        InsertOutcome outcome;
        try {
            outcome = readingRepository.insert(reading);
        } catch (StorageException e) {
            log.error("Failed to store reading: deviceId={}, timestamp={}, error={}",
                    reading.getDeviceId(), reading.getTimestamp(), e.getMessage());
            metrics.recordFailed();
            return IngestionResult.failed(reading, e.getMessage());
        }

        if (outcome == InsertOutcome.DUPLICATE_SKIPPED) {
            log.debug("Duplicate reading skipped: deviceId={}, timestamp={}",
                    reading.getDeviceId(), reading.getTimestamp());
            metrics.recordDuplicate();
            return IngestionResult.duplicate(reading);
        }

        metrics.recordInserted();
        if (reading.isAnomalous()) {
            metrics.recordAnomaly();
        }
        log.info("Reading stored: deviceId={}, name='{}', value={}C, anomalous={}",
                reading.getDeviceId(), reading.getDeviceName(), reading.getValueCelsius(), reading.isAnomalous());
        return IngestionResult.inserted(reading, validation.getErrors());
    }

    private Reading applyRegistry(Reading reading, RecordReadingCommand command) {
        String modelInfo = command.getMetadata() == null ? null : command.getMetadata().getModelInfo();
        try {
            RegistryEntry entry = deviceRegistry.resolveOrRegister(reading.getDeviceId(), reading.getDeviceName(),
                    reading.getLocation(), reading.getSourceKind(), modelInfo);
            Reading.ReadingBuilder builder = reading.toBuilder();
            if (entry.getName() != null && !entry.getName().isBlank()) {
                builder.deviceName(entry.getName());
            }
            if (entry.getLocation() != null && !entry.getLocation().isBlank()) {
                builder.location(entry.getLocation());
            }
            return builder.build();
        } catch (DeviceRegistryException e) {
            log.warn("Device registry unavailable, storing with inferred name: deviceId={}, name='{}', error={}",
                    reading.getDeviceId(), reading.getDeviceName(), e.getMessage());
            return reading;
        }
    }

    private static String provisionalDeviceId(RecordReadingCommand command) {
        if (command.getSourceKind() == null || command.getMetadata() == null
                || command.getMetadata().getVendorUniqueId() == null) {
            return null;
        }
        return command.getSourceKind().deviceIdFor(command.getMetadata().getVendorUniqueId().trim());
    }
}
