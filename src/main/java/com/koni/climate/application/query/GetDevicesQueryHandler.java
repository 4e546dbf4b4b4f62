package com.koni.climate.application.query;

import com.koni.climate.domain.repository.DeviceRegistry;
import com.koni.climate.infrastructure.config.ClimateProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Query handler for listing registered devices.
 * This handler implements the read side of the CQRS pattern.
 *
 * Responsibilities:
 * - Read the registry entries, ordered by device id
 * - Derive the active flag from the staleness window
 * - Map entries to DeviceResponse DTOs
 */
@Service
@Slf4j
public class GetDevicesQueryHandler {

    private final DeviceRegistry deviceRegistry;
    private final Clock clock;
    private final Duration stalenessWindow;

    public GetDevicesQueryHandler(DeviceRegistry deviceRegistry, Clock clock, ClimateProperties properties) {
        this.deviceRegistry = deviceRegistry;
        this.clock = clock;
        this.stalenessWindow = properties.getRegistry().getStalenessWindow();
    }

    /**
     * Handles the GetDevicesQuery.
     * Returns an empty list if no devices are registered, which is a valid state.
     *
     * @param query the optional source kind filter
     * @return the matching devices
     */
    public List<DeviceResponse> handle(GetDevicesQuery query) {
        log.debug("Handling GetDevicesQuery: sourceKind={}", query.getSourceKind());
        OffsetDateTime now = OffsetDateTime.now(clock);

        List<DeviceResponse> devices = deviceRegistry.list(query.getSourceKind()).stream()
                .map(entry -> new DeviceResponse(
                        entry.getDeviceId(),
                        entry.getName(),
                        entry.getLocation(),
                        entry.getSourceKind(),
                        entry.getModelInfo(),
                        entry.getFirstSeen(),
                        entry.getLastSeen(),
                        entry.isActive(now, stalenessWindow)
                ))
                .collect(Collectors.toList());

        log.info("Retrieved {} devices", devices.size());
        return devices;
    }
}
