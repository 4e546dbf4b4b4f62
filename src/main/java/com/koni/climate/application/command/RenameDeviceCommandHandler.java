package com.koni.climate.application.command;

import com.koni.climate.domain.exception.DeviceNotFoundException;
import com.koni.climate.domain.exception.ValidationException;
import com.koni.climate.domain.model.RegistryEntry;
import com.koni.climate.domain.repository.DeviceRegistry;
import com.koni.climate.domain.repository.ReadingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Command handler for renaming devices.
 *
 * A plain rename only changes the registry; stored readings keep the name they
 * were written with. A recursive rename additionally rewrites the device name and
 * location of every historical reading of the device in one store transaction.
 * The registry is updated first; a failed rewrite leaves the readings on the old
 * name and is repaired by repeating the recursive rename.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RenameDeviceCommandHandler {

    private final DeviceRegistry deviceRegistry;
    private final ReadingRepository readingRepository;

    /**
     * Handles the RenameDeviceCommand.
     *
     * @param command the rename to apply
     * @return the new name and, for recursive renames, the number of readings rewritten
     * @throws ValidationException if the device id or name is blank
     * @throws DeviceNotFoundException if the device is not registered
     */
    public RenameResult handle(RenameDeviceCommand command) {
        if (command.getDeviceId() == null || command.getDeviceId().isBlank()) {
            throw new ValidationException("deviceId is required");
        }
        if (command.getName() == null || command.getName().isBlank()) {
            throw new ValidationException("name is required");
        }
        log.debug("Handling RenameDeviceCommand: deviceId={}, name='{}', recursive={}",
                command.getDeviceId(), command.getName(), command.isRecursive());

        String previousName = deviceRegistry.findById(command.getDeviceId())
                .map(RegistryEntry::getName)
                .orElseThrow(() -> new DeviceNotFoundException("Device not found: " + command.getDeviceId()));

        RegistryEntry entry = deviceRegistry.setName(command.getDeviceId(), command.getName());

        int updated = 0;
        if (command.isRecursive()) {
            updated = rewriteReadings(entry, previousName);
            log.info("Renamed device and {} historical readings: deviceId={}, '{}' -> '{}'",
                    updated, entry.getDeviceId(), previousName, entry.getName());
        } else {
            log.info("Renamed device: deviceId={}, '{}' -> '{}'", entry.getDeviceId(), previousName, entry.getName());
        }

        return new RenameResult(entry.getDeviceId(), previousName, entry.getName(), entry.getLocation(),
                command.isRecursive(), updated);
    }

    /**
     * The registry already carries the new name at this point. If the store rewrite
     * fails the readings keep their old name until the same recursive rename is run
     * again; the rewrite is idempotent, so a repeat repairs them.
     */
    private int rewriteReadings(RegistryEntry entry, String previousName) {
        try {
            return readingRepository.rewriteDisplayFields(entry.getDeviceId(), entry.getName(), entry.getLocation());
        } catch (RuntimeException e) {
            log.error("Registry renamed but stored readings were not rewritten: deviceId={}, '{}' -> '{}'. "
                            + "Repeat the recursive rename to update them. Cause: {}: {}",
                    entry.getDeviceId(), previousName, entry.getName(),
                    e.getClass().getSimpleName(), e.getMessage());
            throw e;
        }
    }
}
