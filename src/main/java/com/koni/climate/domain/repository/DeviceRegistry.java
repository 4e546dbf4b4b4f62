package com.koni.climate.domain.repository;

import com.koni.climate.domain.model.RegistryEntry;
import com.koni.climate.domain.model.SourceKind;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for device identities.
 * The registry exclusively owns name and location resolution; readings only keep
 * a denormalized copy taken at insertion time.
 *
 * Readings are joined to entries by the shared device id string, never by a
 * foreign key, so a device may be stored before it is registered.
 */
public interface DeviceRegistry {

    /**
     * Finds the entry for a device.
     *
     * @param deviceId the composite device id
     * @return the entry, or empty if the device was never registered
     */
    Optional<RegistryEntry> findById(String deviceId);

    /**
     * Returns the existing entry (updating its lastSeen) or atomically creates one
     * with the inferred name. Concurrent first sightings of the same device resolve
     * to exactly one entry; the loser of the race gets the winner's entry back.
     *
     * @param deviceId the composite device id
     * @param inferredName the name to use if the device is new
     * @param location the location resolved for the current reading
     * @param sourceKind the ecosystem the device belongs to
     * @param modelInfo optional model description
     * @return the registry entry after the update
     */
    RegistryEntry resolveOrRegister(String deviceId, String inferredName, String location,
                                    SourceKind sourceKind, String modelInfo);

    /**
     * Renames a registered device. Idempotent; readings are untouched.
     *
     * @param deviceId the composite device id
     * @param name the new display name
     * @return the updated entry
     * @throws com.koni.climate.domain.exception.DeviceNotFoundException if the device is not registered
     */
    RegistryEntry setName(String deviceId, String name);

    /**
     * Lists registered devices ordered by device id.
     *
     * @param sourceKind only return devices of this kind, or null for all devices
     * @return the matching entries, possibly empty
     */
    List<RegistryEntry> list(SourceKind sourceKind);
}
