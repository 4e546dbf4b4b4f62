package com.koni.climate.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Persistent identity record for one physical device: the stable, human editable
 * name and location behind a volatile vendor identifier.
 */
@Getter
@AllArgsConstructor
public class RegistryEntry {

    private final String deviceId;
    private final String name;
    private final String location;
    private final SourceKind sourceKind;
    private final String modelInfo;
    private final OffsetDateTime firstSeen;
    private final OffsetDateTime lastSeen;

    /**
     * A device is active when it has reported within the staleness window.
     * This is derived on demand and never stored.
     *
     * @param now the reference time
     * @param stalenessWindow how long a device may stay silent and still count as active
     * @return true if {@code lastSeen} falls within the window
     */
    public boolean isActive(OffsetDateTime now, Duration stalenessWindow) {
        return lastSeen != null && !lastSeen.isBefore(now.minus(stalenessWindow));
    }

    @Override
    public String toString() {
        return "RegistryEntry{" +
                "deviceId=" + deviceId +
                ", name=" + name +
                ", location=" + location +
                ", sourceKind=" + sourceKind +
                ", lastSeen=" + lastSeen +
                '}';
    }
}
