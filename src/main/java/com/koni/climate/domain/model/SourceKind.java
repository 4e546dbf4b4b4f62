package com.koni.climate.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * Closed set of device ecosystems a reading can originate from.
 * Each kind carries its wire tag (the prefix of every device id it produces),
 * a display name used when inferring device names, and its validation range.
 *
 * Adding a source means adding a constant here, not subclassing.
 */
@Getter
public enum SourceKind {

    MOTION_SENSOR("motion-sensor", "Motion Sensor", RangeClass.INDOOR),
    CLOUD_AIR_QUALITY_MONITOR("cloud-air-quality-monitor", "Air Quality Monitor", RangeClass.INDOOR),
    CLOUD_THERMOSTAT("cloud-thermostat", "Thermostat", RangeClass.INDOOR),
    WEATHER_STATION("weather-station", "Weather Station", RangeClass.OUTDOOR);

    private final String tag;
    private final String displayName;
    private final RangeClass rangeClass;

    SourceKind(String tag, String displayName, RangeClass rangeClass) {
        this.tag = tag;
        this.displayName = displayName;
        this.rangeClass = rangeClass;
    }

    /**
     * Composes the globally unique device id {@code "<tag>:<vendorUniqueId>"}.
     *
     * @param vendorUniqueId the identifier assigned by the vendor
     * @return the composite device id
     */
    public String deviceIdFor(String vendorUniqueId) {
        return tag + ":" + vendorUniqueId;
    }

    @JsonValue
    public String toJson() {
        return tag;
    }

    /**
     * Resolves a kind from its wire tag. The enum constant name is accepted too.
     *
     * @param value the tag, e.g. {@code "cloud-thermostat"}
     * @return the matching kind
     * @throws IllegalArgumentException if no kind matches
     */
    @JsonCreator
    public static SourceKind fromTag(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Source kind cannot be null");
        }
        String candidate = value.trim();
        for (SourceKind kind : values()) {
            if (kind.tag.equalsIgnoreCase(candidate) || kind.name().equalsIgnoreCase(candidate)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown source kind: " + value);
    }
}
