package com.koni.climate.infrastructure.registry;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Root of the registry file. Top-level keys other than {@code devices}
 * (the {@code _comment} header, or anything a user added) are kept as they are
 * and written back unchanged.
 */
@Getter
@Setter
class RegistryDocument {

    static final String COMMENT_KEY = "_comment";

    static final String DEFAULT_COMMENT = String.join("\n",
            "Device Registry - custom device names",
            "",
            "Maps device ids to human-readable names. Names are inferred from",
            "location and device kind on first sighting and may be edited here;",
            "edits take effect on the next reading.",
            "",
            "Format:",
            "  <source-kind>:<vendor-id>:",
            "    name: Custom Name",
            "    location: Location Name",
            "    source_kind: motion-sensor|cloud-air-quality-monitor|cloud-thermostat|weather-station",
            "    model_info: optional model information",
            "    first_seen: ISO-8601 timestamp (UTC when no offset is given)",
            "    last_seen: ISO-8601 timestamp (UTC when no offset is given)",
            "");

    private final Map<String, Object> extras = new LinkedHashMap<>();

    private TreeMap<String, RegistryRecord> devices = new TreeMap<>();

    public void setDevices(TreeMap<String, RegistryRecord> devices) {
        this.devices = devices == null ? new TreeMap<>() : devices;
    }

    @JsonAnyGetter
    public Map<String, Object> getExtras() {
        return extras;
    }

    @JsonAnySetter
    public void putExtra(String key, Object value) {
        extras.put(key, value);
    }
}
