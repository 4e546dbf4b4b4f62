package com.koni.climate.infrastructure.registry;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.koni.climate.domain.model.RegistryEntry;
import com.koni.climate.domain.model.SourceKind;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * One device as it appears under {@code devices:} in the registry file.
 * Property names are snake_case because people edit this file by hand.
 * Timestamps and the source kind are read leniently; see the deserializers.
 */
@Getter
@Setter
@NoArgsConstructor
class RegistryRecord {

    private String name;
    private String location;

    @JsonProperty("source_kind")
    @JsonDeserialize(using = LenientSourceKindDeserializer.class)
    private SourceKind sourceKind;

    @JsonProperty("model_info")
    private String modelInfo;

    @JsonProperty("first_seen")
    @JsonDeserialize(using = LenientTimestampDeserializer.class)
    private OffsetDateTime firstSeen;

    @JsonProperty("last_seen")
    @JsonDeserialize(using = LenientTimestampDeserializer.class)
    private OffsetDateTime lastSeen;

    RegistryEntry toEntry(String deviceId) {
        return new RegistryEntry(deviceId, name, location, sourceKind, modelInfo, firstSeen, lastSeen);
    }
}
