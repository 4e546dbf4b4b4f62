package com.koni.climate.application.query;

import com.koni.climate.domain.model.SourceKind;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Data Transfer Object representing a registered device.
 * {@code active} is derived from {@code lastSeen} at query time.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class DeviceResponse {

    private String deviceId;
    private String name;
    private String location;
    private SourceKind sourceKind;
    private String modelInfo;
    private OffsetDateTime firstSeen;
    private OffsetDateTime lastSeen;
    private boolean active;
}
