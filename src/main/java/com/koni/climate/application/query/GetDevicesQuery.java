package com.koni.climate.application.query;

import com.koni.climate.domain.model.SourceKind;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Query to list registered devices, optionally restricted to one source kind.
 */
@Getter
@AllArgsConstructor
public class GetDevicesQuery {

    /** Only devices of this kind, or null for all devices. */
    private final SourceKind sourceKind;

    public static GetDevicesQuery all() {
        return new GetDevicesQuery(null);
    }
}
