package com.koni.climate.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * What a collector knows about a device besides its latest payload.
 */
@Getter
@Builder
@AllArgsConstructor
public class DeviceMetadata {

    private final String vendorUniqueId;

    /** Name the vendor app shows for the device, if any. */
    private final String vendorName;

    /** Location the vendor (or collector configuration) assigns, if any. */
    private final String location;

    private final String modelInfo;
}
