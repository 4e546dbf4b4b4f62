package com.koni.climate.infrastructure.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Request body for renaming a device.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class RenameDeviceRequest {

    @NotBlank(message = "name is required")
    @Size(max = 200, message = "name must be at most 200 characters")
    private String name;

    /**
     * Also rewrite the name on every stored reading of the device.
     */
    private boolean recursive;
}
