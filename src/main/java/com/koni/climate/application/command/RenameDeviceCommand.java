package com.koni.climate.application.command;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Command to give a registered device a new display name.
 */
@Getter
@AllArgsConstructor
public class RenameDeviceCommand {

    private final String deviceId;
    private final String name;

    /**
     * Also rewrite the name and location on every stored reading of the device.
     */
    private final boolean recursive;
}
