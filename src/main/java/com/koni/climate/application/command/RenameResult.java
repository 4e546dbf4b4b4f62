package com.koni.climate.application.command;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Result of a device rename. {@code readingsUpdated} is 0 for a registry-only rename.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class RenameResult {

    private String deviceId;
    private String previousName;
    private String name;
    private String location;
    private boolean recursive;
    private int readingsUpdated;
}
