package com.koni.climate.infrastructure.web.controller;

import com.koni.climate.application.command.RenameDeviceCommand;
import com.koni.climate.application.command.RenameDeviceCommandHandler;
import com.koni.climate.application.command.RenameResult;
import com.koni.climate.application.query.DeviceResponse;
import com.koni.climate.application.query.GetDevicesQuery;
import com.koni.climate.application.query.GetDevicesQueryHandler;
import com.koni.climate.domain.model.SourceKind;
import com.koni.climate.infrastructure.web.dto.RenameDeviceRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the device registry.
 *
 * Endpoints:
 * - GET /api/v1/devices: list registered devices, optionally by source kind
 * - PUT /api/v1/devices/{deviceId}/name: rename a device, optionally rewriting its stored readings
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class DeviceController {

    private final GetDevicesQueryHandler queryHandler;
    private final RenameDeviceCommandHandler renameHandler;

    /**
     * Lists registered devices ordered by device id.
     *
     * Example response:
     * [
     *   {
     *     "deviceId": "motion-sensor:00:17:88:01:02:03:04:05-02-0402",
     *     "name": "Hall Motion Sensor",
     *     "location": "Hall",
     *     "sourceKind": "motion-sensor",
     *     "lastSeen": "2026-10-19T08:15:00.250Z",
     *     "active": true
     *   }
     * ]
     *
     * @param sourceKind optional wire tag, e.g. {@code cloud-thermostat}
     * @return 200 OK with the devices (empty list if none are registered)
     */
    @GetMapping("/v1/devices")
    public ResponseEntity<List<DeviceResponse>> getDevices(@RequestParam(required = false) String sourceKind) {
        log.info("Received request to list devices: sourceKind={}", sourceKind);

        SourceKind kind = sourceKind == null || sourceKind.isBlank() ? null : SourceKind.fromTag(sourceKind);
        List<DeviceResponse> devices = queryHandler.handle(new GetDevicesQuery(kind));

        log.info("Returning {} devices", devices.size());
        return ResponseEntity.ok(devices);
    }

    /**
     * Renames a device. With {@code recursive = true} every stored reading of the
     * device gets the new name and the device's current location.
     *
     * @param deviceId the composite device id
     * @param request the new name and the recursive flag
     * @return 200 OK with the rename result, 404 if the device is not registered
     */
    @PutMapping("/v1/devices/{deviceId}/name")
    public ResponseEntity<RenameResult> renameDevice(@PathVariable String deviceId,
                                                     @Valid @RequestBody RenameDeviceRequest request) {
        log.info("Received request to rename device: deviceId={}, name='{}', recursive={}",
                deviceId, request.getName(), request.isRecursive());

        RenameResult result = renameHandler.handle(
                new RenameDeviceCommand(deviceId, request.getName(), request.isRecursive()));

        return ResponseEntity.ok(result);
    }
}
