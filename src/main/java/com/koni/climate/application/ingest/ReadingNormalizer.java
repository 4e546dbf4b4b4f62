package com.koni.climate.application.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.koni.climate.domain.exception.DeviceRegistryException;
import com.koni.climate.domain.exception.MalformedPayloadException;
import com.koni.climate.domain.model.DeviceMetadata;
import com.koni.climate.domain.model.DeviceNames;
import com.koni.climate.domain.model.Reading;
import com.koni.climate.domain.model.RegistryEntry;
import com.koni.climate.domain.model.SourceKind;
import com.koni.climate.domain.repository.DeviceRegistry;
import com.koni.climate.infrastructure.config.ClimateProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns one vendor payload into a canonical {@link Reading}.
 *
 * Payload shapes:
 * <ul>
 *   <li>motion-sensor: {@code {"state": {"temperature": 2134, "lastupdated": ...},
 *       "config": {"battery": 87, "reachable": true}}}, temperature in hundredths of a degree</li>
 *   <li>cloud-air-quality-monitor: {@code {"temperature": {"value": 71.6, "scale": "FAHRENHEIT"},
 *       "humidity", "pm25", "voc", "co", "co2", "iaq", "connectivity", "lastUpdated"}}</li>
 *   <li>cloud-thermostat: {@code {"temperature": {...}, "humidity", "mode", "hvacState",
 *       "connectivity", "lastUpdated"}}</li>
 *   <li>weather-station: {@code {"temperature": {...}, "humidity"}}</li>
 * </ul>
 *
 * The timestamp comes from the collecting system's clock, never from the vendor.
 * Missing secondary fields stay null.
 */
@Slf4j
@Component
public class ReadingNormalizer {

    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final BigDecimal THIRTY_TWO = new BigDecimal("32");
    private static final BigDecimal FIVE = new BigDecimal("5");
    private static final BigDecimal NINE = new BigDecimal("9");
    private static final int SCALE = 2;
    private static final Pattern OFFSET_SUFFIX = Pattern.compile("[+-]\\d{2}:\\d{2}$");

    private final DeviceRegistry deviceRegistry;
    private final Clock clock;
    private final boolean storeRawPayload;

    public ReadingNormalizer(DeviceRegistry deviceRegistry, Clock clock, ClimateProperties properties) {
        this.deviceRegistry = deviceRegistry;
        this.clock = clock;
        this.storeRawPayload = properties.getIngest().isStoreRawPayload();
    }

    /**
     * Normalizes a payload.
     *
     * @param payload the vendor payload
     * @param sourceKind the ecosystem the payload came from
     * @param metadata what the collector knows about the device
     * @return a reading with {@code anomalous = false}; validation happens later
     * @throws MalformedPayloadException if the payload has no usable primary temperature or device id
     */
    public Reading normalize(JsonNode payload, SourceKind sourceKind, DeviceMetadata metadata) {
        if (sourceKind == null) {
            throw new MalformedPayloadException("Source kind is required");
        }
        if (metadata == null || isBlank(metadata.getVendorUniqueId())) {
            throw new MalformedPayloadException("Vendor unique id is required for " + sourceKind.getTag());
        }
        if (payload == null || !payload.isObject()) {
            throw new MalformedPayloadException("Payload for " + sourceKind.getTag() + ":"
                    + metadata.getVendorUniqueId() + " is not an object");
        }

        String deviceId = sourceKind.deviceIdFor(metadata.getVendorUniqueId().trim());
        String location = resolveLocation(deviceId, metadata);

        Reading.ReadingBuilder builder = Reading.builder()
                .timestamp(OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC)
                        .truncatedTo(ChronoUnit.MILLIS))
                .deviceId(deviceId)
                .location(location)
                .deviceName(DeviceNames.infer(location, sourceKind))
                .sourceKind(sourceKind)
                .anomalous(false);

        if (sourceKind == SourceKind.MOTION_SENSOR) {
            readMotionSensor(payload, deviceId, builder);
        } else {
            readCloudDevice(payload, deviceId, builder);
        }

        if (storeRawPayload) {
            builder.rawPayload(payload.toString());
        }
        return builder.build();
    }

    private void readMotionSensor(JsonNode payload, String deviceId, Reading.ReadingBuilder builder) {
        JsonNode state = payload.path("state");
        JsonNode temperature = state.path("temperature");
        if (!temperature.isNumber()) {
            throw new MalformedPayloadException("Missing or non-numeric state.temperature for " + deviceId);
        }
        builder.valueCelsius(temperature.decimalValue().divide(HUNDRED, SCALE, RoundingMode.HALF_UP));
        builder.vendorUpdatedAt(parseVendorTimestamp(state.path("lastupdated")));

        JsonNode config = payload.path("config");
        builder.batteryLevel(integerOrNull(config.path("battery")));
        JsonNode reachable = config.path("reachable");
        if (reachable.isBoolean()) {
            builder.signalStrength(reachable.booleanValue() ? 100 : 0);
        }
    }

    private void readCloudDevice(JsonNode payload, String deviceId, Reading.ReadingBuilder builder) {
        builder.valueCelsius(celsius(payload.path("temperature"), deviceId));
        builder.humidityPercent(doubleOrNull(payload.path("humidity")));
        builder.pm25(doubleOrNull(payload.path("pm25")));
        builder.vocPpb(doubleOrNull(payload.path("voc")));
        builder.coPpm(doubleOrNull(payload.path("co")));
        builder.co2Ppm(doubleOrNull(payload.path("co2")));
        builder.airQualityIndex(doubleOrNull(payload.path("iaq")));
        builder.thermostatMode(thermostatMode(payload.path("mode")));
        builder.thermostatState(thermostatState(payload.path("hvacState")));
        builder.vendorUpdatedAt(parseVendorTimestamp(payload.path("lastUpdated")));

        JsonNode connectivity = payload.path("connectivity");
        if (connectivity.isTextual()) {
            builder.signalStrength("OK".equalsIgnoreCase(connectivity.asText()) ? 100 : 0);
        }
    }

    /**
     * Reads {@code {"value": 71.6, "scale": "FAHRENHEIT"}}; a bare number is taken as Celsius.
     */
    private BigDecimal celsius(JsonNode temperature, String deviceId) {
        if (temperature.isNumber()) {
            return temperature.decimalValue().setScale(SCALE, RoundingMode.HALF_UP);
        }
        JsonNode value = temperature.path("value");
        if (!value.isNumber()) {
            throw new MalformedPayloadException("Missing or non-numeric temperature.value for " + deviceId);
        }
        String scale = temperature.path("scale").asText("CELSIUS").toUpperCase(Locale.ROOT);
        switch (scale) {
            case "CELSIUS":
                return value.decimalValue().setScale(SCALE, RoundingMode.HALF_UP);
            case "FAHRENHEIT":
                return value.decimalValue().subtract(THIRTY_TWO).multiply(FIVE)
                        .divide(NINE, SCALE, RoundingMode.HALF_UP);
            default:
                throw new MalformedPayloadException("Unknown temperature scale '" + scale + "' for " + deviceId);
        }
    }

    private String resolveLocation(String deviceId, DeviceMetadata metadata) {
        Optional<RegistryEntry> entry = Optional.empty();
        try {
            entry = deviceRegistry.findById(deviceId);
        } catch (DeviceRegistryException e) {
            log.warn("Device registry unreadable, resolving location without it: deviceId={}, error={}",
                    deviceId, e.getMessage());
        }
        if (entry.isPresent() && !isBlank(entry.get().getLocation())) {
            return entry.get().getLocation();
        }
        if (!isBlank(metadata.getLocation())) {
            return metadata.getLocation().trim();
        }
        if (!isBlank(metadata.getVendorName())) {
            return metadata.getVendorName().trim();
        }
        return DeviceNames.fallbackLocation(metadata.getVendorUniqueId().trim());
    }

    private static String thermostatMode(JsonNode node) {
        if (!node.isTextual()) {
            return null;
        }
        switch (node.asText().toUpperCase(Locale.ROOT)) {
            case "HEAT":
                return "heating";
            case "COOL":
                return "cooling";
            case "OFF":
                return "off";
            case "ECO":
            case "AWAY":
                return "away";
            default:
                log.debug("Unmapped thermostat mode '{}'", node.asText());
                return null;
        }
    }

    private static String thermostatState(JsonNode node) {
        if (!node.isTextual()) {
            return null;
        }
        switch (node.asText().toUpperCase(Locale.ROOT)) {
            case "HEATING":
            case "COOLING":
                return "active";
            case "OFF":
            case "IDLE":
                return "idle";
            default:
                log.debug("Unmapped thermostat state '{}'", node.asText());
                return null;
        }
    }

    /**
     * Vendor stamps are advisory: anything unparseable is dropped with a debug log.
     */
    static OffsetDateTime parseVendorTimestamp(JsonNode node) {
        if (!node.isTextual() || node.asText().isBlank()) {
            return null;
        }
        String text = node.asText().trim();
        try {
            if (text.endsWith("Z") || text.endsWith("z")) {
                return Instant.parse(text.toUpperCase(Locale.ROOT)).atOffset(ZoneOffset.UTC);
            }
            if (OFFSET_SUFFIX.matcher(text).find()) {
                return OffsetDateTime.parse(text).withOffsetSameInstant(ZoneOffset.UTC);
            }
            return LocalDateTime.parse(text).atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable vendor timestamp '{}': {}", text, e.getMessage());
            return null;
        }
    }

    private static Double doubleOrNull(JsonNode node) {
        return node.isNumber() ? node.doubleValue() : null;
    }

    private static Integer integerOrNull(JsonNode node) {
        return node.isNumber() ? node.intValue() : null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
