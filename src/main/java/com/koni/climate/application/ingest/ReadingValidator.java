package com.koni.climate.application.ingest;

import com.koni.climate.domain.exception.ValidationException;
import com.koni.climate.domain.model.RangeClass;
import com.koni.climate.domain.model.Reading;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Checks a normalized reading against plausibility bounds.
 *
 * A primary temperature outside the range class of its source is kept and flagged
 * {@code anomalous}. A secondary field outside its bounds is cleared to null and
 * reported, since the store would refuse it. All bounds are inclusive.
 */
@Slf4j
@Component
public class ReadingValidator {

    /**
     * Validates a reading.
     *
     * @param reading the normalized reading
     * @return the reading with {@code anomalous} derived and invalid secondary fields cleared
     * @throws ValidationException if identity fields or the primary temperature are missing
     */
    public ValidationResult validate(Reading reading) {
        if (reading == null) {
            throw new ValidationException("Reading cannot be null");
        }
        if (reading.getDeviceId() == null || reading.getDeviceId().isBlank()) {
            throw new ValidationException("deviceId is required");
        }
        if (reading.getTimestamp() == null) {
            throw new ValidationException("timestamp is required");
        }
        if (reading.getValueCelsius() == null) {
            throw new ValidationException("valueCelsius is required");
        }
        if (reading.getSourceKind() == null) {
            throw new ValidationException("sourceKind is required");
        }

        RangeClass range = reading.getSourceKind().getRangeClass();
        boolean anomalous = !range.contains(reading.getValueCelsius());
        if (anomalous) {
            log.warn("Temperature out of range: deviceId={}, value={}C, range=[{}, {}]",
                    reading.getDeviceId(), reading.getValueCelsius(), range.getMinCelsius(), range.getMaxCelsius());
        }

        List<String> errors = new ArrayList<>();
        Reading.ReadingBuilder builder = reading.toBuilder().anomalous(anomalous);
        if (outside(reading.getHumidityPercent(), 0, 100)) {
            errors.add("humidityPercent out of range [0, 100]: " + reading.getHumidityPercent());
            builder.humidityPercent(null);
        }
        if (outside(reading.getBatteryLevel(), 0, 100)) {
            errors.add("batteryLevel out of range [0, 100]: " + reading.getBatteryLevel());
            builder.batteryLevel(null);
        }
        if (outside(reading.getSignalStrength(), 0, 100)) {
            errors.add("signalStrength out of range [0, 100]: " + reading.getSignalStrength());
            builder.signalStrength(null);
        }
        if (outside(reading.getAirQualityIndex(), 0, 100)) {
            errors.add("airQualityIndex out of range [0, 100]: " + reading.getAirQualityIndex());
            builder.airQualityIndex(null);
        }
        if (negative(reading.getPm25())) {
            errors.add("pm25 must not be negative: " + reading.getPm25());
            builder.pm25(null);
        }
        if (negative(reading.getVocPpb())) {
            errors.add("vocPpb must not be negative: " + reading.getVocPpb());
            builder.vocPpb(null);
        }
        if (negative(reading.getCoPpm())) {
            errors.add("coPpm must not be negative: " + reading.getCoPpm());
            builder.coPpm(null);
        }
        if (negative(reading.getCo2Ppm())) {
            errors.add("co2Ppm must not be negative: " + reading.getCo2Ppm());
            builder.co2Ppm(null);
        }

        if (!errors.isEmpty()) {
            log.warn("Cleared invalid secondary fields: deviceId={}, errors={}", reading.getDeviceId(), errors);
        }
        return new ValidationResult(builder.build(), Collections.unmodifiableList(errors));
    }

    private static boolean outside(Number value, double min, double max) {
        return value != null && (value.doubleValue() < min || value.doubleValue() > max);
    }

    private static boolean negative(Double value) {
        return value != null && value < 0;
    }
}
