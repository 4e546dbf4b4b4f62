package com.koni.climate.application.query;

import com.koni.climate.domain.model.Reading;
import com.koni.climate.domain.model.SourceKind;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * Data Transfer Object representing one stored reading.
 * The raw vendor payload is not exposed.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ReadingResponse {

    private Long id;
    private OffsetDateTime timestamp;
    private String deviceId;
    private String deviceName;
    private String location;
    private SourceKind sourceKind;
    private BigDecimal valueCelsius;
    private boolean anomalous;
    private Double humidityPercent;
    private Integer batteryLevel;
    private Integer signalStrength;
    private Double pm25;
    private Double vocPpb;
    private Double coPpm;
    private Double co2Ppm;
    private Double airQualityIndex;
    private String thermostatMode;
    private String thermostatState;
    private OffsetDateTime vendorUpdatedAt;
    private OffsetDateTime insertedAt;

    static ReadingResponse from(Reading reading) {
        return new ReadingResponse(
                reading.getId(),
                reading.getTimestamp(),
                reading.getDeviceId(),
                reading.getDeviceName(),
                reading.getLocation(),
                reading.getSourceKind(),
                reading.getValueCelsius(),
                reading.isAnomalous(),
                reading.getHumidityPercent(),
                reading.getBatteryLevel(),
                reading.getSignalStrength(),
                reading.getPm25(),
                reading.getVocPpb(),
                reading.getCoPpm(),
                reading.getCo2Ppm(),
                reading.getAirQualityIndex(),
                reading.getThermostatMode(),
                reading.getThermostatState(),
                reading.getVendorUpdatedAt(),
                reading.getInsertedAt()
        );
    }
}
