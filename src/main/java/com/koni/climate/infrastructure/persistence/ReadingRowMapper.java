package com.koni.climate.infrastructure.persistence;

import com.koni.climate.domain.model.Reading;
import com.koni.climate.domain.model.SourceKind;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;

/**
 * Maps between {@link Reading} and rows of the readings table.
 * Secondary columns are written as SQL NULL when absent and read back as null,
 * never as 0.
 */
final class ReadingRowMapper {

    static final String INSERT_SQL = "INSERT INTO " + SchemaMigrator.TABLE + " ("
            + "timestamp, device_id, temperature_celsius, location, device_name, source_kind, is_anomalous, "
            + "humidity_percent, battery_level, signal_strength, pm25_ugm3, voc_ppb, co_ppm, co2_ppm, iaq_score, "
            + "thermostat_mode, thermostat_state, vendor_updated_at, raw_response, inserted_at) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, "
            // never earlier than any committed row, so inserted_at follows commit order across writers
            + "(SELECT MAX(strftime('%Y-%m-%dT%H:%M:%fZ', 'now'), COALESCE(MAX(inserted_at), '')) FROM "
            + SchemaMigrator.TABLE + "))";

    private ReadingRowMapper() {
    }

    static void bindInsert(PreparedStatement ps, Reading reading) throws SQLException {
        int i = 1;
        ps.setString(i++, TimestampCodec.format(reading.getTimestamp()));
        ps.setString(i++, reading.getDeviceId());
        ps.setDouble(i++, reading.getValueCelsius().doubleValue());
        ps.setString(i++, reading.getLocation());
        ps.setString(i++, reading.getDeviceName());
        ps.setString(i++, reading.getSourceKind().getTag());
        ps.setInt(i++, reading.isAnomalous() ? 1 : 0);
        setDouble(ps, i++, reading.getHumidityPercent());
        setInteger(ps, i++, reading.getBatteryLevel());
        setInteger(ps, i++, reading.getSignalStrength());
        setDouble(ps, i++, reading.getPm25());
        setDouble(ps, i++, reading.getVocPpb());
        setDouble(ps, i++, reading.getCoPpm());
        setDouble(ps, i++, reading.getCo2Ppm());
        setDouble(ps, i++, reading.getAirQualityIndex());
        ps.setString(i++, reading.getThermostatMode());
        ps.setString(i++, reading.getThermostatState());
        ps.setString(i++, TimestampCodec.format(reading.getVendorUpdatedAt()));
        ps.setString(i, reading.getRawPayload());
    }

    static Reading map(ResultSet rs) throws SQLException {
        return Reading.builder()
                .id(rs.getLong("id"))
                .timestamp(TimestampCodec.parse(rs.getString("timestamp")))
                .deviceId(rs.getString("device_id"))
                .valueCelsius(BigDecimal.valueOf(rs.getDouble("temperature_celsius")))
                .location(rs.getString("location"))
                .deviceName(rs.getString("device_name"))
                .sourceKind(SourceKind.fromTag(rs.getString("source_kind")))
                .anomalous(rs.getInt("is_anomalous") == 1)
                .humidityPercent(getDouble(rs, "humidity_percent"))
                .batteryLevel(getInteger(rs, "battery_level"))
                .signalStrength(getInteger(rs, "signal_strength"))
                .pm25(getDouble(rs, "pm25_ugm3"))
                .vocPpb(getDouble(rs, "voc_ppb"))
                .coPpm(getDouble(rs, "co_ppm"))
                .co2Ppm(getDouble(rs, "co2_ppm"))
                .airQualityIndex(getDouble(rs, "iaq_score"))
                .thermostatMode(rs.getString("thermostat_mode"))
                .thermostatState(rs.getString("thermostat_state"))
                .vendorUpdatedAt(TimestampCodec.parse(rs.getString("vendor_updated_at")))
                .rawPayload(rs.getString("raw_response"))
                .insertedAt(TimestampCodec.parse(rs.getString("inserted_at")))
                .build();
    }

    private static void setDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.REAL);
        } else {
            ps.setDouble(index, value);
        }
    }

    private static void setInteger(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    private static Double getDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static Integer getInteger(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
