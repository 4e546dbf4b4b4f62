package com.koni.climate.infrastructure.registry;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonStreamContext;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import com.koni.climate.infrastructure.persistence.TimestampCodec;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.DateTimeException;
import java.time.OffsetDateTime;

/**
 * Reads {@code first_seen} / {@code last_seen} the way people write them by hand:
 * ISO offset date-times, {@code Z} instants, and local date-times with a {@code T}
 * or a space, the latter read as UTC.
 *
 * An unreadable value becomes {@code null} with a warning naming the device, so one
 * bad entry does not make the whole registry unreadable.
 */
@Slf4j
class LenientTimestampDeserializer extends StdScalarDeserializer<OffsetDateTime> {

    public LenientTimestampDeserializer() {
        super(OffsetDateTime.class);
    }

    @Override
    public OffsetDateTime deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        String text = parser.getValueAsString();
        try {
            return TimestampCodec.parse(text);
        } catch (DateTimeException e) {
            log.warn("Ignoring unreadable {} '{}' for device {}: {}",
                    parser.getCurrentName(), text, deviceIdOf(parser), e.getMessage());
            return null;
        }
    }

    /**
     * Id of the {@code devices:} entry the parser is inside, or {@code "unknown"}.
     */
    static String deviceIdOf(JsonParser parser) {
        JsonStreamContext record = parser.getParsingContext();
        JsonStreamContext devices = record == null ? null : record.getParent();
        String deviceId = devices == null ? null : devices.getCurrentName();
        return deviceId == null ? "unknown" : deviceId;
    }
}
