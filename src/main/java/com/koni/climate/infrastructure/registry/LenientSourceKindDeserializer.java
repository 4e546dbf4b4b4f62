package com.koni.climate.infrastructure.registry;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import com.koni.climate.domain.model.SourceKind;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Reads {@code source_kind} from the registry file. An unknown tag is dropped with a
 * warning; the next sighting of the device fills it in again.
 */
@Slf4j
class LenientSourceKindDeserializer extends StdScalarDeserializer<SourceKind> {

    public LenientSourceKindDeserializer() {
        super(SourceKind.class);
    }

    @Override
    public SourceKind deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        String text = parser.getValueAsString();
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return SourceKind.fromTag(text);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unknown source_kind '{}' for device {}",
                    text, LenientTimestampDeserializer.deviceIdOf(parser));
            return null;
        }
    }
}
