package com.koni.climate.infrastructure.persistence;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;

/**
 * Text form of timestamps in the store.
 *
 * Values are written in UTC with a fixed width ({@code 2026-10-19T08:15:00.250Z})
 * so that string order is chronological order, which the range queries and
 * keyset pagination rely on. This matches SQLite's
 * {@code strftime('%Y-%m-%dT%H:%M:%fZ')} output used for inserted_at.
 */
public final class TimestampCodec {

    private static final DateTimeFormatter STORE_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'");

    private static final Pattern OFFSET_SUFFIX = Pattern.compile("[+-]\\d{2}:?\\d{2}$");

    private TimestampCodec() {
    }

    public static String format(OffsetDateTime timestamp) {
        if (timestamp == null) {
            return null;
        }
        return STORE_FORMAT.format(timestamp.withOffsetSameInstant(ZoneOffset.UTC));
    }

    /**
     * Parses the store format, plus the formats older rows and hand-edited
     * registry files may carry (ISO offset date-times, and local date-times with
     * a {@code T} or a space, as SQLite's {@code CURRENT_TIMESTAMP} writes them).
     * Local date-times are read as UTC.
     *
     * @throws java.time.format.DateTimeParseException if the text matches none of them
     */
    public static OffsetDateTime parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String value = text.trim();
        if (value.endsWith("Z")) {
            return Instant.parse(value).atOffset(ZoneOffset.UTC);
        }
        if (OFFSET_SUFFIX.matcher(value).find()) {
            return OffsetDateTime.parse(value).withOffsetSameInstant(ZoneOffset.UTC);
        }
        return LocalDateTime.parse(value.replace(' ', 'T')).atOffset(ZoneOffset.UTC);
    }
}
