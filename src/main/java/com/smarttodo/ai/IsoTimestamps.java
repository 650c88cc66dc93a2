package com.smarttodo.ai;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * Lenient ISO-8601 reader for timestamps produced by the model.
 * <p>
 * Accepts an offset date-time (a trailing {@code Z} meaning UTC), a local date-time, or a
 * bare date (start of that day). Offset values are shifted into {@code zone} and stored as
 * local time. Anything else is rejected as a whole; there is no partial parse.
 */
public final class IsoTimestamps {

    private static final int ISO_DATE_LENGTH = 10;

    private IsoTimestamps() {
    }

    public static Optional<LocalDateTime> parse(String raw, ZoneId zone) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = raw.strip();
        try {
            if (text.length() <= ISO_DATE_LENGTH) {
                return Optional.of(LocalDate.parse(text).atStartOfDay());
            }
            if (text.charAt(ISO_DATE_LENGTH) == ' ') {
                text = text.substring(0, ISO_DATE_LENGTH) + 'T' + text.substring(ISO_DATE_LENGTH + 1);
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offset) {
                return Optional.of(offset.atZoneSameInstant(zone).toLocalDateTime());
            }
            return Optional.of((LocalDateTime) parsed);
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
