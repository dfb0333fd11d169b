package io.github.drompincen.elvtrack.runtime.validation;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;

/**
 * Lenient timestamp reading for client-supplied values: ISO-8601 instants, offset
 * date-times, local date-times (read as UTC) and epoch milliseconds.
 */
public final class Timestamps {

    private Timestamps() {}

    public static Instant parse(String field, Object value) {
        if (value instanceof Instant instant) return instant;
        if (value instanceof Date date) return date.toInstant();
        if (value instanceof Number number) return Instant.ofEpochMilli(number.longValue());
        if (value instanceof String text) {
            try {
                TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                        .parseBest(text.trim(), OffsetDateTime::from, LocalDateTime::from);
                return parsed instanceof OffsetDateTime odt
                        ? odt.toInstant()
                        : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                throw new ValidationException(field, "must be an ISO-8601 timestamp, got '" + text + "'");
            }
        }
        throw new ValidationException(field, "must be an ISO-8601 timestamp or epoch milliseconds");
    }
}
