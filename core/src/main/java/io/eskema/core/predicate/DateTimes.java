package io.eskema.core.predicate;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Date-time conversions. Values without an offset are read as UTC. The canonical date-time type is
 * {@link OffsetDateTime}; {@link ZonedDateTime} and {@link Instant} are accepted as equivalents.
 */
public final class DateTimes {

    private static final DateTimeFormatter FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    private DateTimes() {}

    public static boolean isDateTime(Object value) {
        return value instanceof OffsetDateTime || value instanceof ZonedDateTime || value instanceof Instant;
    }

    /** Converts a date-time value to an instant, or {@code null} when it is not one. */
    public static Instant toInstant(Object value) {
        if (value instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toInstant();
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        return null;
    }

    /** Converts to {@link OffsetDateTime}, parsing strings; {@code null} when not possible. */
    public static OffsetDateTime coerce(Object value) {
        if (value instanceof OffsetDateTime odt) {
            return odt;
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toOffsetDateTime();
        }
        if (value instanceof Instant instant) {
            return instant.atOffset(ZoneOffset.UTC);
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt.atOffset(ZoneOffset.UTC);
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay().atOffset(ZoneOffset.UTC);
        }
        if (value instanceof String s) {
            return parse(s);
        }
        return null;
    }

    /**
     * Parses ISO-8601 date-times ({@code T} or a space between date and time), with or without an
     * offset, and plain dates. Returns {@code null} for anything else.
     */
    public static OffsetDateTime parse(String text) {
        String s = text.trim();
        if (s.length() > 10 && s.charAt(10) == ' ') {
            s = s.substring(0, 10) + 'T' + s.substring(11);
        }
        try {
            TemporalAccessor parsed = FORMAT.parseBest(s, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime odt) {
                return odt;
            }
            return coerce(parsed);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
