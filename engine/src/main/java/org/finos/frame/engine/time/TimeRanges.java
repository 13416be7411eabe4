package org.finos.frame.engine.time;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Canonicalization of user-supplied time ranges and timestamp coercion.
 *
 * Local date-times and dates are interpreted in UTC.
 */
public final class TimeRanges {

    /**
     * Name of the timestamp column a table must carry to be filtered by a time range.
     */
    public static final String TIME_COLUMN = "time";

    private TimeRanges() {
    }

    /**
     * Converts a range given as a {@link TimeRange}, a two-element list or array,
     * or a {@link Map.Entry} into a canonical {@link TimeRange}.
     *
     * @throws MalformedRangeException if the input is not a pair, a bound is not
     *                                 coercible to an instant, or begin is after end
     */
    public static TimeRange canonicalize(Object range) {
        if (range instanceof TimeRange timeRange) {
            return timeRange;
        }
        Object begin;
        Object end;
        if (range instanceof List<?> list && list.size() == 2) {
            begin = list.get(0);
            end = list.get(1);
        } else if (range instanceof Object[] array && array.length == 2) {
            begin = array[0];
            end = array[1];
        } else if (range instanceof Map.Entry<?, ?> entry) {
            begin = entry.getKey();
            end = entry.getValue();
        } else {
            throw new MalformedRangeException("Time range " + describe(range) + " should specify (begin, end)");
        }

        Instant b = coerceBound("begin", begin);
        Instant e = coerceBound("end", end);
        return new TimeRange(b, e);
    }

    /**
     * Canonicalizes a nullable range; {@code null} stays {@code null}.
     */
    public static TimeRange canonicalizeNullable(Object range) {
        return range == null ? null : canonicalize(range);
    }

    /**
     * Coerces a timestamp-like value to an {@link Instant}.
     *
     * @return the instant, or {@code null} if the value is not coercible
     */
    public static Instant toInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toInstant(ZoneOffset.UTC);
        }
        if (value instanceof OffsetDateTime dateTime) {
            return dateTime.toInstant();
        }
        if (value instanceof ZonedDateTime dateTime) {
            return dateTime.toInstant();
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay().toInstant(ZoneOffset.UTC);
        }
        if (value instanceof java.sql.Timestamp timestamp) {
            return timestamp.toLocalDateTime().toInstant(ZoneOffset.UTC);
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate().atStartOfDay().toInstant(ZoneOffset.UTC);
        }
        if (value instanceof java.util.Date date) {
            return date.toInstant();
        }
        if (value instanceof String text) {
            return parse(text.trim());
        }
        return null;
    }

    private static Instant parse(String text) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException ignored) {
            // try the local forms below
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException ignored) {
            // try the local forms below
        }
        try {
            return LocalDateTime.parse(text.replace(' ', 'T')).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // try the date form below
        }
        try {
            return LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Instant coerceBound(String which, Object bound) {
        Instant instant = toInstant(bound);
        if (instant == null) {
            throw new MalformedRangeException(which + " time value " + bound + " of type "
                    + (bound == null ? "null" : bound.getClass().getSimpleName())
                    + " is not a timestamp");
        }
        return instant;
    }

    private static String describe(Object range) {
        if (range instanceof Object[] array) {
            return java.util.Arrays.toString(array);
        }
        return String.valueOf(range);
    }
}
