package org.finos.frame.engine.backend.csv;

import org.finos.frame.engine.store.DataType;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Typing of CSV fields.
 */
final class CsvCells {

    private CsvCells() {
    }

    static boolean isNull(String field, CsvReadOptions options) {
        return field == null || field.isEmpty() || field.equals(options.nullValue());
    }

    /**
     * The narrowest type able to hold a non-null field.
     */
    static DataType infer(String field, CsvReadOptions options) {
        if (isLong(field)) {
            return DataType.INTEGER;
        }
        if (isDouble(field)) {
            return DataType.FLOAT;
        }
        if (field.equalsIgnoreCase("true") || field.equalsIgnoreCase("false")) {
            return DataType.BOOLEAN;
        }
        if (parseDate(field, options) != null) {
            return DataType.DATE;
        }
        if (parseTimestamp(field, options) != null) {
            return DataType.TIMESTAMP;
        }
        return DataType.STRING;
    }

    /**
     * Converts a field to a cell of the given type.
     *
     * @throws IllegalArgumentException if the field does not hold a value of the type
     */
    static Object parse(String field, DataType type, CsvReadOptions options) {
        if (isNull(field, options)) {
            return null;
        }
        switch (type) {
            case INTEGER:
                return Long.parseLong(field.trim());
            case FLOAT:
                return Double.parseDouble(field.trim());
            case DECIMAL:
                return new BigDecimal(field.trim());
            case BOOLEAN:
                if (field.equalsIgnoreCase("true") || field.equalsIgnoreCase("false")) {
                    return Boolean.parseBoolean(field);
                }
                throw new IllegalArgumentException("Not a boolean: " + field);
            case DATE:
                LocalDate date = parseDate(field, options);
                if (date == null) {
                    throw new IllegalArgumentException("Not a date: " + field);
                }
                return date;
            case TIMESTAMP:
                LocalDateTime timestamp = parseTimestamp(field, options);
                if (timestamp == null) {
                    throw new IllegalArgumentException("Not a timestamp: " + field);
                }
                return timestamp;
            default:
                return field;
        }
    }

    private static boolean isLong(String field) {
        try {
            Long.parseLong(field.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static boolean isDouble(String field) {
        try {
            Double.parseDouble(field.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static LocalDate parseDate(String field, CsvReadOptions options) {
        DateTimeFormatter format = options.dateFormat() != null ? options.dateFormat() : DateTimeFormatter.ISO_LOCAL_DATE;
        try {
            return LocalDate.parse(field.trim(), format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Timestamps are read as UTC local date-times; an explicit offset is
     * converted to UTC.
     */
    private static LocalDateTime parseTimestamp(String field, CsvReadOptions options) {
        String text = field.trim();
        if (options.timestampFormat() != null) {
            try {
                return LocalDateTime.parse(text, options.timestampFormat());
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        if (text.length() == 10) {
            LocalDate date = parseDate(text, options);
            return date == null ? null : date.atStartOfDay();
        }
        String iso = text.length() > 10 && text.charAt(10) == ' '
                ? text.substring(0, 10) + 'T' + text.substring(11)
                : text;
        try {
            return LocalDateTime.parse(iso);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(iso).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
            } catch (DateTimeParseException notOffset) {
                return null;
            }
        }
    }
}
