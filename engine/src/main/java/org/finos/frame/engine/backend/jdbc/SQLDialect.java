package org.finos.frame.engine.backend.jdbc;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Interface defining SQL dialect-specific behavior.
 * Implementations handle differences between database engines.
 */
public interface SQLDialect {

    DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");

    /**
     * @return The dialect name (e.g., "DuckDB")
     */
    String name();

    /**
     * Quote an identifier (table name, column name, alias).
     *
     * @param identifier The identifier to quote
     * @return The quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * Quote a string literal value.
     *
     * @param value The string value to quote
     * @return The quoted string literal
     */
    String quoteStringLiteral(String value);

    /**
     * Format a boolean literal.
     *
     * @param value The boolean value
     * @return The SQL boolean representation
     */
    String formatBoolean(boolean value);

    /**
     * Format a NULL literal.
     *
     * @return The SQL NULL representation
     */
    default String formatNull() {
        return "NULL";
    }

    /**
     * Format a timestamp literal, as UTC wall-clock time.
     */
    default String formatTimestamp(Instant value) {
        return formatTimestamp(LocalDateTime.ofInstant(value, ZoneOffset.UTC));
    }

    default String formatTimestamp(LocalDateTime value) {
        return "TIMESTAMP " + quoteStringLiteral(TIMESTAMP_FORMAT.format(value));
    }

    default String formatDate(LocalDate value) {
        return "DATE " + quoteStringLiteral(value.toString());
    }
}
