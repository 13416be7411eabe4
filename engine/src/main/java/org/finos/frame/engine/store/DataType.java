package org.finos.frame.engine.store;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;

/**
 * Logical data types of columns and scalars.
 */
public enum DataType {
    STRING,
    INTEGER,
    FLOAT,
    DECIMAL,
    BOOLEAN,
    DATE,
    TIMESTAMP,
    ANY;

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT || this == DECIMAL;
    }

    public boolean isTemporal() {
        return this == DATE || this == TIMESTAMP;
    }

    /**
     * Infers the data type of a single Java value.
     * {@code null} infers to {@link #ANY}.
     */
    public static DataType infer(Object value) {
        if (value == null) {
            return ANY;
        }
        if (value instanceof String) {
            return STRING;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return INTEGER;
        }
        if (value instanceof Double || value instanceof Float) {
            return FLOAT;
        }
        if (value instanceof BigDecimal) {
            return DECIMAL;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof LocalDate) {
            return DATE;
        }
        if (value instanceof LocalDateTime || value instanceof Instant
                || value instanceof OffsetDateTime || value instanceof ZonedDateTime
                || value instanceof java.util.Date) {
            return TIMESTAMP;
        }
        return ANY;
    }

    /**
     * Returns the narrowest type able to hold values of both types.
     * Used when inferring a column type from a sample of cells.
     */
    public DataType widen(DataType other) {
        if (this == other || other == ANY) {
            return this;
        }
        if (this == ANY) {
            return other;
        }
        if (this.isNumeric() && other.isNumeric()) {
            if (this == DECIMAL || other == DECIMAL) {
                return DECIMAL;
            }
            return FLOAT;
        }
        if (this.isTemporal() && other.isTemporal()) {
            return TIMESTAMP;
        }
        return STRING;
    }

    /**
     * Maps a JDBC type code to a data type.
     */
    public static DataType fromJdbcType(int jdbcType) {
        return switch (jdbcType) {
            case java.sql.Types.VARCHAR, java.sql.Types.CHAR, java.sql.Types.LONGVARCHAR,
                    java.sql.Types.NVARCHAR, java.sql.Types.NCHAR -> STRING;
            case java.sql.Types.INTEGER, java.sql.Types.SMALLINT, java.sql.Types.TINYINT,
                    java.sql.Types.BIGINT -> INTEGER;
            case java.sql.Types.DOUBLE, java.sql.Types.FLOAT, java.sql.Types.REAL -> FLOAT;
            case java.sql.Types.DECIMAL, java.sql.Types.NUMERIC -> DECIMAL;
            case java.sql.Types.BOOLEAN, java.sql.Types.BIT -> BOOLEAN;
            case java.sql.Types.DATE -> DATE;
            case java.sql.Types.TIMESTAMP, java.sql.Types.TIMESTAMP_WITH_TIMEZONE -> TIMESTAMP;
            default -> ANY;
        };
    }
}
