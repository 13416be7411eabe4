package org.finos.frame.engine.store;

import java.util.Objects;

/**
 * A named, typed column of a table schema.
 *
 * @param name     The column name
 * @param dataType The logical data type
 * @param nullable Whether the column may hold nulls
 */
public record Column(
        String name,
        DataType dataType,
        boolean nullable
) {
    public Column {
        Objects.requireNonNull(name, "Column name cannot be null");
        Objects.requireNonNull(dataType, "Column dataType cannot be null");

        if (name.isBlank()) {
            throw new IllegalArgumentException("Column name cannot be blank");
        }
    }

    /**
     * Factory for a non-nullable column.
     */
    public static Column required(String name, DataType dataType) {
        return new Column(name, dataType, false);
    }

    /**
     * Factory for a nullable column.
     */
    public static Column nullable(String name, DataType dataType) {
        return new Column(name, dataType, true);
    }
}
