package org.finos.frame.engine.backend.csv;

import org.finos.frame.engine.store.DataType;

import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Options for reading CSV files.
 *
 * @param separator         Column separator
 * @param nullValue         Field text read as null; empty fields are always null
 * @param columnTypes       Types forced for some columns instead of inferred ones
 * @param dateFormat        Format of date fields, null for ISO-8601
 * @param timestampFormat   Format of timestamp fields, null for ISO-8601
 */
public record CsvReadOptions(
        char separator,
        String nullValue,
        Map<String, DataType> columnTypes,
        DateTimeFormatter dateFormat,
        DateTimeFormatter timestampFormat
) {

    private static final CsvReadOptions DEFAULTS = builder().build();

    public CsvReadOptions {
        Objects.requireNonNull(nullValue, "Null value marker cannot be null");
        columnTypes = Map.copyOf(Objects.requireNonNull(columnTypes, "Column types cannot be null"));
    }

    public static CsvReadOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for CsvReadOptions.
     */
    public static class Builder {
        private char separator = ',';
        private String nullValue = "";
        private final Map<String, DataType> columnTypes = new LinkedHashMap<>();
        private DateTimeFormatter dateFormat;
        private DateTimeFormatter timestampFormat;

        public Builder separator(char separator) {
            this.separator = separator;
            return this;
        }

        public Builder nullValue(String nullValue) {
            this.nullValue = nullValue;
            return this;
        }

        public Builder columnType(String column, DataType type) {
            this.columnTypes.put(column, type);
            return this;
        }

        public Builder dateFormat(String pattern) {
            this.dateFormat = DateTimeFormatter.ofPattern(pattern);
            return this;
        }

        public Builder timestampFormat(String pattern) {
            this.timestampFormat = DateTimeFormatter.ofPattern(pattern);
            return this;
        }

        public CsvReadOptions build() {
            return new CsvReadOptions(separator, nullValue, columnTypes, dateFormat, timestampFormat);
        }
    }
}
