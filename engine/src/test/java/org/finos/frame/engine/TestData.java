package org.finos.frame.engine;

import org.finos.frame.engine.execution.TableValue;
import org.finos.frame.engine.store.Column;
import org.finos.frame.engine.store.DataType;
import org.finos.frame.engine.store.Schema;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

/**
 * Shared fixtures: a small daily price series.
 *
 * <pre>
 * row  time        sym  price
 * 0    2024-01-01  A    10.0
 * 1    2024-01-02  A    11.0
 * 2    2024-01-03  B    20.0
 * 3    2024-01-04  A    12.0
 * 4    2024-01-05  B    22.0
 * </pre>
 */
public final class TestData {

    public static final Schema PRICES_SCHEMA = Schema.of(
            Column.required("time", DataType.TIMESTAMP),
            Column.required("sym", DataType.STRING),
            Column.nullable("price", DataType.FLOAT));

    private TestData() {
    }

    public static LocalDateTime day(int dayOfMonth) {
        return LocalDateTime.of(2024, 1, dayOfMonth, 0, 0);
    }

    public static Instant instant(int dayOfMonth) {
        return day(dayOfMonth).toInstant(ZoneOffset.UTC);
    }

    public static TableValue prices() {
        return TableValue.fromRows(PRICES_SCHEMA, List.of(
                Arrays.asList(day(1), "A", 10.0),
                Arrays.asList(day(2), "A", 11.0),
                Arrays.asList(day(3), "B", 20.0),
                Arrays.asList(day(4), "A", 12.0),
                Arrays.asList(day(5), "B", 22.0)));
    }
}
