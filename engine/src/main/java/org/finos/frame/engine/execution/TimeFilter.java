package org.finos.frame.engine.execution;

import org.finos.frame.engine.time.TimeRange;
import org.finos.frame.engine.time.TimeRanges;

import java.time.Instant;

/**
 * Restricts tables to the rows whose {@value TimeRanges#TIME_COLUMN} cell lies
 * in a time range, begin inclusive and end exclusive.
 */
public final class TimeFilter {

    private TimeFilter() {
    }

    /**
     * Filters {@code table} by {@code range}; a null range keeps every row.
     *
     * @throws EvaluationException if a range is given and the table has no
     *                             time column, or a time cell is not a timestamp
     */
    public static TableValue apply(TableValue table, TimeRange range) {
        if (range == null) {
            return table;
        }
        if (!table.hasColumn(TimeRanges.TIME_COLUMN)) {
            throw new EvaluationException("Cannot filter by time range " + range + ": table has no '"
                    + TimeRanges.TIME_COLUMN + "' column " + table.columnNames());
        }
        ColumnValue times = table.column(TimeRanges.TIME_COLUMN);
        int[] positions = new int[times.size()];
        int count = 0;
        for (int i = 0; i < times.size(); i++) {
            Object cell = times.get(i);
            if (cell == null) {
                continue;
            }
            Instant instant = TimeRanges.toInstant(cell);
            if (instant == null) {
                throw new EvaluationException("Value " + cell + " of column '" + TimeRanges.TIME_COLUMN
                        + "' is not a timestamp");
            }
            if (range.contains(instant)) {
                positions[count++] = i;
            }
        }
        int[] kept = new int[count];
        System.arraycopy(positions, 0, kept, 0, count);
        return table.take(kept);
    }
}
