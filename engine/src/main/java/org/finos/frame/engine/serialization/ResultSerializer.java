package org.finos.frame.engine.serialization;

import org.finos.frame.engine.execution.ColumnValue;
import org.finos.frame.engine.execution.Index;
import org.finos.frame.engine.execution.ScalarValue;
import org.finos.frame.engine.execution.TableValue;
import org.finos.frame.engine.execution.Value;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Collections;
import java.util.List;

/**
 * Interface for serializing evaluation results to various output formats.
 */
public interface ResultSerializer {

    /**
     * Returns the format identifier, also used as file extension (e.g., "json", "csv").
     */
    String formatId();

    /**
     * Returns the MIME content type.
     */
    String contentType();

    /**
     * Serializes a table to the output stream.
     */
    void serialize(TableValue table, OutputStream out) throws IOException;

    /**
     * Serializes any value: a column is written as a one-column table and a
     * scalar as a one-cell table named {@code value}.
     */
    default void serialize(Value value, OutputStream out) throws IOException {
        serialize(asTable(value), out);
    }

    static TableValue asTable(Value value) {
        if (value instanceof TableValue table) {
            return table;
        }
        if (value instanceof ColumnValue column) {
            return TableValue.fromColumns(List.of(column), column.index());
        }
        ScalarValue scalar = (ScalarValue) value;
        return TableValue.fromColumns(
                List.of(ColumnValue.of("value", scalar.type(), Collections.singletonList(scalar.value()))),
                Index.range(1));
    }
}
