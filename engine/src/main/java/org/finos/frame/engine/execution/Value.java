package org.finos.frame.engine.execution;

import org.finos.frame.engine.plan.Shape;
import org.finos.frame.engine.store.DataType;

/**
 * A realized result: a single scalar, a labelled column or a labelled table.
 */
public sealed interface Value permits ScalarValue, ColumnValue, TableValue {

    Shape shape();

    /**
     * Wraps a raw parameter or input into a value. Values are returned unchanged.
     */
    static Value wrap(Object raw) {
        if (raw instanceof Value value) {
            return value;
        }
        return new ScalarValue(raw, DataType.infer(raw));
    }
}
