package org.finos.frame.engine.execution.aggregation;

import org.finos.frame.engine.execution.ColumnValue;
import org.finos.frame.engine.execution.ScalarValue;
import org.finos.frame.engine.execution.Value;
import org.finos.frame.engine.plan.ReductionKind;

/**
 * Reduces a whole column to one scalar. This is the default strategy.
 */
public final class Summarize implements AggregationStrategy {

    public static final Summarize INSTANCE = new Summarize();

    private Summarize() {
    }

    @Override
    public Value aggregate(ReductionKind kind, ColumnValue column) {
        return new ScalarValue(Reducers.reduce(kind, column.cells()), Reducers.resultType(kind, column.type()));
    }

    @Override
    public String toString() {
        return "Summarize";
    }
}
