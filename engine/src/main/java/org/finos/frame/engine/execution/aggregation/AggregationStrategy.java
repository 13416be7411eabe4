package org.finos.frame.engine.execution.aggregation;

import org.finos.frame.engine.execution.ColumnValue;
import org.finos.frame.engine.execution.Value;
import org.finos.frame.engine.plan.ReductionKind;

/**
 * Decides how a reduction is applied to a realized column.
 *
 * The same reduction expression yields a scalar under {@link Summarize} and a
 * column aligned with its input under a windowed strategy.
 */
public interface AggregationStrategy {

    /**
     * Reduces {@code column} with {@code kind}.
     *
     * @param kind   The reduction
     * @param column The realized cells to reduce
     * @return a scalar or a column depending on the strategy
     */
    Value aggregate(ReductionKind kind, ColumnValue column);
}
