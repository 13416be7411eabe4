package org.finos.frame.engine.execution.aggregation;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.MutableList;
import org.finos.frame.engine.execution.ColumnValue;
import org.finos.frame.engine.execution.EvaluationException;
import org.finos.frame.engine.execution.Value;
import org.finos.frame.engine.plan.ReductionKind;
import org.finos.frame.engine.time.TimeRanges;

import java.time.Instant;
import java.util.Objects;

/**
 * Base class of strategies producing one reduced value per row, over the rows
 * whose ordering timestamp falls in a window ending at the row's own timestamp.
 */
abstract class TrailingWindow implements AggregationStrategy {

    private final ColumnValue orderKeys;

    protected TrailingWindow(ColumnValue orderKeys) {
        this.orderKeys = Objects.requireNonNull(orderKeys, "Ordering column cannot be null");
    }

    /**
     * Whether a row ordered at {@code candidate} belongs to the window of the row
     * ordered at {@code current}. {@code candidate} is never after {@code current}.
     */
    protected abstract boolean inWindow(Instant current, Instant candidate);

    @Override
    public Value aggregate(ReductionKind kind, ColumnValue column) {
        if (column.size() != orderKeys.size()) {
            throw new EvaluationException("Cannot window column '" + column.name() + "' of " + column.size()
                    + " rows by ordering column '" + orderKeys.name() + "' of " + orderKeys.size() + " rows");
        }
        Instant[] times = new Instant[orderKeys.size()];
        for (int i = 0; i < times.length; i++) {
            times[i] = TimeRanges.toInstant(orderKeys.get(i));
        }
        MutableList<Object> reduced = Lists.mutable.withInitialCapacity(column.size());
        for (int i = 0; i < column.size(); i++) {
            if (times[i] == null) {
                reduced.add(null);
                continue;
            }
            MutableList<Object> window = Lists.mutable.empty();
            for (int j = 0; j < column.size(); j++) {
                if (times[j] != null && !times[j].isAfter(times[i]) && inWindow(times[i], times[j])) {
                    window.add(column.get(j));
                }
            }
            reduced.add(Reducers.reduce(kind, window));
        }
        return new ColumnValue(column.name(), Reducers.resultType(kind, column.type()),
                reduced.toImmutable(), column.index());
    }
}
