package org.finos.frame.engine.backend.memory;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.MutableList;
import org.finos.frame.engine.execution.Cells;
import org.finos.frame.engine.execution.ColumnValue;
import org.finos.frame.engine.execution.EvaluationException;
import org.finos.frame.engine.execution.Index;
import org.finos.frame.engine.execution.ScalarValue;
import org.finos.frame.engine.execution.TableValue;
import org.finos.frame.engine.execution.Value;
import org.finos.frame.engine.plan.BinaryOperator;
import org.finos.frame.engine.store.DataType;

import java.util.HashMap;
import java.util.Map;

/**
 * Element-wise operations on column and scalar values.
 *
 * Columns are combined by row label: when two columns carry different labels
 * the right one is realigned to the left one's labels, missing rows becoming null.
 */
final class ColumnOperations {

    private ColumnOperations() {
    }

    /**
     * Applies {@code operator} to two column or scalar values.
     */
    static Value binary(BinaryOperator operator, String name, DataType type, Value left, Value right) {
        if (left instanceof ScalarValue l && right instanceof ScalarValue r) {
            return new ScalarValue(Cells.apply(operator, l.value(), r.value()), type);
        }
        Index index = left instanceof ColumnValue column ? column.index() : ((ColumnValue) right).index();
        ColumnValue l = asColumn(left, index);
        ColumnValue r = asColumn(right, index);
        MutableList<Object> cells = Lists.mutable.withInitialCapacity(index.size());
        for (int i = 0; i < index.size(); i++) {
            cells.add(Cells.apply(operator, l.get(i), r.get(i)));
        }
        return new ColumnValue(name, type, cells.toImmutable(), index);
    }

    /**
     * Returns {@code value} as a column labelled by {@code index}: scalars are
     * broadcast, columns realigned.
     */
    static ColumnValue asColumn(Value value, Index index) {
        if (value instanceof ScalarValue scalar) {
            MutableList<Object> cells = Lists.mutable.withInitialCapacity(index.size());
            for (int i = 0; i < index.size(); i++) {
                cells.add(scalar.value());
            }
            return new ColumnValue("scalar", scalar.type(), cells.toImmutable(), index);
        }
        if (value instanceof ColumnValue column) {
            return align(column, index);
        }
        throw new EvaluationException("Expected a column or scalar but got a " + value.shape());
    }

    /**
     * Realigns {@code column} to the labels of {@code index}.
     */
    static ColumnValue align(ColumnValue column, Index index) {
        if (column.index().equals(index)) {
            return column;
        }
        Map<Object, Integer> positions = new HashMap<>();
        for (int i = 0; i < column.size(); i++) {
            positions.putIfAbsent(column.index().get(i), i);
        }
        MutableList<Object> cells = Lists.mutable.withInitialCapacity(index.size());
        for (int i = 0; i < index.size(); i++) {
            Integer position = positions.get(index.get(i));
            cells.add(position == null ? null : column.get(position));
        }
        return new ColumnValue(column.name(), column.type(), cells.toImmutable(), index);
    }

    /**
     * Keeps the labels of {@code value} that {@code labels} also has, in the
     * order of {@code value}.
     */
    static ColumnValue restrict(ColumnValue value, Index labels) {
        Map<Object, Boolean> wanted = new HashMap<>();
        for (Object label : labels.labels()) {
            wanted.put(label, Boolean.TRUE);
        }
        int[] positions = new int[value.size()];
        int count = 0;
        for (int i = 0; i < value.size(); i++) {
            if (wanted.containsKey(value.index().get(i))) {
                positions[count++] = i;
            }
        }
        int[] kept = new int[count];
        System.arraycopy(positions, 0, kept, 0, count);
        return value.take(kept);
    }

    /**
     * Returns {@code value} as a single column.
     */
    static ColumnValue asColumn(Value value) {
        if (value instanceof ColumnValue column) {
            return column;
        }
        if (value instanceof ScalarValue scalar) {
            return asColumn(scalar, Index.range(1));
        }
        TableValue table = (TableValue) value;
        if (table.columnCount() != 1) {
            throw new EvaluationException("Expected a single column but got " + table.columnNames());
        }
        return table.columns().get(0);
    }
}
