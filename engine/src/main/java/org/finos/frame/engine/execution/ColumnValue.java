package org.finos.frame.engine.execution;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.finos.frame.engine.plan.Shape;
import org.finos.frame.engine.store.DataType;

import java.util.Objects;

/**
 * A named, typed column of cells with row labels. Cells may be null.
 */
public record ColumnValue(String name, DataType type, ImmutableList<Object> cells, Index index) implements Value {

    public ColumnValue {
        Objects.requireNonNull(name, "Column name cannot be null");
        Objects.requireNonNull(type, "Column type cannot be null");
        Objects.requireNonNull(cells, "Column cells cannot be null");
        Objects.requireNonNull(index, "Column index cannot be null");
        if (cells.size() != index.size()) {
            throw new IllegalArgumentException(
                    "Column '" + name + "' has " + cells.size() + " cells but " + index.size() + " labels");
        }
    }

    /**
     * Creates a column with a dense index.
     */
    public static ColumnValue of(String name, DataType type, Iterable<?> cells) {
        ImmutableList<Object> values = Lists.immutable.withAll(cells);
        return new ColumnValue(name, type, values, Index.range(values.size()));
    }

    public int size() {
        return cells.size();
    }

    public Object get(int position) {
        return cells.get(position);
    }

    public ColumnValue withName(String newName) {
        return new ColumnValue(newName, type, cells, index);
    }

    public ColumnValue withIndex(Index newIndex) {
        return new ColumnValue(name, type, cells, newIndex);
    }

    public ColumnValue resetIndex() {
        return withIndex(Index.range(cells.size()));
    }

    /**
     * Selects the cells at the given positions, keeping their labels.
     */
    public ColumnValue take(int[] positions) {
        MutableList<Object> taken = Lists.mutable.withInitialCapacity(positions.length);
        for (int position : positions) {
            taken.add(cells.get(position));
        }
        return new ColumnValue(name, type, taken.toImmutable(), index.take(positions));
    }

    @Override
    public Shape shape() {
        return Shape.COLUMN;
    }
}
