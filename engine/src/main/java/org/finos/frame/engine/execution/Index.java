package org.finos.frame.engine.execution;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;

import java.util.Objects;

/**
 * Row labels attached to column and table values.
 *
 * Labels survive filtering and sorting, which lets operators align values that
 * were computed over different slices of the same source.
 */
public record Index(ImmutableList<Object> labels) {

    public Index {
        Objects.requireNonNull(labels, "Index labels cannot be null");
    }

    /**
     * Creates the dense index {@code 0..size-1}.
     */
    public static Index range(int size) {
        MutableList<Object> labels = Lists.mutable.withInitialCapacity(size);
        for (int i = 0; i < size; i++) {
            labels.add(i);
        }
        return new Index(labels.toImmutable());
    }

    public static Index of(Iterable<?> labels) {
        return new Index(Lists.immutable.withAll(labels));
    }

    public int size() {
        return labels.size();
    }

    public Object get(int position) {
        return labels.get(position);
    }

    /**
     * Returns the position of {@code label}, or -1.
     */
    public int positionOf(Object label) {
        return labels.indexOf(label);
    }

    /**
     * Whether the labels are exactly {@code 0..size-1}.
     */
    public boolean isDense() {
        for (int i = 0; i < labels.size(); i++) {
            if (!Integer.valueOf(i).equals(labels.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Selects the labels at the given positions, in that order.
     */
    public Index take(int[] positions) {
        MutableList<Object> taken = Lists.mutable.withInitialCapacity(positions.length);
        for (int position : positions) {
            taken.add(labels.get(position));
        }
        return new Index(taken.toImmutable());
    }
}
