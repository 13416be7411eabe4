package org.finos.frame.engine.plan;

import org.finos.frame.engine.store.DataType;

import java.util.List;
import java.util.Objects;

/**
 * Applies a reduction over a trailing time window, producing one value per
 * input row.
 *
 * The inputs are the reduced column, the ordering column and the window, so the
 * reduction node itself is never evaluated as a whole-column aggregate.
 *
 * @param reduction The reduction applied within each window
 * @param orderBy   The timestamp column ordering the rows
 * @param window    The window extent
 */
public record WindowOp(Reduction reduction, TableColumn orderBy, WindowSpec window) implements ValueNode {

    public WindowOp {
        Objects.requireNonNull(reduction, "Reduction cannot be null");
        Objects.requireNonNull(orderBy, "Ordering column cannot be null");
        Objects.requireNonNull(window, "Window cannot be null");
        if (reduction.where() != null) {
            throw new IllegalArgumentException("Windowed reductions do not support a where mask");
        }
    }

    @Override
    public String name() {
        return reduction.name();
    }

    @Override
    public DataType type() {
        return reduction.type();
    }

    @Override
    public Shape shape() {
        return Shape.COLUMN;
    }

    @Override
    public List<Object> inputs() {
        return List.of(reduction.arg(), orderBy, window);
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
