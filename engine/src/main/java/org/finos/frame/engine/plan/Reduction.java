package org.finos.frame.engine.plan;

import org.finos.frame.engine.store.DataType;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Reduces a column to a scalar, optionally restricted by a boolean column.
 * How the reduction is carried out is decided by the aggregation strategy in
 * effect.
 *
 * @param kind  The reduction
 * @param arg   The column to reduce
 * @param where Optional boolean mask, may be null
 */
public record Reduction(ReductionKind kind, ValueNode arg, ValueNode where) implements ValueNode {

    public Reduction {
        Objects.requireNonNull(kind, "Reduction kind cannot be null");
        Objects.requireNonNull(arg, "Reduction argument cannot be null");
    }

    public Reduction(ReductionKind kind, ValueNode arg) {
        this(kind, arg, null);
    }

    @Override
    public String name() {
        return arg.name();
    }

    @Override
    public DataType type() {
        return switch (kind) {
            case COUNT -> DataType.INTEGER;
            case MEAN -> DataType.FLOAT;
            default -> arg.type();
        };
    }

    @Override
    public Shape shape() {
        return Shape.SCALAR;
    }

    @Override
    public List<Object> inputs() {
        return Arrays.asList(arg, where);
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return kind + "(" + arg + ")";
    }
}
