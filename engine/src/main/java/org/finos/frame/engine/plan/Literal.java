package org.finos.frame.engine.plan;

import org.finos.frame.engine.store.DataType;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A constant value.
 *
 * @param value The constant, may be null
 * @param type  The declared type
 */
public record Literal(Object value, DataType type) implements ValueNode {

    public Literal {
        Objects.requireNonNull(type, "Literal type cannot be null");
    }

    public static Literal of(Object value) {
        return new Literal(value, DataType.infer(value));
    }

    @Override
    public String name() {
        return "literal";
    }

    @Override
    public List<Object> inputs() {
        return Arrays.asList(value, type);
    }

    @Override
    public Shape shape() {
        return Shape.SCALAR;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "Literal(" + value + ")";
    }
}
