package org.finos.frame.engine.plan;

import org.finos.frame.engine.store.DataType;

import java.util.List;
import java.util.Objects;

/**
 * A named scalar whose value is supplied at execution time through the
 * parameter map.
 */
public record ScalarParameter(String name, DataType type) implements ValueNode, Placeholder {

    public ScalarParameter {
        Objects.requireNonNull(name, "Parameter name cannot be null");
        Objects.requireNonNull(type, "Parameter type cannot be null");
    }

    @Override
    public List<Object> inputs() {
        return List.of();
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
        return "ScalarParameter(" + name + ")";
    }
}
