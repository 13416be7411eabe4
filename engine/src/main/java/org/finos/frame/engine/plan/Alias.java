package org.finos.frame.engine.plan;

import org.finos.frame.engine.store.DataType;

import java.util.List;
import java.util.Objects;

/**
 * Renames a value.
 */
public record Alias(ValueNode arg, String name) implements ValueNode {

    public Alias {
        Objects.requireNonNull(arg, "Aliased expression cannot be null");
        Objects.requireNonNull(name, "Alias cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Alias cannot be blank");
        }
    }

    @Override
    public DataType type() {
        return arg.type();
    }

    @Override
    public Shape shape() {
        return arg.shape();
    }

    @Override
    public List<Object> inputs() {
        return List.of(arg, name);
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
