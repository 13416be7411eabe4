package org.finos.frame.engine.plan;

import org.finos.frame.engine.store.Schema;

import java.util.List;
import java.util.Objects;

/**
 * A table with a schema but no backing source. Its data must be bound in the
 * scope passed to the evaluator.
 */
public record UnboundTable(String name, Schema schema) implements RelationNode, Placeholder {

    public UnboundTable {
        Objects.requireNonNull(name, "Table name cannot be null");
        Objects.requireNonNull(schema, "Schema cannot be null");
    }

    @Override
    public List<Object> inputs() {
        return List.of(name, schema);
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "UnboundTable(" + name + ")";
    }
}
