package org.finos.frame.engine.plan;

import org.finos.frame.engine.store.Schema;

import java.util.List;
import java.util.Objects;

/**
 * Keeps at most {@code n} rows after skipping {@code offset} rows.
 */
public record Limit(RelationNode table, Integer n, Integer offset) implements RelationNode {

    public Limit {
        Objects.requireNonNull(table, "Source node cannot be null");
        Objects.requireNonNull(n, "Limit cannot be null");
        Objects.requireNonNull(offset, "Offset cannot be null");
        if (n < 0 || offset < 0) {
            throw new IllegalArgumentException("Limit and offset must be non-negative");
        }
    }

    public Limit(RelationNode table, int n) {
        this(table, n, 0);
    }

    @Override
    public Schema schema() {
        return table.schema();
    }

    @Override
    public List<Object> inputs() {
        return List.of(table, n, offset);
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
