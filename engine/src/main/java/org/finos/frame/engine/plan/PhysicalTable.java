package org.finos.frame.engine.plan;

import org.finos.frame.engine.execution.Backend;

/**
 * A whole table stored in a backend.
 */
public interface PhysicalTable extends RelationNode {

    String name();

    Backend source();

    @Override
    default <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
