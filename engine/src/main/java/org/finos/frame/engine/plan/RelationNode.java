package org.finos.frame.engine.plan;

import org.finos.frame.engine.store.Schema;

/**
 * A table-valued node.
 */
public interface RelationNode extends RangeSensitiveLeaf {

    /**
     * The declared output schema, in column order.
     */
    Schema schema();

    @Override
    default Shape shape() {
        return Shape.TABLE;
    }
}
