package org.finos.frame.engine.plan;

import org.finos.frame.engine.store.DataType;

/**
 * A column- or scalar-valued node.
 */
public interface ValueNode extends Node {

    /**
     * The output name, used as column name when projected.
     */
    String name();

    DataType type();
}
