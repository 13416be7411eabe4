package org.finos.frame.engine.plan;

/**
 * The declared result shape of a node.
 */
public enum Shape {
    SCALAR,
    COLUMN,
    TABLE
}
