package org.finos.frame.engine.plan;

/**
 * Marks nodes that carry no data of their own; their value must be bound by
 * the caller through parameters or a seed scope.
 */
public interface Placeholder extends Node {
}
