package org.finos.frame.engine.plan;

/**
 * Marks node kinds whose memoized values may be reused across time ranges:
 * column references and table-valued nodes.
 *
 * A cached value of such a node is reused for a requested range only when
 * that range lies within the range the value was computed for. Every other
 * node kind is recomputed whenever a range is in play.
 */
public interface RangeSensitiveLeaf extends Node {
}
