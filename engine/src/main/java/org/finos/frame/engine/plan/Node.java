package org.finos.frame.engine.plan;

import java.util.List;

/**
 * An operator instance in an expression tree.
 *
 * Nodes are immutable. Their identity is their reference: two structurally
 * equal nodes are still distinct operators, so every memo keyed by nodes
 * hashes by identity.
 */
public interface Node {

    /**
     * The fixed, ordered inputs of this operator. Elements are sub-nodes, scalars,
     * {@code null}, window specifications, metadata tuples, data types, backend
     * handles, or opaque configuration such as names and lists.
     */
    List<Object> inputs();

    /**
     * Whether this node evaluates to a scalar, a column or a table.
     */
    Shape shape();

    <T> T accept(NodeVisitor<T> visitor);
}
