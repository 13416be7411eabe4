package org.finos.frame.engine.plan;

/**
 * Visitor interface for traversing expression trees.
 *
 * @param <T> The return type of the visitor methods
 */
public interface NodeVisitor<T> {

    T visit(Literal literal);

    T visit(ScalarParameter parameter);

    T visit(UnboundTable table);

    /**
     * Visit a table stored in a backend (database table, CSV file).
     */
    T visit(PhysicalTable table);

    T visit(TableColumn column);

    T visit(Alias alias);

    T visit(BinaryOp binaryOp);

    T visit(Reduction reduction);

    T visit(WindowOp windowOp);

    /**
     * Visit a selection (projection, filter, sort).
     */
    T visit(Selection selection);

    /**
     * Visit a group-by aggregation.
     */
    T visit(Aggregation aggregation);

    T visit(Join join);

    T visit(Limit limit);
}
