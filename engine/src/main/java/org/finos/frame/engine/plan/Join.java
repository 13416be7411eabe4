package org.finos.frame.engine.plan;

import org.finos.frame.engine.store.Column;
import org.finos.frame.engine.store.Schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Equi-join of two relations.
 *
 * The output holds the left columns followed by the right columns; a right
 * column whose name clashes with a left one is suffixed with
 * {@value #RIGHT_SUFFIX}.
 *
 * @param left       The left relation
 * @param right      The right relation
 * @param predicates Equality predicates between a left column and a right column
 * @param kind       The join kind
 */
public record Join(
        RelationNode left,
        RelationNode right,
        List<BinaryOp> predicates,
        JoinKind kind
) implements RelationNode {

    public static final String RIGHT_SUFFIX = "_right";

    public Join {
        Objects.requireNonNull(left, "Left relation cannot be null");
        Objects.requireNonNull(right, "Right relation cannot be null");
        Objects.requireNonNull(kind, "Join kind cannot be null");
        predicates = List.copyOf(Objects.requireNonNull(predicates, "Predicates cannot be null"));
        if (predicates.isEmpty()) {
            throw new IllegalArgumentException("At least one join predicate is required");
        }
        for (BinaryOp predicate : predicates) {
            if (predicate.operator() != BinaryOperator.EQUALS
                    || !(predicate.left() instanceof TableColumn l) || l.table() != left
                    || !(predicate.right() instanceof TableColumn r) || r.table() != right) {
                throw new IllegalArgumentException(
                        "Join predicates must equate a left column with a right column: " + predicate);
            }
        }
    }

    public List<String> leftKeys() {
        return predicates.stream().map(p -> ((TableColumn) p.left()).name()).toList();
    }

    public List<String> rightKeys() {
        return predicates.stream().map(p -> ((TableColumn) p.right()).name()).toList();
    }

    /**
     * Output name of a right column.
     */
    public String rightOutputName(String rightColumn) {
        return left.schema().contains(rightColumn) ? rightColumn + RIGHT_SUFFIX : rightColumn;
    }

    @Override
    public Schema schema() {
        List<Column> columns = new ArrayList<>(left.schema().columns());
        for (Column column : right.schema().columns()) {
            columns.add(Column.nullable(rightOutputName(column.name()), column.dataType()));
        }
        return new Schema(columns);
    }

    @Override
    public List<Object> inputs() {
        return List.of(left, right, predicates, kind);
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
