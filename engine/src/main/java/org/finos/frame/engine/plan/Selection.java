package org.finos.frame.engine.plan;

import org.finos.frame.engine.store.Column;
import org.finos.frame.engine.store.Schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Projection, mutation, filtering and sorting of a table.
 *
 * The selection, predicate and sort-key lists are configuration of this
 * operator: they are evaluated by the operator implementation against the
 * realized table, not by the evaluator's recursion.
 *
 * @param table      The source relation
 * @param selections Output columns in order; a relation selects all its
 *                   columns; an empty list keeps the source schema
 * @param predicates Boolean values, all of which must hold for a row to be kept
 * @param sortKeys   Sort order applied after filtering
 */
public record Selection(
        RelationNode table,
        List<Node> selections,
        List<ValueNode> predicates,
        List<SortKey> sortKeys
) implements RelationNode {

    public Selection {
        Objects.requireNonNull(table, "Source table cannot be null");
        selections = List.copyOf(Objects.requireNonNull(selections, "Selections cannot be null"));
        predicates = List.copyOf(Objects.requireNonNull(predicates, "Predicates cannot be null"));
        sortKeys = List.copyOf(Objects.requireNonNull(sortKeys, "Sort keys cannot be null"));
        for (Node selection : selections) {
            if (!(selection instanceof RelationNode) && !(selection instanceof ValueNode)) {
                throw new IllegalArgumentException("Unsupported selection: " + selection);
            }
        }
    }

    public static Selection project(RelationNode table, List<Node> selections) {
        return new Selection(table, selections, List.of(), List.of());
    }

    public static Selection filter(RelationNode table, List<ValueNode> predicates) {
        return new Selection(table, List.of(), predicates, List.of());
    }

    public static Selection sort(RelationNode table, List<SortKey> sortKeys) {
        return new Selection(table, List.of(), List.of(), sortKeys);
    }

    @Override
    public Schema schema() {
        if (selections.isEmpty()) {
            return table.schema();
        }
        List<Column> columns = new ArrayList<>();
        for (Node selection : selections) {
            if (selection instanceof RelationNode relation) {
                columns.addAll(relation.schema().columns());
            } else {
                ValueNode value = (ValueNode) selection;
                columns.add(Column.nullable(value.name(), value.type()));
            }
        }
        return new Schema(columns);
    }

    @Override
    public List<Object> inputs() {
        return List.of(table, selections, predicates, sortKeys);
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "Selection(" + selections.size() + " selections, "
                + predicates.size() + " predicates <- " + table + ")";
    }
}
