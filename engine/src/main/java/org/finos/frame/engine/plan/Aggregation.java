package org.finos.frame.engine.plan;

import org.finos.frame.engine.store.Column;
import org.finos.frame.engine.store.Schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Group-by aggregation. The output holds the grouping keys followed by the
 * metrics, one row per distinct key combination (one row in total when there
 * are no keys).
 *
 * @param table   The source relation
 * @param metrics Scalar-valued reductions over the source, one output column each
 * @param by      Grouping keys over the source
 */
public record Aggregation(
        RelationNode table,
        List<ValueNode> metrics,
        List<ValueNode> by
) implements RelationNode {

    public Aggregation {
        Objects.requireNonNull(table, "Source node cannot be null");
        metrics = List.copyOf(Objects.requireNonNull(metrics, "Metrics cannot be null"));
        by = List.copyOf(Objects.requireNonNull(by, "Grouping keys cannot be null"));
        if (metrics.isEmpty()) {
            throw new IllegalArgumentException("At least one metric is required");
        }
        for (ValueNode metric : metrics) {
            if (metric.shape() != Shape.SCALAR) {
                throw new IllegalArgumentException("Metric must reduce to a scalar: " + metric);
            }
        }
    }

    @Override
    public Schema schema() {
        List<Column> columns = new ArrayList<>();
        for (ValueNode key : by) {
            columns.add(Column.nullable(key.name(), key.type()));
        }
        for (ValueNode metric : metrics) {
            columns.add(Column.nullable(metric.name(), metric.type()));
        }
        return new Schema(columns);
    }

    @Override
    public List<Object> inputs() {
        return List.of(table, metrics, by);
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
