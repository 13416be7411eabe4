package org.finos.frame.engine.backend.memory;

import org.finos.frame.engine.execution.Cells;
import org.finos.frame.engine.execution.ColumnValue;
import org.finos.frame.engine.execution.EvaluationException;
import org.finos.frame.engine.execution.ExecutionContext;
import org.finos.frame.engine.execution.Index;
import org.finos.frame.engine.execution.ScalarValue;
import org.finos.frame.engine.execution.Scope;
import org.finos.frame.engine.execution.TableValue;
import org.finos.frame.engine.execution.Value;
import org.finos.frame.engine.execution.aggregation.AggregationStrategy;
import org.finos.frame.engine.execution.aggregation.Summarize;
import org.finos.frame.engine.plan.Aggregation;
import org.finos.frame.engine.plan.Join;
import org.finos.frame.engine.plan.JoinKind;
import org.finos.frame.engine.plan.Node;
import org.finos.frame.engine.plan.Placeholder;
import org.finos.frame.engine.plan.RelationNode;
import org.finos.frame.engine.plan.Selection;
import org.finos.frame.engine.plan.SortKey;
import org.finos.frame.engine.plan.ValueNode;
import org.finos.frame.engine.store.Column;
import org.finos.frame.engine.store.Schema;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Table-valued operators over realized tables.
 *
 * Expressions configuring an operator (selections, predicates, sort keys,
 * metrics, grouping keys) are evaluated through the evaluator against a scope
 * binding the operator's source relation to its realized table. That scope
 * keeps only the caller's placeholders, so no value memoized over different
 * rows of the source is reused.
 */
final class RelationOperations {

    private RelationOperations() {
    }

    // ==================== Selection ====================

    static TableValue select(Selection node, TableValue source, ExecutionContext context) {
        Scope local = bind(context, node.table(), source);
        Index index = source.index();

        List<ColumnValue> columns = new ArrayList<>();
        if (node.selections().isEmpty()) {
            columns.addAll(source.columns().castToList());
        }
        for (Node selection : node.selections()) {
            if (selection == node.table()) {
                columns.addAll(source.columns().castToList());
            } else if (selection instanceof RelationNode relation) {
                TableValue table = (TableValue) evaluate(relation, local, context, context.aggregation());
                for (ColumnValue column : table.columns()) {
                    columns.add(ColumnOperations.align(column, index));
                }
            } else {
                ValueNode value = (ValueNode) selection;
                Value result = evaluate(value, local, context, context.aggregation());
                columns.add(ColumnOperations.asColumn(result, index).withName(value.name()));
            }
        }
        TableValue projected = TableValue.fromColumns(columns, index);

        List<Integer> kept = new ArrayList<>();
        List<ColumnValue> masks = new ArrayList<>();
        for (ValueNode predicate : node.predicates()) {
            masks.add(ColumnOperations.asColumn(evaluate(predicate, local, context, context.aggregation()), index));
        }
        for (int i = 0; i < index.size(); i++) {
            boolean keep = true;
            for (ColumnValue mask : masks) {
                keep &= Boolean.TRUE.equals(mask.get(i));
            }
            if (keep) {
                kept.add(i);
            }
        }

        if (!node.sortKeys().isEmpty()) {
            List<ColumnValue> keys = new ArrayList<>();
            for (SortKey sortKey : node.sortKeys()) {
                keys.add(ColumnOperations.asColumn(
                        evaluate(sortKey.key(), local, context, context.aggregation()), index));
            }
            kept.sort(sortOrder(node.sortKeys(), keys));
        }
        return projected.take(toArray(kept));
    }

    private static Comparator<Integer> sortOrder(List<SortKey> sortKeys, List<ColumnValue> keys) {
        return (a, b) -> {
            for (int k = 0; k < keys.size(); k++) {
                Object x = keys.get(k).get(a);
                Object y = keys.get(k).get(b);
                int c;
                if (x == null || y == null) {
                    c = Cells.NULLS_LAST.compare(x, y);
                } else {
                    c = sortKeys.get(k).ascending() ? Cells.compare(x, y) : Cells.compare(y, x);
                }
                if (c != 0) {
                    return c;
                }
            }
            return 0;
        };
    }

    // ==================== Aggregation ====================

    static TableValue aggregate(Aggregation node, TableValue source, ExecutionContext context) {
        Scope local = bind(context, node.table(), source);
        List<ColumnValue> keys = new ArrayList<>();
        for (ValueNode key : node.by()) {
            keys.add(ColumnOperations.asColumn(evaluate(key, local, context, Summarize.INSTANCE), source.index()));
        }

        Map<List<Object>, List<Integer>> groups = new LinkedHashMap<>();
        if (keys.isEmpty()) {
            List<Integer> all = new ArrayList<>();
            for (int i = 0; i < source.rowCount(); i++) {
                all.add(i);
            }
            groups.put(List.of(), all);
        } else {
            for (int i = 0; i < source.rowCount(); i++) {
                List<Object> key = new ArrayList<>(keys.size());
                for (ColumnValue column : keys) {
                    key.add(column.get(i));
                }
                groups.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
            }
        }

        Scope base = context.scope().retainKeys(k -> k instanceof Placeholder);
        List<List<Object>> rows = new ArrayList<>();
        for (Map.Entry<List<Object>, List<Integer>> group : groups.entrySet()) {
            TableValue part = source.take(toArray(group.getValue()));
            Scope groupScope = base.store(node.table(), part, context.range());
            List<Object> row = new ArrayList<>(group.getKey());
            for (ValueNode metric : node.metrics()) {
                Value value = evaluate(metric, groupScope, context, Summarize.INSTANCE);
                if (!(value instanceof ScalarValue scalar)) {
                    throw new EvaluationException("Metric " + metric + " did not reduce to a scalar");
                }
                row.add(scalar.value());
            }
            rows.add(row);
        }
        return TableValue.fromRows(node.schema(), rows);
    }

    // ==================== Join ====================

    static TableValue join(Join node, TableValue left, TableValue right) {
        List<String> leftKeys = node.leftKeys();
        List<String> rightKeys = node.rightKeys();

        Map<List<Object>, List<Integer>> lookup = new HashMap<>();
        for (int j = 0; j < right.rowCount(); j++) {
            List<Object> key = joinKey(right, rightKeys, j);
            if (key != null) {
                lookup.computeIfAbsent(key, k -> new ArrayList<>()).add(j);
            }
        }

        List<Column> columns = new ArrayList<>(left.schema().columns());
        for (Column column : right.schema().columns()) {
            columns.add(Column.nullable(node.rightOutputName(column.name()), column.dataType()));
        }

        List<List<Object>> rows = new ArrayList<>();
        List<Object> missing = Arrays.asList(new Object[right.columnCount()]);
        for (int i = 0; i < left.rowCount(); i++) {
            List<Object> key = joinKey(left, leftKeys, i);
            List<Integer> matches = key == null ? null : lookup.get(key);
            if (matches != null) {
                for (int j : matches) {
                    List<Object> row = left.row(i);
                    row.addAll(right.row(j));
                    rows.add(row);
                }
            } else if (node.kind() == JoinKind.LEFT) {
                List<Object> row = left.row(i);
                row.addAll(missing);
                rows.add(row);
            }
        }
        return TableValue.fromRows(new Schema(columns), rows);
    }

    private static List<Object> joinKey(TableValue table, List<String> names, int row) {
        List<Object> key = new ArrayList<>(names.size());
        for (String name : names) {
            Object cell = table.column(name).get(row);
            if (cell == null) {
                return null;
            }
            key.add(cell instanceof Number number ? normalize(number) : cell);
        }
        return key;
    }

    private static BigDecimal normalize(Number number) {
        BigDecimal decimal = Cells.toBigDecimal(number);
        return decimal.signum() == 0 ? BigDecimal.ZERO : decimal.stripTrailingZeros();
    }

    // ==================== Limit ====================

    static TableValue limit(TableValue source, int n, int offset) {
        int from = Math.min(offset, source.rowCount());
        int to = from + Math.min(n, source.rowCount() - from);
        int[] positions = new int[to - from];
        for (int i = from; i < to; i++) {
            positions[i - from] = i;
        }
        return source.take(positions);
    }

    // ==================== Helpers ====================

    private static Scope bind(ExecutionContext context, RelationNode table, TableValue data) {
        return context.scope().retainKeys(k -> k instanceof Placeholder).store(table, data, context.range());
    }

    private static Value evaluate(Node expr, Scope scope, ExecutionContext context, AggregationStrategy strategy) {
        return context.evaluator().executeWithScope(expr, scope, context.range(), strategy, context.backends());
    }

    private static int[] toArray(List<Integer> positions) {
        int[] array = new int[positions.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = positions.get(i);
        }
        return array;
    }
}
