package org.finos.frame.engine.backend.memory;

import org.finos.frame.engine.dispatch.OperatorModule;
import org.finos.frame.engine.dispatch.OperatorRegistry;
import org.finos.frame.engine.execution.ColumnValue;
import org.finos.frame.engine.execution.EvaluationException;
import org.finos.frame.engine.execution.ExecutionContext;
import org.finos.frame.engine.execution.Index;
import org.finos.frame.engine.execution.ScalarValue;
import org.finos.frame.engine.execution.TableValue;
import org.finos.frame.engine.execution.TimeFilter;
import org.finos.frame.engine.execution.Value;
import org.finos.frame.engine.execution.aggregation.AggregationStrategy;
import org.finos.frame.engine.execution.aggregation.Cumulative;
import org.finos.frame.engine.execution.aggregation.Moving;
import org.finos.frame.engine.execution.aggregation.Summarize;
import org.finos.frame.engine.plan.Aggregation;
import org.finos.frame.engine.plan.Alias;
import org.finos.frame.engine.plan.BinaryOp;
import org.finos.frame.engine.plan.DatabaseTable;
import org.finos.frame.engine.plan.Join;
import org.finos.frame.engine.plan.Limit;
import org.finos.frame.engine.plan.Reduction;
import org.finos.frame.engine.plan.Selection;
import org.finos.frame.engine.plan.TableColumn;
import org.finos.frame.engine.plan.WindowOp;
import org.finos.frame.engine.plan.WindowSpec;
import org.finos.frame.engine.time.TimeRange;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Operators over realized in-memory values, used whatever backend produced
 * the data, plus reads of {@link MemoryBackend} tables.
 */
public final class FrameOperators implements OperatorModule {

    @Override
    public void register(OperatorRegistry registry) {
        registry.registerExecuteNode(DatabaseTable.class, List.of(MemoryBackend.class),
                (node, args, ctx) -> TimeFilter.apply(((MemoryBackend) args.get(0)).read(node.name()), ctx.range()));

        registry.registerExecuteNode(TableColumn.class, List.of(TableValue.class),
                (node, args, ctx) -> ((TableValue) args.get(0)).column(node.name()));

        registry.registerExecuteNode(Alias.class, List.of(ColumnValue.class),
                (node, args, ctx) -> ((ColumnValue) args.get(0)).withName(node.name()));
        registry.registerExecuteNode(Alias.class, List.of(ScalarValue.class),
                (node, args, ctx) -> (ScalarValue) args.get(0));

        registerBinary(registry, ColumnValue.class, ColumnValue.class);
        registerBinary(registry, ColumnValue.class, ScalarValue.class);
        registerBinary(registry, ScalarValue.class, ColumnValue.class);
        registerBinary(registry, ScalarValue.class, ScalarValue.class);

        registry.registerExecuteNode(Reduction.class, List.of(ColumnValue.class, Void.class),
                (node, args, ctx) -> ctx.aggregation().aggregate(node.kind(), (ColumnValue) args.get(0)));
        registry.registerExecuteNode(Reduction.class, List.of(ColumnValue.class, ColumnValue.class),
                FrameOperators::reduceWhere);
        registry.registerExecuteNode(Reduction.class, List.of(ScalarValue.class, Void.class),
                (node, args, ctx) -> ctx.aggregation().aggregate(node.kind(),
                        ColumnOperations.asColumn((ScalarValue) args.get(0))));

        registry.registerExecuteNode(WindowOp.class, List.of(ColumnValue.class, ColumnValue.class, WindowSpec.class),
                FrameOperators::window);
        registry.registerTimeContext(WindowOp.class, FrameOperators::windowTimeContext);
        registry.registerPostExecute(WindowOp.class, ColumnValue.class, FrameOperators::trimWindow);

        registry.registerExecuteNode(Selection.class, List.of(TableValue.class),
                (node, args, ctx) -> RelationOperations.select(node, (TableValue) args.get(0), ctx));
        registry.registerExecuteNode(Aggregation.class, List.of(TableValue.class),
                (node, args, ctx) -> RelationOperations.aggregate(node, (TableValue) args.get(0), ctx));
        registry.registerExecuteNode(Join.class, List.of(TableValue.class, TableValue.class),
                (node, args, ctx) -> RelationOperations.join(node, (TableValue) args.get(0), (TableValue) args.get(1)));
        registry.registerExecuteNode(Limit.class, List.of(TableValue.class, Integer.class, Integer.class),
                (node, args, ctx) -> RelationOperations.limit((TableValue) args.get(0),
                        (Integer) args.get(1), (Integer) args.get(2)));
    }

    private static void registerBinary(OperatorRegistry registry, Class<? extends Value> left,
                                       Class<? extends Value> right) {
        registry.registerExecuteNode(BinaryOp.class, List.of(left, right),
                (node, args, ctx) -> ColumnOperations.binary(node.operator(), node.name(), node.type(),
                        (Value) args.get(0), (Value) args.get(1)));
    }

    private static Value reduceWhere(Reduction node, List<Object> args, ExecutionContext context) {
        ColumnValue column = (ColumnValue) args.get(0);
        ColumnValue mask = ColumnOperations.align((ColumnValue) args.get(1), column.index());
        int[] positions = new int[column.size()];
        int count = 0;
        for (int i = 0; i < column.size(); i++) {
            if (Boolean.TRUE.equals(mask.get(i))) {
                positions[count++] = i;
            }
        }
        return context.aggregation().aggregate(node.kind(), column.take(Arrays.copyOf(positions, count)));
    }

    // ==================== Windows ====================

    private static Value window(WindowOp node, List<Object> args, ExecutionContext context) {
        ColumnValue column = (ColumnValue) args.get(0);
        ColumnValue orderKeys = ColumnOperations.align((ColumnValue) args.get(1), column.index());
        WindowSpec spec = (WindowSpec) args.get(2);
        AggregationStrategy strategy = spec.isCumulative()
                ? new Cumulative(orderKeys)
                : new Moving(orderKeys, spec.preceding());
        return strategy.aggregate(node.reduction().kind(), column);
    }

    /**
     * Every input of a window is read from earlier: rows before the range
     * contribute to the windows of the first rows inside it.
     */
    private static List<TimeRange> windowTimeContext(WindowOp node, TimeRange range, int inputCount) {
        return Collections.nCopies(inputCount, range.extendBack(node.window().preceding()));
    }

    /**
     * Drops the rows read only to fill windows: keeps the rows of the ordering
     * column as evaluated for the node's own range.
     */
    private static Value trimWindow(WindowOp node, ColumnValue value, ExecutionContext context) {
        if (context.range() == null) {
            return value;
        }
        Value visible = context.evaluator().executeWithScope(node.orderBy(), context.scope(), context.range(),
                Summarize.INSTANCE, context.backends());
        if (!(visible instanceof ColumnValue orderKeys)) {
            throw new EvaluationException("Ordering column of " + node + " did not evaluate to a column");
        }
        Index labels = orderKeys.index();
        return ColumnOperations.restrict(value, labels);
    }
}
