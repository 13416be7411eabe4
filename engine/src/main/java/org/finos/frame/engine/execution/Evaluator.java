package org.finos.frame.engine.execution;

import org.finos.frame.engine.dispatch.OperatorRegistry;
import org.finos.frame.engine.execution.aggregation.AggregationStrategy;
import org.finos.frame.engine.execution.aggregation.Summarize;
import org.finos.frame.engine.plan.Literal;
import org.finos.frame.engine.plan.Node;
import org.finos.frame.engine.plan.PhysicalTable;
import org.finos.frame.engine.plan.Placeholder;
import org.finos.frame.engine.plan.RelationNode;
import org.finos.frame.engine.plan.SortKey;
import org.finos.frame.engine.plan.Tuple;
import org.finos.frame.engine.time.TimeRange;
import org.finos.frame.engine.time.TimeRanges;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Evaluates expression trees bottom-up against the registered operators.
 *
 * <p>Every node is evaluated at most once per time range: results are memoized
 * in a {@link Scope} threaded through the recursion, so shared sub-expressions
 * are computed once and later siblings see the results of earlier ones. For each
 * node the evaluator:
 * <ol>
 * <li>evaluates literals directly through {@code execute_literal};</li>
 * <li>returns early on a memo hit;</li>
 * <li>derives child ranges through {@code compute_time_context};</li>
 * <li>lets {@code pre_execute} contribute scope entries, then checks the memo again;</li>
 * <li>fails with {@link UnboundDataException} on an unbound placeholder;</li>
 * <li>evaluates the computable inputs in order;</li>
 * <li>runs {@code execute_node} then {@code post_execute} and memoizes the result.</li>
 * </ol>
 *
 * Usage:
 * <pre>
 * Evaluator evaluator = Evaluator.builder()
 *     .registry(OperatorRegistry.global())
 *     .build();
 *
 * Value result = evaluator.execute(expr, Map.of(), Scope.empty(),
 *     TimeRange.of(begin, end), null);
 * </pre>
 */
public final class Evaluator {

    private static final Logger LOGGER = LoggerFactory.getLogger(Evaluator.class);

    private final OperatorRegistry registry;
    private final AggregationStrategy defaultAggregation;

    public Evaluator(OperatorRegistry registry, AggregationStrategy defaultAggregation) {
        this.registry = Objects.requireNonNull(registry, "Operator registry cannot be null");
        this.defaultAggregation = Objects.requireNonNull(defaultAggregation, "Aggregation strategy cannot be null");
    }

    /**
     * Creates an evaluator over the global registry.
     */
    public static Evaluator create() {
        return new Evaluator(OperatorRegistry.global(), Summarize.INSTANCE);
    }

    public static Builder builder() {
        return new Builder();
    }

    public OperatorRegistry registry() {
        return registry;
    }

    // ==================== Entry points ====================

    public Value execute(Node expr) {
        return execute(expr, Map.of(), Scope.empty(), null, null);
    }

    public Value execute(Node expr, Map<? extends Node, ?> params) {
        return execute(expr, params, Scope.empty(), null, null);
    }

    /**
     * Evaluates {@code expr}.
     *
     * @param expr        The expression to evaluate
     * @param params      Values bound to parameters and unbound tables; raw
     *                    values are wrapped as scalars
     * @param scope       Initial memo, may be null
     * @param range       A time range in any form accepted by
     *                    {@link TimeRanges#canonicalize}, may be null
     * @param aggregation The aggregation strategy, null for the default
     * @return the value of {@code expr}
     */
    public Value execute(Node expr, Map<? extends Node, ?> params, Scope scope, Object range,
                         AggregationStrategy aggregation) {
        Objects.requireNonNull(expr, "Expression cannot be null");
        TimeRange timeRange = TimeRanges.canonicalizeNullable(range);
        Scope bound = scope == null ? Scope.empty() : scope;
        if (params != null) {
            for (Map.Entry<? extends Node, ?> param : params.entrySet()) {
                bound = bound.store(param.getKey(), Value.wrap(param.getValue()), timeRange);
            }
        }
        return executeWithScope(expr, bound, timeRange, aggregation, null);
    }

    /**
     * Evaluates {@code expr} and normalizes the result: a table gets a dense
     * index and the columns of the expression's schema in schema order, and a
     * column gets a dense index.
     */
    public Value executeAndReset(Node expr, Map<? extends Node, ?> params, Scope scope, Object range,
                                 AggregationStrategy aggregation) {
        Value result = execute(expr, params, scope, range, aggregation);
        if (result instanceof TableValue table) {
            TableValue reset = table.resetIndex();
            return expr instanceof RelationNode relation ? reset.select(relation.schema().names()) : reset;
        }
        if (result instanceof ColumnValue column) {
            return column.resetIndex();
        }
        return result;
    }

    public Value executeAndReset(Node expr) {
        return executeAndReset(expr, Map.of(), Scope.empty(), null, null);
    }

    /**
     * Evaluates {@code expr} against an already built scope.
     *
     * @param backends The collaborating backends; discovered from the
     *                 expression when null
     */
    public Value executeWithScope(Node expr, Scope scope, TimeRange range, AggregationStrategy aggregation,
                                  List<Backend> backends) {
        Objects.requireNonNull(expr, "Expression cannot be null");
        Objects.requireNonNull(scope, "Scope cannot be null");
        List<Backend> clients = backends == null ? findBackends(expr) : backends;
        AggregationStrategy strategy = aggregation == null ? defaultAggregation : aggregation;
        ExecutionContext original = new ExecutionContext(scope, range, strategy, clients, this);

        LOGGER.debug("Evaluating {} over {} with range {} and {}",
                expr.getClass().getSimpleName(), clients, range, strategy);

        Scope prepared = scope.merge(registry.preExecute(expr, clients, original));
        Scope result = evaluate(expr, prepared, range, original, 0);
        ScopeEntry entry = result.entry(expr);
        if (entry == null) {
            throw new UnboundDataException(expr);
        }
        return (Value) entry.value();
    }

    // ==================== Recursion ====================

    private Scope evaluate(Node node, Scope scope, TimeRange range, ExecutionContext original, int depth) {
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("{}{} [{}]", indent(depth), node, range);
        }

        if (node instanceof Literal literal) {
            Value value = registry.executeLiteral(literal, original.withScope(scope).withRange(range));
            return scope.store(node, value, range);
        }

        if (scope.lookup(node, range).isPresent()) {
            LOGGER.trace("{}memo hit", indent(depth));
            return scope;
        }

        List<Object> computable = ComputableInputs.of(node);
        List<TimeRange> childRanges = range == null
                ? Collections.<TimeRange>nCopies(computable.size(), null)
                : registry.computeTimeContext(node, range, computable.size());
        if (childRanges.size() != computable.size()) {
            throw new ArityMismatchException(node, computable.size(), childRanges.size());
        }

        ExecutionContext context = original.withScope(scope).withRange(range);
        Scope current = scope.merge(registry.preExecute(node, original.backends(), context));
        if (current.lookup(node, range).isPresent()) {
            LOGGER.trace("{}provided by pre_execute", indent(depth));
            return current;
        }

        if (node instanceof Placeholder) {
            if (current.contains(node)) {
                return current;
            }
            throw new UnboundDataException(node);
        }

        for (int i = 0; i < computable.size(); i++) {
            Object input = computable.get(i);
            if (input instanceof Node child) {
                current = evaluate(child, current, childRanges.get(i), original, depth + 1);
                if (!current.contains(child)) {
                    throw new UnboundDataException(child);
                }
            } else if (input != null) {
                current = current.store(input, input, childRanges.get(i));
            }
        }

        List<Object> args = new ArrayList<>(computable.size());
        for (int i = 0; i < computable.size(); i++) {
            Object input = computable.get(i);
            args.add(input instanceof Node child ? realized(child, current, childRanges.get(i)) : input);
        }

        Value result = registry.executeNode(node, args, context);
        Value computed = registry.postExecute(node, result, original.withRange(range));
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("{}=> {}", indent(depth), computed.shape());
        }
        return current.store(node, computed, range);
    }

    private static Object realized(Node child, Scope scope, TimeRange range) {
        Optional<Object> value = scope.lookup(child, range);
        if (value.isEmpty()) {
            value = scope.lookup(child, null);
        }
        return value.orElseThrow(() -> new UnboundDataException(child));
    }

    // ==================== Collaborators ====================

    /**
     * Collects the distinct backends referenced anywhere in {@code expr}, in
     * the order they are first met.
     */
    public static List<Backend> findBackends(Node expr) {
        List<Backend> backends = new ArrayList<>();
        Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        collectBackends(expr, backends, seen);
        return backends;
    }

    private static void collectBackends(Object input, List<Backend> backends, Set<Object> seen) {
        if (input == null || !seen.add(input)) {
            return;
        }
        if (input instanceof Backend backend) {
            backends.add(backend);
        } else if (input instanceof PhysicalTable table) {
            collectBackends(table.source(), backends, seen);
            for (Object child : table.inputs()) {
                collectBackends(child, backends, seen);
            }
        } else if (input instanceof Node node) {
            for (Object child : node.inputs()) {
                collectBackends(child, backends, seen);
            }
        } else if (input instanceof List<?> list) {
            for (Object item : list) {
                collectBackends(item, backends, seen);
            }
        } else if (input instanceof Tuple tuple) {
            collectBackends(tuple.items(), backends, seen);
        } else if (input instanceof SortKey sortKey) {
            collectBackends(sortKey.key(), backends, seen);
        }
    }

    private static String indent(int depth) {
        return "  ".repeat(depth);
    }

    /**
     * Builder for Evaluator.
     */
    public static class Builder {
        private OperatorRegistry registry;
        private AggregationStrategy aggregation = Summarize.INSTANCE;

        public Builder registry(OperatorRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder defaultAggregation(AggregationStrategy aggregation) {
            this.aggregation = aggregation;
            return this;
        }

        public Evaluator build() {
            return new Evaluator(registry == null ? OperatorRegistry.global() : registry, aggregation);
        }
    }
}
