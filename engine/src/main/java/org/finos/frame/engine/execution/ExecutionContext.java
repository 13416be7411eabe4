package org.finos.frame.engine.execution;

import org.finos.frame.engine.execution.aggregation.AggregationStrategy;
import org.finos.frame.engine.time.TimeRange;

import java.util.List;
import java.util.Objects;

/**
 * Everything an operator implementation may need besides its node and
 * arguments.
 *
 * @param scope       The memo visible to the hook
 * @param range       The time range the node is evaluated for, may be null
 * @param aggregation The aggregation strategy in effect
 * @param backends    The backends collaborating in this evaluation
 * @param evaluator   The evaluator, for hooks that evaluate sub-expressions
 */
public record ExecutionContext(
        Scope scope,
        TimeRange range,
        AggregationStrategy aggregation,
        List<Backend> backends,
        Evaluator evaluator
) {

    public ExecutionContext {
        Objects.requireNonNull(scope, "Scope cannot be null");
        Objects.requireNonNull(aggregation, "Aggregation strategy cannot be null");
        backends = List.copyOf(Objects.requireNonNull(backends, "Backends cannot be null"));
        Objects.requireNonNull(evaluator, "Evaluator cannot be null");
    }

    public ExecutionContext withScope(Scope newScope) {
        return new ExecutionContext(newScope, range, aggregation, backends, evaluator);
    }

    public ExecutionContext withRange(TimeRange newRange) {
        return new ExecutionContext(scope, newRange, aggregation, backends, evaluator);
    }

    public ExecutionContext withAggregation(AggregationStrategy newAggregation) {
        return new ExecutionContext(scope, range, newAggregation, backends, evaluator);
    }

    /**
     * Returns the first collaborating backend of the given type, if any.
     */
    public <B extends Backend> B backend(Class<B> type) {
        for (Backend backend : backends) {
            if (type.isInstance(backend)) {
                return type.cast(backend);
            }
        }
        return null;
    }
}
