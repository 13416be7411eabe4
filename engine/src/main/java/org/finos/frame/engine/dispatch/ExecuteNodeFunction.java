package org.finos.frame.engine.dispatch;

import org.finos.frame.engine.execution.ExecutionContext;
import org.finos.frame.engine.execution.Value;
import org.finos.frame.engine.plan.Node;

import java.util.List;

/**
 * Computes the value of a node from its realized computable inputs.
 *
 * @param <N> The node type
 */
@FunctionalInterface
public interface ExecuteNodeFunction<N extends Node> {

    /**
     * @param node    The node being evaluated
     * @param args    Realized computable inputs, in input order; raw inputs
     *                (scalars, backends, windows) are passed as themselves
     * @param context The node's time range, incoming scope and strategy
     */
    Value execute(N node, List<Object> args, ExecutionContext context);
}
