package org.finos.frame.engine.dispatch;

import org.finos.frame.engine.execution.ExecutionContext;
import org.finos.frame.engine.execution.Value;
import org.finos.frame.engine.plan.Node;

/**
 * Transforms a node's computed value. The context carries the scope the
 * whole evaluation started from.
 *
 * @param <N> The node type
 * @param <V> The value type
 */
@FunctionalInterface
public interface PostExecuteFunction<N extends Node, V extends Value> {

    Value postExecute(N node, V value, ExecutionContext context);
}
