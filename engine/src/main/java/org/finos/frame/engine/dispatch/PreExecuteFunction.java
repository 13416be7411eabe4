package org.finos.frame.engine.dispatch;

import org.finos.frame.engine.execution.Backend;
import org.finos.frame.engine.execution.ExecutionContext;
import org.finos.frame.engine.execution.Scope;
import org.finos.frame.engine.plan.Node;

import java.util.List;

/**
 * Runs before a node's inputs are evaluated and returns entries to add to the
 * scope, for instance tables a backend has already loaded.
 *
 * @param <N> The node type
 */
@FunctionalInterface
public interface PreExecuteFunction<N extends Node> {

    Scope preExecute(N node, List<Backend> backends, ExecutionContext context);
}
