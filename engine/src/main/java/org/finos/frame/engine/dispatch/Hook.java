package org.finos.frame.engine.dispatch;

/**
 * The operator hook families an evaluation dispatches through.
 */
public enum Hook {
    /** Computes a node's value from its realized arguments. */
    EXECUTE_NODE,
    /** Contributes scope entries before a node's inputs are evaluated. */
    PRE_EXECUTE,
    /** Transforms a node's value after it was computed. */
    POST_EXECUTE,
    /** Derives the time range of each computable input from the node's range. */
    COMPUTE_TIME_CONTEXT,
    /** Evaluates literals without recursion. */
    EXECUTE_LITERAL
}
