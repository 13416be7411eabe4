package org.finos.frame.engine.execution;

import org.finos.frame.engine.plan.Node;

/**
 * Exception thrown when the evaluation reaches an expression for which no data
 * can be found in scope, parameters or any backend.
 */
public class UnboundDataException extends EvaluationException {

    private final transient Node node;

    public UnboundDataException(Node node) {
        super("Unable to find data for expression:\n" + node);
        this.node = node;
    }

    public Node getNode() {
        return node;
    }
}
