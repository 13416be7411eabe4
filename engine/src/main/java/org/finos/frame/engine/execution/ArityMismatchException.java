package org.finos.frame.engine.execution;

import org.finos.frame.engine.plan.Node;

/**
 * Exception thrown when a time-context hook returns a number of child ranges
 * different from the number of computable inputs of the node.
 */
public class ArityMismatchException extends EvaluationException {

    public ArityMismatchException(Node node, int expected, int actual) {
        super("Child time ranges differ from computable inputs in length for type "
                + node.getClass().getSimpleName() + ": expected " + expected + ", got " + actual);
    }
}
