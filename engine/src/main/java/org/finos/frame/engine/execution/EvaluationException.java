package org.finos.frame.engine.execution;

/**
 * Base exception for failures that abort an evaluation.
 */
public class EvaluationException extends RuntimeException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
