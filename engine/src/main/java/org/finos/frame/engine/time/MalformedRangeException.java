package org.finos.frame.engine.time;

import org.finos.frame.engine.execution.EvaluationException;

/**
 * Exception thrown when a time range is not a pair of coercible bounds
 * or its begin is after its end.
 */
public class MalformedRangeException extends EvaluationException {

    public MalformedRangeException(String message) {
        super(message);
    }

    public MalformedRangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
