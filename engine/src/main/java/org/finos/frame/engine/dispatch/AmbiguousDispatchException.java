package org.finos.frame.engine.dispatch;

import org.finos.frame.engine.execution.EvaluationException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Exception thrown when several implementations match a hook invocation and
 * none is more specific than all the others.
 */
public class AmbiguousDispatchException extends EvaluationException {

    public AmbiguousDispatchException(Hook hook, List<Class<?>> types, List<Signature> candidates) {
        super("Ambiguous " + hook + " dispatch for " + OperatorNotImplementedException.describe(types)
                + ": candidates " + candidates.stream().map(Signature::toString).collect(Collectors.joining(", ")));
    }
}
