package org.finos.frame.engine.dispatch;

import org.finos.frame.engine.execution.EvaluationException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Exception thrown when no implementation is registered for the runtime types
 * of a hook invocation.
 */
public class OperatorNotImplementedException extends EvaluationException {

    private final Hook hook;

    public OperatorNotImplementedException(Hook hook, List<Class<?>> types) {
        super("Operation is not implemented: " + hook + describe(types));
        this.hook = hook;
    }

    public Hook getHook() {
        return hook;
    }

    static String describe(List<Class<?>> types) {
        return types.stream().map(Class::getSimpleName).collect(Collectors.joining(", ", "(", ")"));
    }
}
