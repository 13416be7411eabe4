package org.finos.frame.engine.dispatch;

import org.finos.frame.engine.execution.ExecutionContext;
import org.finos.frame.engine.execution.Value;
import org.finos.frame.engine.plan.Literal;

/**
 * Evaluates a literal. Literals never recurse and never reach the memo lookup.
 *
 * @param <T> The Java type of the literal's value
 */
@FunctionalInterface
public interface LiteralFunction<T> {

    Value executeLiteral(Literal literal, T value, ExecutionContext context);
}
