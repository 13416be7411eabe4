package org.finos.frame.engine.dispatch;

/**
 * A set of operator implementations, usually contributed by a backend.
 *
 * Modules listed in {@code META-INF/services/org.finos.frame.engine.dispatch.OperatorModule}
 * are installed into {@link OperatorRegistry#global()}.
 */
public interface OperatorModule {

    void register(OperatorRegistry registry);
}
