package org.finos.frame.engine.execution;

import org.finos.frame.engine.plan.RelationNode;

/**
 * A collaborator supplying data for its own kind of source.
 *
 * Backends are referenced from expression trees by the tables they create and
 * contribute operator implementations through an
 * {@link org.finos.frame.engine.dispatch.OperatorModule}.
 */
public interface Backend {

    /**
     * A short name used in messages and logs.
     */
    String name();

    /**
     * Looks up a table by name.
     *
     * @throws org.finos.frame.engine.store.TableNotFoundException if absent
     */
    RelationNode table(String name);
}
