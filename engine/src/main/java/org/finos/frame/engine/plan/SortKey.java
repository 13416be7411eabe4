package org.finos.frame.engine.plan;

import java.util.Objects;

/**
 * A sort key of a selection.
 */
public record SortKey(ValueNode key, boolean ascending) {

    public SortKey {
        Objects.requireNonNull(key, "Sort key cannot be null");
    }

    public static SortKey asc(ValueNode key) {
        return new SortKey(key, true);
    }

    public static SortKey desc(ValueNode key) {
        return new SortKey(key, false);
    }
}
