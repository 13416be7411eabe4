package org.finos.frame.engine.plan;

import java.time.Duration;

/**
 * A trailing time window: each row aggregates the rows whose ordering
 * timestamp lies within {@code preceding} before its own, both ends included.
 * A {@code null} preceding duration means an unbounded (cumulative) window.
 */
public record WindowSpec(Duration preceding) {

    public WindowSpec {
        if (preceding != null && preceding.isNegative()) {
            throw new IllegalArgumentException("Preceding duration cannot be negative: " + preceding);
        }
    }

    public static WindowSpec trailing(Duration preceding) {
        return new WindowSpec(preceding);
    }

    public static WindowSpec cumulative() {
        return new WindowSpec(null);
    }

    public boolean isCumulative() {
        return preceding == null;
    }
}
