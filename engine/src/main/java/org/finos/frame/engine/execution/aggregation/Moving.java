package org.finos.frame.engine.execution.aggregation;

import org.finos.frame.engine.execution.ColumnValue;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Trailing window of fixed duration: a row at time {@code t} reduces the rows
 * in {@code [t - preceding, t]}.
 */
public final class Moving extends TrailingWindow {

    private final Duration preceding;

    public Moving(ColumnValue orderKeys, Duration preceding) {
        super(orderKeys);
        this.preceding = Objects.requireNonNull(preceding, "Preceding duration cannot be null");
    }

    @Override
    protected boolean inWindow(Instant current, Instant candidate) {
        return !candidate.isBefore(current.minus(preceding));
    }

    @Override
    public String toString() {
        return "Moving(" + preceding + ")";
    }
}
