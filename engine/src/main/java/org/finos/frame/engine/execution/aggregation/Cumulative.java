package org.finos.frame.engine.execution.aggregation;

import org.finos.frame.engine.execution.ColumnValue;

import java.time.Instant;

/**
 * Unbounded trailing window: a row reduces every row ordered at or before it.
 */
public final class Cumulative extends TrailingWindow {

    public Cumulative(ColumnValue orderKeys) {
        super(orderKeys);
    }

    @Override
    protected boolean inWindow(Instant current, Instant candidate) {
        return true;
    }

    @Override
    public String toString() {
        return "Cumulative";
    }
}
