package org.finos.frame.engine.execution;

import org.finos.frame.engine.time.TimeRange;

/**
 * A memoized value and the time range it was computed for ({@code null} when
 * computed without a range).
 */
public record ScopeEntry(Object value, TimeRange range) {
}
