package org.finos.frame.engine.dispatch;

import org.finos.frame.engine.plan.Node;
import org.finos.frame.engine.time.TimeRange;

import java.util.List;

/**
 * Derives one time range per computable input from the node's own range.
 *
 * @param <N> The node type
 */
@FunctionalInterface
public interface TimeContextFunction<N extends Node> {

    /**
     * @param node        The node being evaluated
     * @param range       The node's range, never null
     * @param inputCount  The number of computable inputs
     * @return exactly {@code inputCount} ranges
     */
    List<TimeRange> computeTimeContext(N node, TimeRange range, int inputCount);
}
