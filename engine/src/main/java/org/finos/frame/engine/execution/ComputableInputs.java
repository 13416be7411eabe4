package org.finos.frame.engine.execution;

import org.finos.frame.engine.plan.Node;
import org.finos.frame.engine.plan.Tuple;
import org.finos.frame.engine.plan.WindowSpec;
import org.finos.frame.engine.store.DataType;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.Period;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Classifies node inputs into those the evaluator realizes and hands to an
 * operator, and metadata the operator reads off the node itself.
 *
 * Nodes, nulls, numbers, booleans, temporal scalars, backends, windows, tuples
 * and data types are computable. Strings, lists, schemas and enums are not.
 */
public final class ComputableInputs {

    private ComputableInputs() {
    }

    public static boolean isComputable(Object input) {
        return input == null
                || input instanceof Node
                || input instanceof Number
                || input instanceof Boolean
                || input instanceof Backend
                || input instanceof WindowSpec
                || input instanceof Tuple
                || input instanceof DataType
                || isTemporal(input);
    }

    /**
     * The computable inputs of {@code node}, in input order.
     */
    public static List<Object> of(Node node) {
        List<Object> computable = new ArrayList<>();
        for (Object input : node.inputs()) {
            if (isComputable(input)) {
                computable.add(input);
            }
        }
        return computable;
    }

    private static boolean isTemporal(Object input) {
        return input instanceof Instant
                || input instanceof LocalDate
                || input instanceof LocalDateTime
                || input instanceof LocalTime
                || input instanceof OffsetDateTime
                || input instanceof ZonedDateTime
                || input instanceof Duration
                || input instanceof Period
                || input instanceof java.util.Date;
    }
}
