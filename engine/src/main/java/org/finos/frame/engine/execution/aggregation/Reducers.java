package org.finos.frame.engine.execution.aggregation;

import org.finos.frame.engine.execution.Cells;
import org.finos.frame.engine.execution.EvaluationException;
import org.finos.frame.engine.plan.ReductionKind;
import org.finos.frame.engine.store.DataType;

import java.math.BigDecimal;

/**
 * Reductions over a sequence of cells. Null cells are ignored; reducing no
 * non-null cells yields null, except for a count which yields zero.
 */
public final class Reducers {

    private Reducers() {
    }

    public static Object reduce(ReductionKind kind, Iterable<?> cells) {
        return switch (kind) {
            case COUNT -> count(cells);
            case SUM -> sum(cells);
            case MEAN -> mean(cells);
            case MIN -> extreme(cells, -1);
            case MAX -> extreme(cells, 1);
        };
    }

    /**
     * The type of a reduction's result given the type of its input.
     */
    public static DataType resultType(ReductionKind kind, DataType input) {
        return switch (kind) {
            case COUNT -> DataType.INTEGER;
            case MEAN -> DataType.FLOAT;
            default -> input;
        };
    }

    private static long count(Iterable<?> cells) {
        long count = 0;
        for (Object cell : cells) {
            if (cell != null) {
                count++;
            }
        }
        return count;
    }

    private static Object sum(Iterable<?> cells) {
        boolean any = false;
        boolean integral = true;
        boolean decimal = false;
        for (Object cell : cells) {
            if (cell == null) {
                continue;
            }
            number(cell);
            any = true;
            integral &= Cells.isIntegral(cell);
            decimal |= cell instanceof BigDecimal;
        }
        if (!any) {
            return null;
        }
        if (integral) {
            long total = 0;
            for (Object cell : cells) {
                if (cell != null) {
                    total = Math.addExact(total, ((Number) cell).longValue());
                }
            }
            return total;
        }
        if (decimal) {
            BigDecimal total = BigDecimal.ZERO;
            for (Object cell : cells) {
                if (cell != null) {
                    total = total.add(Cells.toBigDecimal((Number) cell));
                }
            }
            return total;
        }
        double total = 0.0;
        for (Object cell : cells) {
            if (cell != null) {
                total += ((Number) cell).doubleValue();
            }
        }
        return total;
    }

    private static Double mean(Iterable<?> cells) {
        double total = 0.0;
        long count = 0;
        for (Object cell : cells) {
            if (cell != null) {
                total += number(cell).doubleValue();
                count++;
            }
        }
        return count == 0 ? null : total / count;
    }

    private static Object extreme(Iterable<?> cells, int direction) {
        Object best = null;
        for (Object cell : cells) {
            if (cell != null && (best == null || Cells.compare(cell, best) * direction > 0)) {
                best = cell;
            }
        }
        return best;
    }

    private static Number number(Object cell) {
        if (cell instanceof Number number) {
            return number;
        }
        throw new EvaluationException("Cannot reduce non-numeric value " + cell);
    }
}
