package org.finos.frame.engine.execution;

import org.finos.frame.engine.plan.BinaryOperator;
import org.finos.frame.engine.time.TimeRanges;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Operations on individual cells with SQL null semantics: any null operand
 * yields null, except where a logical operator is already decided.
 */
public final class Cells {

    /**
     * Orders cells with nulls last. Numbers compare by value across Java types
     * and temporal cells compare by instant.
     */
    public static final Comparator<Object> NULLS_LAST = (a, b) -> {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : 1) : -1;
        }
        return compare(a, b);
    };

    private Cells() {
    }

    /**
     * Compares two non-null cells.
     *
     * @throws EvaluationException if the cells are not comparable
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compare(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return toBigDecimal(x).compareTo(toBigDecimal(y));
        }
        if (a.getClass() == b.getClass() && a instanceof Comparable comparable) {
            return comparable.compareTo(b);
        }
        Instant x = TimeRanges.toInstant(a);
        Instant y = TimeRanges.toInstant(b);
        if (x != null && y != null) {
            return x.compareTo(y);
        }
        throw new EvaluationException("Cannot compare " + describe(a) + " with " + describe(b));
    }

    /**
     * Applies a binary operator to two cells.
     */
    public static Object apply(BinaryOperator operator, Object left, Object right) {
        return switch (operator.category()) {
            case LOGICAL -> logical(operator, left, right);
            case COMPARISON -> left == null || right == null ? null : comparison(operator, left, right);
            case ARITHMETIC -> left == null || right == null ? null : arithmetic(operator, left, right);
        };
    }

    private static Object logical(BinaryOperator operator, Object left, Object right) {
        Boolean l = asBoolean(left);
        Boolean r = asBoolean(right);
        if (operator == BinaryOperator.AND) {
            if (Boolean.FALSE.equals(l) || Boolean.FALSE.equals(r)) {
                return false;
            }
            return l == null || r == null ? null : true;
        }
        if (Boolean.TRUE.equals(l) || Boolean.TRUE.equals(r)) {
            return true;
        }
        return l == null || r == null ? null : false;
    }

    private static Boolean comparison(BinaryOperator operator, Object left, Object right) {
        if (operator == BinaryOperator.EQUALS || operator == BinaryOperator.NOT_EQUALS) {
            boolean equal = sameValue(left, right);
            return operator == BinaryOperator.EQUALS ? equal : !equal;
        }
        int c = compare(left, right);
        return switch (operator) {
            case LESS_THAN -> c < 0;
            case LESS_THAN_OR_EQUAL -> c <= 0;
            case GREATER_THAN -> c > 0;
            case GREATER_THAN_OR_EQUAL -> c >= 0;
            default -> throw new IllegalArgumentException("Not a comparison: " + operator);
        };
    }

    private static boolean sameValue(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            return compare(left, right) == 0;
        }
        if (left instanceof String || right instanceof String) {
            return left.equals(right);
        }
        Instant x = TimeRanges.toInstant(left);
        Instant y = TimeRanges.toInstant(right);
        if (x != null && y != null) {
            return x.equals(y);
        }
        return Objects.equals(left, right);
    }

    private static Object arithmetic(BinaryOperator operator, Object left, Object right) {
        if (!(left instanceof Number l) || !(right instanceof Number r)) {
            throw new EvaluationException("Cannot apply " + operator + " to " + describe(left)
                    + " and " + describe(right));
        }
        if (operator == BinaryOperator.DIVIDE) {
            return r.doubleValue() == 0.0 ? null : l.doubleValue() / r.doubleValue();
        }
        if (isIntegral(l) && isIntegral(r)) {
            long x = l.longValue();
            long y = r.longValue();
            return switch (operator) {
                case ADD -> Math.addExact(x, y);
                case SUBTRACT -> Math.subtractExact(x, y);
                case MULTIPLY -> Math.multiplyExact(x, y);
                default -> throw new IllegalArgumentException("Not arithmetic: " + operator);
            };
        }
        if (l instanceof BigDecimal || r instanceof BigDecimal) {
            BigDecimal x = toBigDecimal(l);
            BigDecimal y = toBigDecimal(r);
            return switch (operator) {
                case ADD -> x.add(y);
                case SUBTRACT -> x.subtract(y);
                case MULTIPLY -> x.multiply(y, MathContext.DECIMAL128);
                default -> throw new IllegalArgumentException("Not arithmetic: " + operator);
            };
        }
        double x = l.doubleValue();
        double y = r.doubleValue();
        return switch (operator) {
            case ADD -> x + y;
            case SUBTRACT -> x - y;
            case MULTIPLY -> x * y;
            default -> throw new IllegalArgumentException("Not arithmetic: " + operator);
        };
    }

    public static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
    }

    public static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (isIntegral(number)) {
            return BigDecimal.valueOf(number.longValue());
        }
        return BigDecimal.valueOf(number.doubleValue());
    }

    private static Boolean asBoolean(Object value) {
        if (value == null || value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new EvaluationException("Expected a boolean but got " + describe(value));
    }

    private static String describe(Object value) {
        return value + " (" + value.getClass().getSimpleName() + ")";
    }
}
