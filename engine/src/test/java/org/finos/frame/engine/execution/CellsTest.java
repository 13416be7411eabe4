package org.finos.frame.engine.execution;

import org.finos.frame.engine.plan.BinaryOperator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CellsTest {

    @Test
    @DisplayName("Logical operators use three-valued logic")
    void testThreeValuedLogic() {
        assertEquals(false, Cells.apply(BinaryOperator.AND, null, false));
        assertNull(Cells.apply(BinaryOperator.AND, null, true));
        assertEquals(true, Cells.apply(BinaryOperator.OR, null, true));
        assertNull(Cells.apply(BinaryOperator.OR, false, null));
    }

    @Test
    @DisplayName("Comparisons and arithmetic with null yield null")
    void testNullPropagation() {
        assertNull(Cells.apply(BinaryOperator.EQUALS, null, 1));
        assertNull(Cells.apply(BinaryOperator.LESS_THAN, 1, null));
        assertNull(Cells.apply(BinaryOperator.ADD, null, 1));
    }

    @Test
    @DisplayName("Numbers compare by value across types")
    void testNumericComparison() {
        assertEquals(true, Cells.apply(BinaryOperator.EQUALS, 2, 2.0));
        assertEquals(true, Cells.apply(BinaryOperator.EQUALS, 2L, new BigDecimal("2.00")));
        assertEquals(true, Cells.apply(BinaryOperator.LESS_THAN, 1, 1.5));
        assertEquals(false, Cells.apply(BinaryOperator.NOT_EQUALS, 3, 3L));
    }

    @Test
    @DisplayName("Timestamps compare as instants")
    void testTemporalComparison() {
        LocalDateTime local = LocalDateTime.of(2024, 1, 1, 0, 0);
        Instant instant = Instant.parse("2024-01-01T00:00:00Z");

        assertEquals(true, Cells.apply(BinaryOperator.EQUALS, local, instant));
        assertEquals(true, Cells.apply(BinaryOperator.GREATER_THAN, instant.plusSeconds(1), local));
    }

    @Test
    @DisplayName("Arithmetic keeps the widest operand type")
    void testArithmeticTypes() {
        assertEquals(5L, Cells.apply(BinaryOperator.ADD, 2, 3));
        assertEquals(5.5, Cells.apply(BinaryOperator.ADD, 2, 3.5));
        assertEquals(new BigDecimal("5.5"), Cells.apply(BinaryOperator.ADD, 2, new BigDecimal("3.5")));
        assertEquals(2.5, Cells.apply(BinaryOperator.DIVIDE, 5, 2));
        assertNull(Cells.apply(BinaryOperator.DIVIDE, 5, 0));
    }

    @Test
    @DisplayName("Integer overflow fails instead of wrapping")
    void testOverflow() {
        assertThrows(ArithmeticException.class, () -> Cells.apply(BinaryOperator.MULTIPLY, Long.MAX_VALUE, 2));
    }

    @Test
    @DisplayName("Incompatible operands fail")
    void testIncompatibleOperands() {
        assertThrows(EvaluationException.class, () -> Cells.apply(BinaryOperator.ADD, "a", 1));
        assertThrows(EvaluationException.class, () -> Cells.apply(BinaryOperator.LESS_THAN, "a", 1));
        assertThrows(EvaluationException.class, () -> Cells.apply(BinaryOperator.AND, 1, true));
    }

    @Test
    @DisplayName("Sorting puts nulls last")
    void testNullsLast() {
        List<Object> cells = new ArrayList<>(Arrays.asList(3, null, 1.5, 2L));

        cells.sort(Cells.NULLS_LAST);

        assertEquals(Arrays.asList(1.5, 2L, 3, null), cells);
    }
}
