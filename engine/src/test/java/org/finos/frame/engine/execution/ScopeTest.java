package org.finos.frame.engine.execution;

import org.finos.frame.engine.TestData;
import org.finos.frame.engine.plan.BinaryOp;
import org.finos.frame.engine.plan.BinaryOperator;
import org.finos.frame.engine.plan.Literal;
import org.finos.frame.engine.plan.TableColumn;
import org.finos.frame.engine.plan.UnboundTable;
import org.finos.frame.engine.time.TimeRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.finos.frame.engine.TestData.instant;
import static org.junit.jupiter.api.Assertions.*;

class ScopeTest {

    private final UnboundTable prices = new UnboundTable("prices", TestData.PRICES_SCHEMA);
    private final TableColumn price = new TableColumn(prices, "price");

    private static TimeRange days(int begin, int end) {
        return TimeRange.of(instant(begin), instant(end));
    }

    @Test
    @DisplayName("Lookup without a range ignores the stored range")
    void testLookupWithoutRange() {
        Scope scope = Scope.of(prices, "data", days(1, 4));

        assertEquals("data", scope.lookup(prices, null).orElseThrow());
    }

    @Test
    @DisplayName("A leaf is reused for a range inside its stored range")
    void testLeafReusedForSubset() {
        Scope scope = Scope.of(prices, "data", days(1, 4));

        assertTrue(scope.lookup(prices, days(2, 3)).isPresent());
        assertTrue(scope.lookup(prices, days(1, 4)).isPresent());
        assertTrue(scope.lookup(prices, days(0, 5)).isEmpty());
        assertTrue(scope.lookup(prices, days(3, 6)).isEmpty());
        assertTrue(scope.lookup(prices, days(5, 6)).isEmpty());
    }

    @Test
    @DisplayName("A leaf stored without a range is not reused under a range")
    void testUnrangedLeafNotReusedUnderRange() {
        Scope scope = Scope.of(price, "cells", null);

        assertTrue(scope.lookup(price, days(1, 2)).isEmpty());
        assertTrue(scope.lookup(price, null).isPresent());
    }

    @Test
    @DisplayName("Derived nodes are recomputed whenever a range is requested")
    void testDerivedNodeNotReusedUnderRange() {
        BinaryOp doubled = BinaryOp.of(price, BinaryOperator.MULTIPLY, Literal.of(2));
        Scope scope = Scope.of(doubled, "cells", days(1, 4));

        assertTrue(scope.lookup(doubled, days(2, 3)).isEmpty());
        assertTrue(scope.lookup(doubled, null).isPresent());
    }

    @Test
    @DisplayName("Keys are compared by identity")
    void testIdentityKeys() {
        TableColumn twin = new TableColumn(prices, "price");
        Scope scope = Scope.of(price, "cells", null);

        assertEquals(price, twin);
        assertTrue(scope.contains(price));
        assertFalse(scope.contains(twin));
    }

    @Test
    @DisplayName("Store leaves the original scope untouched")
    void testStoreIsCopyOnWrite() {
        Scope empty = Scope.empty();
        Scope one = empty.store(prices, "a", null);
        Scope replaced = one.store(prices, "b", days(1, 2));

        assertTrue(empty.isEmpty());
        assertEquals("a", one.entry(prices).value());
        assertEquals("b", replaced.entry(prices).value());
        assertEquals(days(1, 2), replaced.entry(prices).range());
    }

    @Test
    @DisplayName("Merge is a right-biased union")
    void testMergeRightBiased() {
        Scope left = Scope.of(prices, "left", days(1, 5)).store(price, "only-left", null);
        Scope right = Scope.of(prices, "right", days(2, 3));

        Scope merged = left.merge(right);

        assertEquals(2, merged.size());
        assertEquals("right", merged.entry(prices).value());
        assertEquals(days(2, 3), merged.entry(prices).range());
        assertEquals("only-left", merged.entry(price).value());
        assertSame(left, left.merge(Scope.empty()));
        assertSame(left, left.merge(null));
    }

    @Test
    @DisplayName("retainKeys filters entries by key")
    void testRetainKeys() {
        Scope scope = Scope.of(prices, "table", null).store(price, "column", null);

        Scope retained = scope.retainKeys(key -> key instanceof UnboundTable);

        assertEquals(1, retained.size());
        assertTrue(retained.contains(prices));
        assertEquals(2, scope.size());
    }

    @Test
    @DisplayName("Null keys are rejected")
    void testNullKey() {
        assertThrows(NullPointerException.class, () -> Scope.empty().store(null, "x", null));
    }
}
