package org.finos.frame.engine.time;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.AbstractMap;
import java.util.List;

import static org.finos.frame.engine.TestData.instant;
import static org.junit.jupiter.api.Assertions.*;

class TimeRangeTest {

    private static TimeRange days(int begin, int end) {
        return TimeRange.of(instant(begin), instant(end));
    }

    @Nested
    @DisplayName("compare")
    class Compare {

        @Test
        @DisplayName("A range inside the cached one is a subset")
        void testSubset() {
            assertEquals(TimeRangeRelation.SUBSET, TimeRange.compare(days(2, 3), days(1, 4)));
        }

        @Test
        @DisplayName("Equal ranges are subsets of each other")
        void testEqualIsSubset() {
            assertEquals(TimeRangeRelation.SUBSET, TimeRange.compare(days(1, 4), days(1, 4)));
        }

        @Test
        @DisplayName("A range enclosing the cached one is a superset")
        void testSuperset() {
            assertEquals(TimeRangeRelation.SUPERSET, TimeRange.compare(days(1, 6), days(2, 4)));
        }

        @Test
        @DisplayName("Disjoint ranges do not overlap")
        void testNonOverlap() {
            assertEquals(TimeRangeRelation.NONOVERLAP, TimeRange.compare(days(5, 6), days(1, 4)));
            assertEquals(TimeRangeRelation.NONOVERLAP, TimeRange.compare(days(1, 2), days(3, 4)));
        }

        @Test
        @DisplayName("Ranges sharing only part of their extent overlap")
        void testOverlap() {
            assertEquals(TimeRangeRelation.OVERLAP, TimeRange.compare(days(3, 6), days(1, 4)));
            assertEquals(TimeRangeRelation.OVERLAP, TimeRange.compare(days(1, 3), days(2, 5)));
        }

        @Test
        @DisplayName("Ranges touching at one instant overlap")
        void testTouching() {
            assertEquals(TimeRangeRelation.OVERLAP, TimeRange.compare(days(4, 6), days(1, 4)));
        }
    }

    @Nested
    @DisplayName("canonicalize")
    class Canonicalize {

        @Test
        @DisplayName("Accepts pairs of mixed timestamp types")
        void testPairs() {
            TimeRange expected = days(1, 2);

            assertEquals(expected, TimeRanges.canonicalize(expected));
            assertEquals(expected, TimeRanges.canonicalize(List.of(instant(1), instant(2))));
            assertEquals(expected, TimeRanges.canonicalize(
                    new Object[]{LocalDateTime.of(2024, 1, 1, 0, 0), "2024-01-02T00:00:00Z"}));
            assertEquals(expected, TimeRanges.canonicalize(
                    new AbstractMap.SimpleEntry<>(LocalDate.of(2024, 1, 1),
                            OffsetDateTime.of(2024, 1, 2, 1, 0, 0, 0, ZoneOffset.ofHours(1)))));
            assertEquals(expected, TimeRanges.canonicalize(List.of("2024-01-01", "2024-01-02 00:00:00")));
        }

        @Test
        @DisplayName("Rejects anything but a pair")
        void testNotAPair() {
            assertThrows(MalformedRangeException.class, () -> TimeRanges.canonicalize(instant(1)));
            assertThrows(MalformedRangeException.class,
                    () -> TimeRanges.canonicalize(List.of(instant(1), instant(2), instant(3))));
        }

        @Test
        @DisplayName("Rejects bounds that are not timestamps")
        void testNotTimestamps() {
            MalformedRangeException e = assertThrows(MalformedRangeException.class,
                    () -> TimeRanges.canonicalize(List.of("yesterday", instant(2))));
            assertTrue(e.getMessage().contains("yesterday"));
        }

        @Test
        @DisplayName("Rejects a begin after the end")
        void testReversed() {
            assertThrows(MalformedRangeException.class, () -> TimeRanges.canonicalize(List.of(instant(3), instant(2))));
        }

        @Test
        @DisplayName("A null range stays null")
        void testNull() {
            assertNull(TimeRanges.canonicalizeNullable(null));
        }
    }

    @Test
    @DisplayName("Membership is half-open")
    void testContains() {
        TimeRange range = days(2, 4);

        assertFalse(range.contains(instant(1)));
        assertTrue(range.contains(instant(2)));
        assertTrue(range.contains(instant(3)));
        assertFalse(range.contains(instant(4)));
    }

    @Test
    @DisplayName("extendBack widens the begin bound only")
    void testExtendBack() {
        TimeRange range = days(3, 5);

        assertEquals(days(1, 5), range.extendBack(Duration.ofDays(2)));
        assertEquals(TimeRange.of(Instant.MIN, instant(5)), range.extendBack(null));
        assertEquals(Instant.MIN, TimeRange.of(Instant.MIN, instant(5)).extendBack(Duration.ofDays(1)).begin());
    }
}
