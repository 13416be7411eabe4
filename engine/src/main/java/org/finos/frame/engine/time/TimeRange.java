package org.finos.frame.engine.time;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A two-sided time range used to bound what data a node reads. Range
 * comparison treats both bounds as closed; row membership through
 * {@link #contains} is half-open, {@code [begin, end)}.
 *
 * @param begin The earliest instant
 * @param end   The latest instant, never before {@code begin}
 */
public record TimeRange(Instant begin, Instant end) {

    public TimeRange {
        Objects.requireNonNull(begin, "Range begin cannot be null");
        Objects.requireNonNull(end, "Range end cannot be null");
        if (begin.isAfter(end)) {
            throw new MalformedRangeException(
                    "begin time " + begin + " must be before or equal to end time " + end);
        }
    }

    public static TimeRange of(Instant begin, Instant end) {
        return new TimeRange(begin, end);
    }

    /**
     * Classifies this range against a previously cached one.
     */
    public TimeRangeRelation compareTo(TimeRange old) {
        return compare(this, old);
    }

    public static TimeRangeRelation compare(TimeRange current, TimeRange old) {
        if (!old.begin.isAfter(current.begin) && !old.end.isBefore(current.end)) {
            return TimeRangeRelation.SUBSET;
        }
        if (!old.begin.isBefore(current.begin) && !old.end.isAfter(current.end)) {
            return TimeRangeRelation.SUPERSET;
        }
        if (old.end.isBefore(current.begin) || current.end.isBefore(old.begin)) {
            return TimeRangeRelation.NONOVERLAP;
        }
        return TimeRangeRelation.OVERLAP;
    }

    /**
     * Half-open membership test {@code begin <= t < end}, used when filtering rows
     * by their time column.
     */
    public boolean contains(Instant instant) {
        return !instant.isBefore(begin) && instant.isBefore(end);
    }

    /**
     * Returns a range whose begin is moved back by {@code lookBack}.
     * A {@code null} look-back means unbounded and clamps to {@link Instant#MIN}.
     */
    public TimeRange extendBack(Duration lookBack) {
        if (lookBack == null) {
            return new TimeRange(Instant.MIN, end);
        }
        Instant shifted;
        try {
            shifted = begin.minus(lookBack);
        } catch (java.time.DateTimeException | ArithmeticException e) {
            shifted = Instant.MIN;
        }
        return new TimeRange(shifted, end);
    }

    @Override
    public String toString() {
        return "[" + begin + ", " + end + "]";
    }
}
