package org.finos.frame.engine.time;

/**
 * Relationship of a current range to a previously seen one.
 *
 * <p>Given a current range {@code (b1, e1)} and an old range {@code (b2, e2)}:
 * <ul>
 * <li>{@link #SUBSET}: {@code b2 <= b1} and {@code e2 >= e1}</li>
 * <li>{@link #SUPERSET}: {@code b2 >= b1} and {@code e2 <= e1}</li>
 * <li>{@link #NONOVERLAP}: {@code e2 < b1} or {@code e1 < b2}</li>
 * <li>{@link #OVERLAP}: anything else</li>
 * </ul>
 * Checked in that order, so identical ranges are a {@code SUBSET}.
 */
public enum TimeRangeRelation {
    SUBSET,
    SUPERSET,
    OVERLAP,
    NONOVERLAP
}
