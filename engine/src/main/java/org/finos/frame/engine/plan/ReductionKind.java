package org.finos.frame.engine.plan;

/**
 * Column reductions.
 */
public enum ReductionKind {
    SUM("SUM"),
    MEAN("AVG"),
    MIN("MIN"),
    MAX("MAX"),
    COUNT("COUNT");

    private final String sql;

    ReductionKind(String sql) {
        this.sql = sql;
    }

    public String sql() {
        return sql;
    }
}
