package org.finos.frame.engine.plan;

/**
 * Supported join kinds.
 */
public enum JoinKind {
    INNER("INNER JOIN"),
    LEFT("LEFT OUTER JOIN");

    private final String sql;

    JoinKind(String sql) {
        this.sql = sql;
    }

    public String toSql() {
        return sql;
    }
}
