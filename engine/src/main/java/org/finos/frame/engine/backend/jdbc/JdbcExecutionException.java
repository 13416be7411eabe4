package org.finos.frame.engine.backend.jdbc;

import org.finos.frame.engine.execution.EvaluationException;

import java.sql.SQLException;

/**
 * Exception thrown when a statement sent to a JDBC backend fails.
 */
public class JdbcExecutionException extends EvaluationException {

    private final String sql;

    public JdbcExecutionException(String message, String sql, SQLException cause) {
        super(message + (sql == null ? "" : ": " + sql), cause);
        this.sql = sql;
    }

    public String getSql() {
        return sql;
    }
}
