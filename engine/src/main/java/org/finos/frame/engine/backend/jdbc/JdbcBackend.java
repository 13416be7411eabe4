package org.finos.frame.engine.backend.jdbc;

import org.finos.frame.engine.execution.Backend;
import org.finos.frame.engine.execution.ColumnValue;
import org.finos.frame.engine.execution.EvaluationException;
import org.finos.frame.engine.execution.ScalarValue;
import org.finos.frame.engine.execution.Scope;
import org.finos.frame.engine.execution.TableValue;
import org.finos.frame.engine.execution.Value;
import org.finos.frame.engine.plan.DatabaseTable;
import org.finos.frame.engine.plan.Node;
import org.finos.frame.engine.plan.RelationNode;
import org.finos.frame.engine.plan.TableColumn;
import org.finos.frame.engine.plan.ValueNode;
import org.finos.frame.engine.store.Column;
import org.finos.frame.engine.store.DataType;
import org.finos.frame.engine.store.Schema;
import org.finos.frame.engine.store.TableNotFoundException;
import org.finos.frame.engine.time.TimeRange;
import org.finos.frame.engine.time.TimeRanges;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A backend that compiles expressions to SQL and runs them over a JDBC
 * connection.
 *
 * Usage:
 * <pre>
 * JdbcBackend duckdb = JdbcBackend.connect("jdbc:duckdb:", DuckDBDialect.INSTANCE);
 * DatabaseTable trades = duckdb.table("trades");
 * Value total = duckdb.execute(new Reduction(ReductionKind.SUM, new TableColumn(trades, "qty")));
 * </pre>
 */
public final class JdbcBackend implements Backend, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcBackend.class);

    private final Connection connection;
    private final SQLDialect dialect;

    public JdbcBackend(Connection connection, SQLDialect dialect) {
        this.connection = Objects.requireNonNull(connection, "Connection cannot be null");
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
    }

    /**
     * Opens a connection to {@code url}.
     */
    public static JdbcBackend connect(String url, SQLDialect dialect) {
        try {
            return new JdbcBackend(DriverManager.getConnection(url), dialect);
        } catch (SQLException e) {
            throw new JdbcExecutionException("Failed to connect to " + url, null, e);
        }
    }

    @Override
    public String name() {
        return dialect.name();
    }

    public Connection connection() {
        return connection;
    }

    /**
     * Looks up a table and its schema in the database catalog.
     *
     * @throws TableNotFoundException if the table does not exist
     */
    @Override
    public DatabaseTable table(String tableName) {
        List<Column> columns = new ArrayList<>();
        try {
            DatabaseMetaData metaData = connection.getMetaData();
            try (ResultSet rs = metaData.getColumns(null, null, tableName, null)) {
                while (rs.next()) {
                    DataType type = DataType.fromJdbcType(rs.getInt("DATA_TYPE"));
                    boolean nullable = rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls;
                    String name = rs.getString("COLUMN_NAME");
                    columns.add(nullable ? Column.nullable(name, type) : Column.required(name, type));
                }
            }
        } catch (SQLException e) {
            throw new JdbcExecutionException("Failed to read schema of table " + tableName, null, e);
        }
        if (columns.isEmpty()) {
            throw new TableNotFoundException(tableName, name());
        }
        return new DatabaseTable(tableName, new Schema(columns), this);
    }

    // ==================== Compilation ====================

    /**
     * Compiles {@code expr} to SQL.
     *
     * @param scope Where bound scalar parameters are found, may be null
     * @param range Restricts every table scan, may be null
     * @throws org.finos.frame.engine.dispatch.OperatorNotImplementedException
     *         if the expression uses an operator this backend cannot compile
     */
    public String compile(Node expr, Scope scope, TimeRange range) {
        SqlCompiler compiler = new SqlCompiler(this, dialect, scope, range);
        if (expr instanceof RelationNode relation) {
            return compiler.compileRelation(relation);
        }
        ValueNode value = (ValueNode) expr;
        RelationNode source = sourceOf(value);
        return switch (value.shape()) {
            case COLUMN -> compiler.compileColumn(value, source);
            case SCALAR -> compiler.compileScalar(value, source);
            case TABLE -> throw new IllegalArgumentException("Value node with table shape: " + value);
        };
    }

    // ==================== Execution ====================

    public Value execute(Node expr) {
        return execute(expr, null, Map.of());
    }

    /**
     * Compiles and runs {@code expr}. Tables materialize as tables, column
     * expressions as columns and scalar expressions as scalars.
     *
     * @param range  A time range in any accepted form, may be null
     * @param params Values of scalar parameters, may be null
     */
    public Value execute(Node expr, Object range, Map<? extends Node, ?> params) {
        TimeRange timeRange = TimeRanges.canonicalizeNullable(range);
        Scope scope = Scope.empty();
        if (params != null) {
            for (Map.Entry<? extends Node, ?> param : params.entrySet()) {
                scope = scope.store(param.getKey(), Value.wrap(param.getValue()), timeRange);
            }
        }
        String sql = compile(expr, scope, timeRange);
        TableValue result = query(sql);
        return switch (expr.shape()) {
            case TABLE -> result;
            case COLUMN -> single(result, expr).withName(((ValueNode) expr).name());
            case SCALAR -> {
                ColumnValue column = single(result, expr);
                if (column.size() != 1) {
                    throw new EvaluationException("Scalar query returned " + column.size() + " rows: " + sql);
                }
                yield new ScalarValue(column.get(0), ((ValueNode) expr).type());
            }
        };
    }

    /**
     * Runs a query and materializes its rows.
     */
    public TableValue query(String sql) {
        LOGGER.debug("Executing SQL: {}", sql);
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(sql)) {
            return JdbcResults.fromResultSet(rs);
        } catch (SQLException e) {
            throw new JdbcExecutionException("Query failed", sql, e);
        }
    }

    /**
     * Runs a statement that returns no rows.
     */
    public void update(String sql) {
        LOGGER.debug("Executing SQL: {}", sql);
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        } catch (SQLException e) {
            throw new JdbcExecutionException("Statement failed", sql, e);
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new JdbcExecutionException("Failed to close connection", null, e);
        }
    }

    private static ColumnValue single(TableValue result, Node expr) {
        if (result.columnCount() != 1) {
            throw new EvaluationException("Expected one column for " + expr + " but got " + result.columnNames());
        }
        return result.columns().get(0);
    }

    /**
     * The relation a value expression reads from: the table of its first
     * column reference, or null for a constant expression.
     */
    private static RelationNode sourceOf(Object input) {
        if (input instanceof TableColumn column) {
            return column.table();
        }
        if (input instanceof ValueNode node) {
            for (Object child : node.inputs()) {
                RelationNode source = sourceOf(child);
                if (source != null) {
                    return source;
                }
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "JdbcBackend(" + dialect.name() + ")";
    }
}
