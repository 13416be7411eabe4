package org.finos.frame.engine.backend.jdbc;

import org.finos.frame.engine.dispatch.Hook;
import org.finos.frame.engine.dispatch.OperatorNotImplementedException;
import org.finos.frame.engine.execution.ScalarValue;
import org.finos.frame.engine.execution.Scope;
import org.finos.frame.engine.execution.ScopeEntry;
import org.finos.frame.engine.execution.UnboundDataException;
import org.finos.frame.engine.plan.Aggregation;
import org.finos.frame.engine.plan.Alias;
import org.finos.frame.engine.plan.BinaryOp;
import org.finos.frame.engine.plan.DatabaseTable;
import org.finos.frame.engine.plan.Join;
import org.finos.frame.engine.plan.Limit;
import org.finos.frame.engine.plan.Literal;
import org.finos.frame.engine.plan.Node;
import org.finos.frame.engine.plan.NodeVisitor;
import org.finos.frame.engine.plan.PhysicalTable;
import org.finos.frame.engine.plan.Reduction;
import org.finos.frame.engine.plan.RelationNode;
import org.finos.frame.engine.plan.ScalarParameter;
import org.finos.frame.engine.plan.Selection;
import org.finos.frame.engine.plan.SortKey;
import org.finos.frame.engine.plan.TableColumn;
import org.finos.frame.engine.plan.UnboundTable;
import org.finos.frame.engine.plan.ValueNode;
import org.finos.frame.engine.plan.WindowOp;
import org.finos.frame.engine.store.Column;
import org.finos.frame.engine.time.TimeRange;
import org.finos.frame.engine.time.TimeRanges;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Compiles an expression tree into a SQL query.
 *
 * Every relation becomes a {@code SELECT} over its source wrapped as a
 * subquery, so column references never need qualifying except inside joins.
 * Every table scan is restricted to the time range, when one is given.
 * Scalar parameters are inlined from the scope as literals.
 */
final class SqlCompiler implements NodeVisitor<String> {

    private static final String SOURCE_ALIAS = "t";
    private static final String LEFT_ALIAS = "l";
    private static final String RIGHT_ALIAS = "r";

    private final JdbcBackend backend;
    private final SQLDialect dialect;
    private final Scope scope;
    private final TimeRange range;

    SqlCompiler(JdbcBackend backend, SQLDialect dialect, Scope scope, TimeRange range) {
        this.backend = Objects.requireNonNull(backend, "Backend cannot be null");
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
        this.scope = scope == null ? Scope.empty() : scope;
        this.range = range;
    }

    /**
     * Generates a query returning the rows of a relation.
     */
    String compileRelation(RelationNode relation) {
        return relation.accept(this);
    }

    /**
     * Generates a query returning one column named after {@code value}.
     */
    String compileColumn(ValueNode value, RelationNode source) {
        return "SELECT " + value.accept(this) + " AS " + dialect.quoteIdentifier(value.name())
                + " FROM " + subquery(source, SOURCE_ALIAS);
    }

    /**
     * Generates a query returning a single row and column named after {@code value}.
     */
    String compileScalar(ValueNode value, RelationNode source) {
        String select = "SELECT " + value.accept(this) + " AS " + dialect.quoteIdentifier(value.name());
        return source == null ? select : select + " FROM " + subquery(source, SOURCE_ALIAS);
    }

    // ==================== Relations ====================

    @Override
    public String visit(PhysicalTable table) {
        if (!(table instanceof DatabaseTable) || table.source() != backend) {
            throw notImplemented(table);
        }
        String sql = "SELECT * FROM " + dialect.quoteIdentifier(table.name());
        String timePredicate = timePredicate();
        return timePredicate == null ? sql : sql + " WHERE " + timePredicate;
    }

    @Override
    public String visit(UnboundTable table) {
        throw new UnboundDataException(table);
    }

    @Override
    public String visit(Selection selection) {
        List<String> items = new ArrayList<>();
        if (selection.selections().isEmpty()) {
            items.add("*");
        }
        for (Node item : selection.selections()) {
            if (item == selection.table()) {
                items.add("*");
            } else if (item instanceof ValueNode value) {
                items.add(value.accept(this) + " AS " + dialect.quoteIdentifier(value.name()));
            } else {
                throw notImplemented(item);
            }
        }
        StringBuilder sql = new StringBuilder("SELECT ")
                .append(String.join(", ", items))
                .append(" FROM ")
                .append(subquery(selection.table(), SOURCE_ALIAS));
        if (!selection.predicates().isEmpty()) {
            sql.append(" WHERE ").append(selection.predicates().stream()
                    .map(p -> p.accept(this))
                    .collect(Collectors.joining(" AND ")));
        }
        if (!selection.sortKeys().isEmpty()) {
            sql.append(" ORDER BY ").append(selection.sortKeys().stream()
                    .map(this::formatSortKey)
                    .collect(Collectors.joining(", ")));
        }
        return sql.toString();
    }

    @Override
    public String visit(Aggregation aggregation) {
        List<String> items = new ArrayList<>();
        for (ValueNode key : aggregation.by()) {
            items.add(key.accept(this) + " AS " + dialect.quoteIdentifier(key.name()));
        }
        for (ValueNode metric : aggregation.metrics()) {
            items.add(metric.accept(this) + " AS " + dialect.quoteIdentifier(metric.name()));
        }
        String sql = "SELECT " + String.join(", ", items) + " FROM " + subquery(aggregation.table(), SOURCE_ALIAS);
        if (aggregation.by().isEmpty()) {
            return sql;
        }
        return sql + " GROUP BY " + aggregation.by().stream()
                .map(k -> k.accept(this))
                .collect(Collectors.joining(", "));
    }

    @Override
    public String visit(Join join) {
        List<String> items = new ArrayList<>();
        for (Column column : join.left().schema().columns()) {
            items.add(qualified(LEFT_ALIAS, column.name()));
        }
        for (Column column : join.right().schema().columns()) {
            items.add(qualified(RIGHT_ALIAS, column.name()) + " AS "
                    + dialect.quoteIdentifier(join.rightOutputName(column.name())));
        }
        List<String> conditions = new ArrayList<>();
        List<String> leftKeys = join.leftKeys();
        List<String> rightKeys = join.rightKeys();
        for (int i = 0; i < leftKeys.size(); i++) {
            conditions.add(qualified(LEFT_ALIAS, leftKeys.get(i)) + " = " + qualified(RIGHT_ALIAS, rightKeys.get(i)));
        }
        return "SELECT " + String.join(", ", items)
                + " FROM " + subquery(join.left(), LEFT_ALIAS)
                + " " + join.kind().toSql() + " " + subquery(join.right(), RIGHT_ALIAS)
                + " ON " + String.join(" AND ", conditions);
    }

    @Override
    public String visit(Limit limit) {
        String sql = "SELECT * FROM " + subquery(limit.table(), SOURCE_ALIAS) + " LIMIT " + limit.n();
        return limit.offset() == 0 ? sql : sql + " OFFSET " + limit.offset();
    }

    // ==================== Values ====================

    @Override
    public String visit(Literal literal) {
        return formatLiteral(literal.value());
    }

    @Override
    public String visit(ScalarParameter parameter) {
        ScopeEntry entry = scope.entry(parameter);
        if (entry == null || !(entry.value() instanceof ScalarValue value)) {
            throw new UnboundDataException(parameter);
        }
        return formatLiteral(value.value());
    }

    @Override
    public String visit(TableColumn column) {
        return dialect.quoteIdentifier(column.name());
    }

    @Override
    public String visit(Alias alias) {
        return alias.arg().accept(this);
    }

    @Override
    public String visit(BinaryOp binaryOp) {
        return "(" + binaryOp.left().accept(this) + " " + binaryOp.operator().sql() + " "
                + binaryOp.right().accept(this) + ")";
    }

    @Override
    public String visit(Reduction reduction) {
        String arg = reduction.arg().accept(this);
        if (reduction.where() != null) {
            arg = "CASE WHEN " + reduction.where().accept(this) + " THEN " + arg + " END";
        }
        return reduction.kind().sql() + "(" + arg + ")";
    }

    @Override
    public String visit(WindowOp windowOp) {
        throw notImplemented(windowOp);
    }

    // ==================== Helpers ====================

    private String subquery(RelationNode relation, String alias) {
        return "(" + relation.accept(this) + ") AS " + dialect.quoteIdentifier(alias);
    }

    private String qualified(String alias, String column) {
        return dialect.quoteIdentifier(alias) + "." + dialect.quoteIdentifier(column);
    }

    private String formatSortKey(SortKey sortKey) {
        return sortKey.key().accept(this) + (sortKey.ascending() ? " ASC" : " DESC") + " NULLS LAST";
    }

    private String timePredicate() {
        if (range == null) {
            return null;
        }
        String time = dialect.quoteIdentifier(TimeRanges.TIME_COLUMN);
        String upper = time + " < " + dialect.formatTimestamp(range.end());
        if (range.begin().equals(Instant.MIN)) {
            return upper;
        }
        return time + " >= " + dialect.formatTimestamp(range.begin()) + " AND " + upper;
    }

    private String formatLiteral(Object value) {
        if (value == null) {
            return dialect.formatNull();
        }
        if (value instanceof Boolean b) {
            return dialect.formatBoolean(b);
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof Number) {
            return value.toString();
        }
        if (value instanceof LocalDate date) {
            return dialect.formatDate(date);
        }
        if (value instanceof LocalDateTime dateTime) {
            return dialect.formatTimestamp(dateTime);
        }
        Instant instant = value instanceof String ? null : TimeRanges.toInstant(value);
        if (instant != null) {
            return dialect.formatTimestamp(instant);
        }
        return dialect.quoteStringLiteral(value.toString());
    }

    private static OperatorNotImplementedException notImplemented(Node node) {
        return new OperatorNotImplementedException(Hook.EXECUTE_NODE, List.of(node.getClass(), JdbcBackend.class));
    }
}
