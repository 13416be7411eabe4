package org.finos.frame.engine.backend.jdbc;

import org.finos.frame.engine.execution.TableValue;
import org.finos.frame.engine.store.Column;
import org.finos.frame.engine.store.DataType;
import org.finos.frame.engine.store.Schema;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Materializes JDBC result sets as tables.
 */
final class JdbcResults {

    private JdbcResults() {
    }

    /**
     * Creates a table from a JDBC ResultSet.
     * The ResultSet is fully consumed and can be closed after this call.
     */
    static TableValue fromResultSet(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();

        List<Column> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(Column.nullable(meta.getColumnLabel(i), DataType.fromJdbcType(meta.getColumnType(i))));
        }

        List<List<Object>> rows = new ArrayList<>();
        while (rs.next()) {
            List<Object> values = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                values.add(unwrapValue(rs.getObject(i)));
            }
            rows.add(values);
        }
        return TableValue.fromRows(new Schema(columns), rows);
    }

    /**
     * Converts JDBC temporal types to java.time values.
     */
    private static Object unwrapValue(Object value) {
        if (value instanceof java.sql.Timestamp timestamp) {
            return timestamp.toLocalDateTime();
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate();
        }
        return value;
    }
}
