package org.finos.frame.engine.execution;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.finos.frame.engine.plan.Shape;
import org.finos.frame.engine.store.Column;
import org.finos.frame.engine.store.Schema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A table of equally long columns sharing one row index.
 */
public record TableValue(ImmutableList<ColumnValue> columns, Index index) implements Value {

    public TableValue {
        Objects.requireNonNull(columns, "Table columns cannot be null");
        Objects.requireNonNull(index, "Table index cannot be null");
        MutableList<ColumnValue> aligned = Lists.mutable.withInitialCapacity(columns.size());
        for (ColumnValue column : columns) {
            if (column.size() != index.size()) {
                throw new IllegalArgumentException("Column '" + column.name() + "' has " + column.size()
                        + " cells but the table has " + index.size() + " rows");
            }
            aligned.add(column.index().equals(index) ? column : column.withIndex(index));
        }
        columns = aligned.toImmutable();
    }

    /**
     * Builds a table from columns that already share the same labels.
     */
    public static TableValue fromColumns(List<ColumnValue> columns, Index index) {
        return new TableValue(Lists.immutable.withAll(columns), index);
    }

    /**
     * Builds a table from row-major data with a dense index.
     */
    public static TableValue fromRows(Schema schema, List<? extends List<?>> rows) {
        return fromRows(schema, rows, Index.range(rows.size()));
    }

    /**
     * Builds a table from row-major data with the given labels.
     */
    public static TableValue fromRows(Schema schema, List<? extends List<?>> rows, Index index) {
        List<MutableList<Object>> cells = new ArrayList<>();
        for (int c = 0; c < schema.columnCount(); c++) {
            cells.add(Lists.mutable.withInitialCapacity(rows.size()));
        }
        for (List<?> row : rows) {
            if (row.size() != schema.columnCount()) {
                throw new IllegalArgumentException(
                        "Row has " + row.size() + " values but schema has " + schema.columnCount() + " columns");
            }
            for (int c = 0; c < row.size(); c++) {
                cells.get(c).add(row.get(c));
            }
        }
        MutableList<ColumnValue> columns = Lists.mutable.empty();
        for (int c = 0; c < schema.columnCount(); c++) {
            Column column = schema.columns().get(c);
            columns.add(new ColumnValue(column.name(), column.dataType(), cells.get(c).toImmutable(), index));
        }
        return new TableValue(columns.toImmutable(), index);
    }

    public static TableValue empty(Schema schema) {
        return fromRows(schema, List.of());
    }

    public int rowCount() {
        return index.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public List<String> columnNames() {
        return columns.collect(ColumnValue::name).castToList();
    }

    public Schema schema() {
        return new Schema(columns.collect(c -> Column.nullable(c.name(), c.type())).castToList());
    }

    public boolean hasColumn(String name) {
        return columns.anySatisfy(c -> c.name().equals(name));
    }

    /**
     * Returns the column with the given name.
     *
     * @throws IllegalArgumentException if there is no such column
     */
    public ColumnValue column(String name) {
        ColumnValue column = columns.detect(c -> c.name().equals(name));
        if (column == null) {
            throw new IllegalArgumentException("Column '" + name + "' not found in " + columnNames());
        }
        return column;
    }

    /**
     * Returns the row at {@code position} in column order.
     */
    public List<Object> row(int position) {
        List<Object> row = new ArrayList<>(columns.size());
        for (ColumnValue column : columns) {
            row.add(column.get(position));
        }
        return row;
    }

    /**
     * Projects the named columns, in the order given.
     */
    public TableValue select(Collection<String> names) {
        MutableList<ColumnValue> selected = Lists.mutable.withInitialCapacity(names.size());
        for (String name : names) {
            selected.add(column(name));
        }
        return new TableValue(selected.toImmutable(), index);
    }

    /**
     * Selects the rows at the given positions, keeping their labels.
     */
    public TableValue take(int[] positions) {
        return new TableValue(columns.collect(c -> c.take(positions)), index.take(positions));
    }

    public TableValue resetIndex() {
        return new TableValue(columns, Index.range(rowCount()));
    }

    @Override
    public Shape shape() {
        return Shape.TABLE;
    }
}
