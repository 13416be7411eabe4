package org.finos.frame.engine.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Ordered list of columns describing a table.
 * Column names are unique.
 */
public record Schema(List<Column> columns) {

    public Schema {
        Objects.requireNonNull(columns, "Columns cannot be null");
        columns = List.copyOf(columns);
        long distinct = columns.stream().map(Column::name).distinct().count();
        if (distinct != columns.size()) {
            throw new IllegalArgumentException("Duplicate column names in schema: " + columns);
        }
    }

    public static Schema of(Column... columns) {
        return new Schema(List.of(columns));
    }

    public static Schema empty() {
        return new Schema(List.of());
    }

    public int columnCount() {
        return columns.size();
    }

    public List<String> names() {
        return columns.stream().map(Column::name).toList();
    }

    public boolean contains(String name) {
        return indexOf(name) >= 0;
    }

    public int indexOf(String name) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Gets a column by name.
     *
     * @throws IllegalArgumentException if the column is absent
     */
    public Column column(String name) {
        int index = indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Column not found: " + name + " in " + names());
        }
        return columns.get(index);
    }

    /**
     * Projects the schema to the given column names, in the given order.
     */
    public Schema select(Collection<String> names) {
        List<Column> selected = new ArrayList<>(names.size());
        for (String name : names) {
            selected.add(column(name));
        }
        return new Schema(selected);
    }
}
