package org.finos.frame.engine.plan;

import org.finos.frame.engine.store.DataType;

import java.util.List;
import java.util.Objects;

/**
 * A reference to one column of a table-valued node.
 *
 * @param table The table the column belongs to
 * @param name  The column name, present in the table's schema
 */
public record TableColumn(RelationNode table, String name) implements ValueNode, RangeSensitiveLeaf {

    public TableColumn {
        Objects.requireNonNull(table, "Table cannot be null");
        Objects.requireNonNull(name, "Column name cannot be null");
        if (!table.schema().contains(name)) {
            throw new IllegalArgumentException("Column " + name + " not in schema " + table.schema().names());
        }
    }

    @Override
    public DataType type() {
        return table.schema().column(name).dataType();
    }

    @Override
    public List<Object> inputs() {
        return List.of(table, name);
    }

    @Override
    public Shape shape() {
        return Shape.COLUMN;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "TableColumn(" + name + ")";
    }
}
