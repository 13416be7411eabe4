package org.finos.frame.engine.store;

/**
 * Exception thrown when a named table is absent from a backend's catalog.
 */
public class TableNotFoundException extends RuntimeException {

    private final String tableName;

    public TableNotFoundException(String tableName, String backend) {
        super("Table not found: " + tableName + " in " + backend);
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
