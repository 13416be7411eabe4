package org.finos.frame.engine.backend.memory;

import org.finos.frame.engine.execution.Backend;
import org.finos.frame.engine.execution.TableValue;
import org.finos.frame.engine.plan.DatabaseTable;
import org.finos.frame.engine.store.TableNotFoundException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A catalog of named in-memory tables.
 *
 * Registered tables are re-labelled densely, so the row labels of any read are
 * the rows' positions in the registered data.
 */
public final class MemoryBackend implements Backend {

    private final String name;
    private final Map<String, TableValue> tables = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> reads = new ConcurrentHashMap<>();

    public MemoryBackend() {
        this("memory");
    }

    public MemoryBackend(String name) {
        this.name = Objects.requireNonNull(name, "Backend name cannot be null");
    }

    /**
     * Registers or replaces a table.
     */
    public MemoryBackend register(String tableName, TableValue data) {
        Objects.requireNonNull(tableName, "Table name cannot be null");
        tables.put(tableName, data.resetIndex());
        return this;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public DatabaseTable table(String tableName) {
        return new DatabaseTable(tableName, data(tableName).schema(), this);
    }

    /**
     * Returns the registered data of a table and counts the read.
     *
     * @throws TableNotFoundException if no such table is registered
     */
    public TableValue read(String tableName) {
        TableValue data = data(tableName);
        reads.computeIfAbsent(tableName, t -> new AtomicInteger()).incrementAndGet();
        return data;
    }

    /**
     * Number of times a table's data was read during evaluations.
     */
    public int readCount(String tableName) {
        AtomicInteger count = reads.get(tableName);
        return count == null ? 0 : count.get();
    }

    public List<String> tableNames() {
        return new ArrayList<>(tables.keySet());
    }

    private TableValue data(String tableName) {
        TableValue data = tables.get(tableName);
        if (data == null) {
            throw new TableNotFoundException(tableName, name);
        }
        return data;
    }

    @Override
    public String toString() {
        return "MemoryBackend(" + name + ")";
    }
}
