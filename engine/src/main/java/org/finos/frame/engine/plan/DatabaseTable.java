package org.finos.frame.engine.plan;

import org.finos.frame.engine.execution.Backend;
import org.finos.frame.engine.store.Schema;

import java.util.List;
import java.util.Objects;

/**
 * A named table held by a backend (in-memory catalog or JDBC connection).
 *
 * @param name   The table name in the backend
 * @param schema The table schema
 * @param source The backend holding the data
 */
public record DatabaseTable(
        String name,
        Schema schema,
        Backend source
) implements PhysicalTable {

    public DatabaseTable {
        Objects.requireNonNull(name, "Table name cannot be null");
        Objects.requireNonNull(schema, "Schema cannot be null");
        Objects.requireNonNull(source, "Source cannot be null");
    }

    @Override
    public List<Object> inputs() {
        return List.of(name, schema, source);
    }

    @Override
    public String toString() {
        return "DatabaseTable(" + name + " @ " + source.name() + ")";
    }
}
