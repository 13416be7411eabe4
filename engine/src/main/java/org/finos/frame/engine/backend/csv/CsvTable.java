package org.finos.frame.engine.backend.csv;

import org.finos.frame.engine.plan.PhysicalTable;
import org.finos.frame.engine.store.Schema;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A table stored in a CSV file with a header row.
 *
 * @param name    The table name, the file's base name
 * @param schema  The table schema
 * @param source  The backend the file belongs to
 * @param path    The file
 * @param options How to read the file
 */
public record CsvTable(
        String name,
        Schema schema,
        CsvBackend source,
        Path path,
        CsvReadOptions options
) implements PhysicalTable {

    public CsvTable {
        Objects.requireNonNull(name, "Table name cannot be null");
        Objects.requireNonNull(schema, "Schema cannot be null");
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(path, "Path cannot be null");
        Objects.requireNonNull(options, "Read options cannot be null");
    }

    @Override
    public List<Object> inputs() {
        return List.of(name, schema, source);
    }

    @Override
    public String toString() {
        return "CsvTable(" + name + ")";
    }
}
