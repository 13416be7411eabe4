package org.finos.frame.engine.backend.csv;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.finos.frame.engine.execution.Backend;
import org.finos.frame.engine.execution.EvaluationException;
import org.finos.frame.engine.execution.Index;
import org.finos.frame.engine.execution.TableValue;
import org.finos.frame.engine.execution.Value;
import org.finos.frame.engine.serialization.SerializerRegistry;
import org.finos.frame.engine.store.Column;
import org.finos.frame.engine.store.DataType;
import org.finos.frame.engine.store.Schema;
import org.finos.frame.engine.store.TableNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A backend reading tables from the CSV files of one directory.
 *
 * A table named {@code t} is the file {@code <root>/t.csv}. The first line of
 * every file is a header naming the columns.
 *
 * Usage:
 * <pre>
 * CsvBackend csv = new CsvBackend(Path.of("data"));
 * CsvTable trades = csv.table("trades");
 * Value result = Evaluator.create().execute(Selection.project(trades, ...));
 * </pre>
 */
public final class CsvBackend implements Backend {

    private static final Logger LOGGER = LoggerFactory.getLogger(CsvBackend.class);

    /**
     * Number of data rows sampled to infer a schema.
     */
    public static final int SAMPLE_ROWS = 50;

    public static final String EXTENSION = "csv";

    private static final CsvMapper MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .build();

    private final Path root;
    private final Map<String, AtomicInteger> reads = new ConcurrentHashMap<>();

    public CsvBackend(Path root) {
        this.root = Objects.requireNonNull(root, "Root directory cannot be null");
    }

    @Override
    public String name() {
        return "csv:" + root;
    }

    public Path root() {
        return root;
    }

    @Override
    public CsvTable table(String tableName) {
        return table(tableName, null, CsvReadOptions.defaults());
    }

    /**
     * Defines a table over {@code <root>/<name>.csv}.
     *
     * @param schema  The schema, or null to infer it from the first
     *                {@value #SAMPLE_ROWS} data rows
     * @param options How to read the file
     * @throws TableNotFoundException if the file does not exist
     */
    public CsvTable table(String tableName, Schema schema, CsvReadOptions options) {
        Path path = root.resolve(tableName + "." + EXTENSION);
        if (!Files.isRegularFile(path)) {
            throw new TableNotFoundException(tableName, name());
        }
        Schema resolved = schema != null ? schema : inferSchema(path, options);
        return new CsvTable(tableName, resolved, this, path, options);
    }

    /**
     * Returns the column names of a table's header row.
     */
    public List<String> header(CsvTable table) {
        try (MappingIterator<String[]> rows = open(table.path(), table.options())) {
            if (!rows.hasNext()) {
                return List.of();
            }
            return Arrays.asList(rows.next());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read header of " + table.path(), e);
        }
    }

    /**
     * Reads a table, all of its columns or only those named.
     *
     * Rows are labelled by their position in the file.
     *
     * @param columns The columns to read in schema order, or null for all
     */
    public TableValue read(CsvTable table, Collection<String> columns) {
        Schema schema = columns == null
                ? table.schema()
                : table.schema().select(table.schema().names().stream().filter(columns::contains).toList());
        LOGGER.debug("Reading {} columns {}", table.path(), schema.names());
        reads.computeIfAbsent(table.name(), t -> new AtomicInteger()).incrementAndGet();

        try (MappingIterator<String[]> rows = open(table.path(), table.options())) {
            if (!rows.hasNext()) {
                return TableValue.empty(schema);
            }
            List<String> header = Arrays.asList(rows.next());
            int[] positions = new int[schema.columnCount()];
            for (int c = 0; c < positions.length; c++) {
                positions[c] = header.indexOf(schema.columns().get(c).name());
                if (positions[c] < 0) {
                    throw new EvaluationException("Column '" + schema.columns().get(c).name()
                            + "' missing from header of " + table.path());
                }
            }
            List<List<Object>> data = new ArrayList<>();
            int line = 1;
            while (rows.hasNext()) {
                String[] fields = rows.next();
                line++;
                List<Object> row = new ArrayList<>(positions.length);
                for (int c = 0; c < positions.length; c++) {
                    String field = positions[c] < fields.length ? fields[positions[c]] : null;
                    row.add(parse(field, schema.columns().get(c), table, line));
                }
                data.add(row);
            }
            return TableValue.fromRows(schema, data, Index.range(data.size()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + table.path(), e);
        }
    }

    /**
     * Number of times a table's file was read.
     */
    public int readCount(String tableName) {
        AtomicInteger count = reads.get(tableName);
        return count == null ? 0 : count.get();
    }

    /**
     * Writes a materialized value to {@code <root>/<relativePath>}, in the
     * format given by the file extension.
     *
     * @return the written file
     */
    public Path insert(String relativePath, Value value) {
        Path path = root.resolve(relativePath);
        try (OutputStream out = Files.newOutputStream(path)) {
            SerializerRegistry.forPath(path).serialize(value, out);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + path, e);
        }
        LOGGER.debug("Wrote {}", path);
        return path;
    }

    private Schema inferSchema(Path path, CsvReadOptions options) {
        try (MappingIterator<String[]> rows = open(path, options)) {
            if (!rows.hasNext()) {
                return Schema.empty();
            }
            String[] header = rows.next();
            DataType[] types = new DataType[header.length];
            Arrays.fill(types, DataType.ANY);
            for (int sampled = 0; sampled < SAMPLE_ROWS && rows.hasNext(); sampled++) {
                String[] fields = rows.next();
                for (int c = 0; c < header.length && c < fields.length; c++) {
                    if (!CsvCells.isNull(fields[c], options)) {
                        types[c] = types[c].widen(CsvCells.infer(fields[c], options));
                    }
                }
            }
            List<Column> columns = new ArrayList<>(header.length);
            for (int c = 0; c < header.length; c++) {
                DataType type = options.columnTypes().getOrDefault(header[c],
                        types[c] == DataType.ANY ? DataType.STRING : types[c]);
                columns.add(Column.nullable(header[c], type));
            }
            return new Schema(columns);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to sample " + path, e);
        }
    }

    private Object parse(String field, Column column, CsvTable table, int line) {
        try {
            return CsvCells.parse(field, column.dataType(), table.options());
        } catch (IllegalArgumentException e) {
            throw new EvaluationException("Invalid " + column.dataType() + " value '" + field + "' for column '"
                    + column.name() + "' at line " + line + " of " + table.path(), e);
        }
    }

    private static MappingIterator<String[]> open(Path path, CsvReadOptions options) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(options.separator());
        Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        return MAPPER.readerFor(String[].class).with(schema).readValues(reader);
    }

    @Override
    public String toString() {
        return "CsvBackend(" + root + ")";
    }
}
