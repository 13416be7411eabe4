package org.finos.frame.engine.serialization;

import org.finos.frame.engine.execution.TableValue;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * JSON serializer for tables.
 *
 * Produces a JSON array of objects, where each object represents a row
 * with column names as keys. Temporal values are written as ISO-8601 strings.
 */
public final class JsonSerializer implements ResultSerializer {

    public static final JsonSerializer INSTANCE = new JsonSerializer();

    private JsonSerializer() {
    }

    @Override
    public String formatId() {
        return "json";
    }

    @Override
    public String contentType() {
        return "application/json";
    }

    @Override
    public void serialize(TableValue table, OutputStream out) throws IOException {
        try (Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8)) {
            List<String> names = table.columnNames();
            writer.write('[');
            for (int i = 0; i < table.rowCount(); i++) {
                if (i > 0) {
                    writer.write(',');
                }
                writeRow(writer, names, table.row(i));
            }
            writer.write(']');
        }
    }

    private void writeRow(Writer writer, List<String> names, List<Object> values) throws IOException {
        writer.write('{');
        for (int i = 0; i < names.size(); i++) {
            if (i > 0) {
                writer.write(',');
            }
            writer.write('"');
            writeEscaped(writer, names.get(i));
            writer.write("\":");
            writeValue(writer, values.get(i));
        }
        writer.write('}');
    }

    private void writeValue(Writer writer, Object value) throws IOException {
        if (value == null) {
            writer.write("null");
        } else if (value instanceof Boolean) {
            writer.write(value.toString());
        } else if (value instanceof Number number && isFinite(number)) {
            writer.write(value.toString());
        } else {
            writer.write('"');
            writeEscaped(writer, value.toString());
            writer.write('"');
        }
    }

    private static boolean isFinite(Number number) {
        return !(number instanceof Double d && (d.isNaN() || d.isInfinite()))
                && !(number instanceof Float f && (f.isNaN() || f.isInfinite()));
    }

    private void writeEscaped(Writer writer, String s) throws IOException {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> writer.write("\\\"");
                case '\\' -> writer.write("\\\\");
                case '\n' -> writer.write("\\n");
                case '\r' -> writer.write("\\r");
                case '\t' -> writer.write("\\t");
                default -> writer.write(c);
            }
        }
    }
}
