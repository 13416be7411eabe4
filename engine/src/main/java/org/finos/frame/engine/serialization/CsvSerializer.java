package org.finos.frame.engine.serialization;

import org.finos.frame.engine.execution.TableValue;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

/**
 * CSV serializer for tables.
 *
 * Produces RFC 4180 compliant CSV with header row and no index column.
 * Values containing commas, quotes, or newlines are properly escaped; nulls are
 * written as empty fields.
 */
public final class CsvSerializer implements ResultSerializer {

    public static final CsvSerializer INSTANCE = new CsvSerializer();

    private static final char DELIMITER = ',';
    private static final char QUOTE = '"';
    private static final String LINE_ENDING = "\r\n";

    private CsvSerializer() {
    }

    @Override
    public String formatId() {
        return "csv";
    }

    @Override
    public String contentType() {
        return "text/csv";
    }

    @Override
    public void serialize(TableValue table, OutputStream out) throws IOException {
        try (Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8)) {
            writeHeader(writer, table.columnNames());
            for (int i = 0; i < table.rowCount(); i++) {
                writeRow(writer, table.row(i));
            }
        }
    }

    private void writeHeader(Writer writer, List<String> names) throws IOException {
        String header = names.stream()
                .map(this::escapeField)
                .collect(Collectors.joining(String.valueOf(DELIMITER)));
        writer.write(header);
        writer.write(LINE_ENDING);
    }

    private void writeRow(Writer writer, List<Object> values) throws IOException {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                writer.write(DELIMITER);
            }
            writer.write(formatValue(values.get(i)));
        }
        writer.write(LINE_ENDING);
    }

    private String formatValue(Object value) {
        if (value == null) {
            return "";
        }
        return escapeField(value.toString());
    }

    private String escapeField(String value) {
        boolean needsQuoting = value.indexOf(DELIMITER) >= 0
                || value.indexOf(QUOTE) >= 0
                || value.indexOf('\n') >= 0
                || value.indexOf('\r') >= 0;

        if (!needsQuoting) {
            return value;
        }

        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append(QUOTE);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == QUOTE) {
                sb.append(QUOTE);
            }
            sb.append(c);
        }
        sb.append(QUOTE);
        return sb.toString();
    }
}
