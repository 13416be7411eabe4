package org.finos.frame.engine.serialization;

import org.finos.frame.engine.execution.ColumnValue;
import org.finos.frame.engine.execution.ScalarValue;
import org.finos.frame.engine.execution.TableValue;
import org.finos.frame.engine.store.Column;
import org.finos.frame.engine.store.DataType;
import org.finos.frame.engine.store.Schema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SerializerRegistryTest {

    private static final TableValue TABLE = TableValue.fromRows(
            Schema.of(Column.nullable("name", DataType.STRING), Column.nullable("score", DataType.FLOAT)),
            List.of(Arrays.asList("plain", 1.5),
                    Arrays.asList("with, comma", null),
                    Arrays.asList("say \"hi\"", Double.NaN)));

    private static String write(ResultSerializer serializer, Object value) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (value instanceof TableValue table) {
            serializer.serialize(table, out);
        } else if (value instanceof ColumnValue column) {
            serializer.serialize(column, out);
        } else {
            serializer.serialize((ScalarValue) value, out);
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Built-in formats are registered")
    void testBuiltInFormats() {
        assertTrue(SerializerRegistry.isSupported("json"));
        assertTrue(SerializerRegistry.isSupported("csv"));
        assertSame(CsvSerializer.INSTANCE, SerializerRegistry.get("csv"));
        assertEquals("application/json", SerializerRegistry.get("json").contentType());
    }

    @Test
    @DisplayName("Formats are chosen by file extension")
    void testForPath() {
        assertSame(JsonSerializer.INSTANCE, SerializerRegistry.forPath(Path.of("out", "result.JSON")));
        assertThrows(IllegalArgumentException.class, () -> SerializerRegistry.forPath(Path.of("result")));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SerializerRegistry.forPath(Path.of("result.xml")));
        assertTrue(e.getMessage().contains("xml"));
    }

    @Test
    @DisplayName("CSV quotes special characters and leaves nulls empty")
    void testCsv() throws IOException {
        String csv = write(CsvSerializer.INSTANCE, TABLE);

        assertEquals("name,score\r\nplain,1.5\r\n\"with, comma\",\r\n\"say \"\"hi\"\"\",NaN\r\n", csv);
    }

    @Test
    @DisplayName("JSON writes one object per row")
    void testJson() throws IOException {
        String json = write(JsonSerializer.INSTANCE, TABLE);

        assertEquals("[{\"name\":\"plain\",\"score\":1.5},"
                + "{\"name\":\"with, comma\",\"score\":null},"
                + "{\"name\":\"say \\\"hi\\\"\",\"score\":\"NaN\"}]", json);
    }

    @Test
    @DisplayName("Columns and scalars are written as tables")
    void testNonTableValues() throws IOException {
        ColumnValue column = ColumnValue.of("n", DataType.INTEGER, List.of(1L, 2L));

        assertEquals("n\r\n1\r\n2\r\n", write(CsvSerializer.INSTANCE, column));
        assertEquals("[{\"value\":true}]", write(JsonSerializer.INSTANCE, ScalarValue.of(true)));
    }
}
