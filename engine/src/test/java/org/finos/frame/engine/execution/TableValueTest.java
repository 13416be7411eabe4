package org.finos.frame.engine.execution;

import org.finos.frame.engine.TestData;
import org.finos.frame.engine.store.DataType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TableValueTest {

    @Test
    @DisplayName("Taking rows keeps their labels")
    void testTakeKeepsLabels() {
        TableValue taken = TestData.prices().take(new int[]{4, 1});

        assertEquals(List.of(4, 1), taken.index().labels().castToList());
        assertEquals(List.of(22.0, 11.0), taken.column("price").cells().castToList());
        assertEquals(taken.index(), taken.column("sym").index());
    }

    @Test
    @DisplayName("Resetting the index relabels rows densely")
    void testResetIndex() {
        TableValue reset = TestData.prices().take(new int[]{3, 2}).resetIndex();

        assertTrue(reset.index().isDense());
        assertTrue(reset.column("price").index().isDense());
    }

    @Test
    @DisplayName("Selecting columns keeps the requested order")
    void testSelect() {
        TableValue selected = TestData.prices().select(List.of("price", "time"));

        assertEquals(List.of("price", "time"), selected.columnNames());
        assertEquals(DataType.FLOAT, selected.schema().column("price").dataType());
        assertThrows(IllegalArgumentException.class, () -> selected.column("sym"));
    }

    @Test
    @DisplayName("Rows must match the schema width")
    void testRowWidth() {
        assertThrows(IllegalArgumentException.class,
                () -> TableValue.fromRows(TestData.PRICES_SCHEMA, List.of(List.of("too short"))));
    }

    @Test
    @DisplayName("Columns realign to the table's labels")
    void testColumnsAdoptTableIndex() {
        ColumnValue column = ColumnValue.of("n", DataType.INTEGER, List.of(1L, 2L));
        Index labels = Index.of(List.of("x", "y"));

        TableValue table = TableValue.fromColumns(List.of(column), labels);

        assertEquals(labels, table.column("n").index());
        assertEquals(List.of(1L, 2L), table.column("n").cells().castToList());
    }
}
