package org.finos.frame.engine.backend.csv;

import org.finos.frame.engine.TestData;
import org.finos.frame.engine.backend.memory.FrameOperators;
import org.finos.frame.engine.dispatch.OperatorRegistry;
import org.finos.frame.engine.execution.ColumnValue;
import org.finos.frame.engine.execution.EvaluationException;
import org.finos.frame.engine.execution.Evaluator;
import org.finos.frame.engine.execution.ExecutionContext;
import org.finos.frame.engine.execution.Scope;
import org.finos.frame.engine.execution.TableValue;
import org.finos.frame.engine.execution.Value;
import org.finos.frame.engine.execution.aggregation.Summarize;
import org.finos.frame.engine.plan.BinaryOp;
import org.finos.frame.engine.plan.BinaryOperator;
import org.finos.frame.engine.plan.Join;
import org.finos.frame.engine.plan.JoinKind;
import org.finos.frame.engine.plan.Literal;
import org.finos.frame.engine.plan.Reduction;
import org.finos.frame.engine.plan.ReductionKind;
import org.finos.frame.engine.plan.Selection;
import org.finos.frame.engine.plan.TableColumn;
import org.finos.frame.engine.store.DataType;
import org.finos.frame.engine.store.Schema;
import org.finos.frame.engine.store.TableNotFoundException;
import org.finos.frame.engine.time.TimeRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.finos.frame.engine.TestData.instant;
import static org.junit.jupiter.api.Assertions.*;

class CsvBackendTest {

    private static final String PRICES = String.join("\n",
            "time,sym,price,volume",
            "2024-01-01 00:00:00,A,10.0,100",
            "2024-01-02 00:00:00,A,11.0,200",
            "2024-01-03 00:00:00,B,20.0,300",
            "2024-01-04 00:00:00,A,12.0,",
            "2024-01-05 00:00:00,B,22.0,500") + "\n";

    @TempDir
    Path root;

    private CsvBackend csv;
    private Evaluator evaluator;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(root.resolve("prices.csv"), PRICES);
        Files.writeString(root.resolve("names.csv"), "sym,name,sector\nA,Apple,Tech\nB,Banana,Food\n");
        csv = new CsvBackend(root);
        evaluator = new Evaluator(OperatorRegistry.create()
                .install(new FrameOperators())
                .install(new CsvOperators()), Summarize.INSTANCE);
    }

    private ExecutionContext context(TimeRange range) {
        return new ExecutionContext(Scope.empty(), range, Summarize.INSTANCE, List.of(csv), evaluator);
    }

    private static TimeRange days(int begin, int end) {
        return TimeRange.of(instant(begin), instant(end));
    }

    @Nested
    @DisplayName("Tables")
    class Tables {

        @Test
        @DisplayName("Infers column types from a sample of rows")
        void testSchemaInference() {
            Schema schema = csv.table("prices").schema();

            assertEquals(List.of("time", "sym", "price", "volume"), schema.names());
            assertEquals(DataType.TIMESTAMP, schema.column("time").dataType());
            assertEquals(DataType.STRING, schema.column("sym").dataType());
            assertEquals(DataType.FLOAT, schema.column("price").dataType());
            assertEquals(DataType.INTEGER, schema.column("volume").dataType());
        }

        @Test
        @DisplayName("Reads typed cells with empty fields as nulls")
        void testRead() {
            TableValue data = csv.read(csv.table("prices"), null);

            assertEquals(5, data.rowCount());
            assertEquals(TestData.day(1), data.column("time").get(0));
            assertEquals(Arrays.asList(100L, 200L, 300L, null, 500L), data.column("volume").cells().castToList());
            assertTrue(data.index().isDense());
        }

        @Test
        @DisplayName("A missing file is an unknown table")
        void testTableNotFound() {
            TableNotFoundException e = assertThrows(TableNotFoundException.class, () -> csv.table("missing"));
            assertEquals("missing", e.getTableName());
        }

        @Test
        @DisplayName("Honours read options")
        void testReadOptions() throws IOException {
            // GIVEN
            Files.writeString(root.resolve("codes.csv"), "code;day;label\n007;31/01/2024;NA\n042;01/02/2024;x\n");
            CsvReadOptions options = CsvReadOptions.builder()
                    .separator(';')
                    .nullValue("NA")
                    .columnType("code", DataType.STRING)
                    .dateFormat("dd/MM/yyyy")
                    .build();

            // WHEN
            CsvTable table = csv.table("codes", null, options);
            TableValue data = csv.read(table, null);

            // THEN
            assertEquals(DataType.STRING, table.schema().column("code").dataType());
            assertEquals(DataType.DATE, table.schema().column("day").dataType());
            assertEquals(List.of("007", "042"), data.column("code").cells().castToList());
            assertEquals(LocalDate.of(2024, 1, 31), data.column("day").get(0));
            assertEquals(Arrays.asList(null, "x"), data.column("label").cells().castToList());
        }

        @Test
        @DisplayName("A cell not matching the sampled type fails with its location")
        void testBadCell() throws IOException {
            StringBuilder content = new StringBuilder("n\n");
            for (int i = 0; i < CsvBackend.SAMPLE_ROWS; i++) {
                content.append(i).append('\n');
            }
            content.append("oops\n");
            Files.writeString(root.resolve("numbers.csv"), content.toString());
            CsvTable numbers = csv.table("numbers");

            EvaluationException e = assertThrows(EvaluationException.class, () -> csv.read(numbers, null));
            assertTrue(e.getMessage().contains("oops"));
            assertTrue(e.getMessage().contains("line " + (CsvBackend.SAMPLE_ROWS + 2)));
        }
    }

    @Nested
    @DisplayName("Column pruning")
    class Pruning {

        @Test
        @DisplayName("A projection reads only the selected columns")
        void testProjectionReadsSelectedColumns() {
            // GIVEN
            CsvTable prices = csv.table("prices");
            Selection selection = Selection.project(prices,
                    List.of(new TableColumn(prices, "sym"), new TableColumn(prices, "price")));

            // WHEN
            Scope scope = CsvOperators.readSelectedColumns(selection, List.of(csv), context(null));

            // THEN
            TableValue read = (TableValue) scope.entry(prices).value();
            assertEquals(List.of("sym", "price"), read.columnNames());
        }

        @Test
        @DisplayName("Predicates and the time column count as needed columns")
        void testPredicateAndRangeColumns() {
            // GIVEN
            CsvTable prices = csv.table("prices");
            TableColumn price = new TableColumn(prices, "price");
            Selection selection = new Selection(prices, List.of(price),
                    List.of(BinaryOp.of(new TableColumn(prices, "volume"), BinaryOperator.GREATER_THAN, Literal.of(150))),
                    List.of());

            // WHEN
            Scope scope = CsvOperators.readSelectedColumns(selection, List.of(csv), context(days(2, 4)));

            // THEN
            TableValue read = (TableValue) scope.entry(prices).value();
            assertEquals(List.of("time", "price", "volume"), read.columnNames());
            assertEquals(2, read.rowCount());
            assertEquals(days(2, 4), scope.entry(prices).range());
        }

        @Test
        @DisplayName("Reads every column when a table's header lacks a needed one")
        void testFallbackToAllColumns() {
            // GIVEN
            CsvTable prices = csv.table("prices");
            CsvTable names = csv.table("names");
            Join join = new Join(prices, names,
                    List.of(BinaryOp.equalTo(new TableColumn(prices, "sym"), new TableColumn(names, "sym"))),
                    JoinKind.INNER);
            Selection selection = Selection.project(join,
                    List.of(new TableColumn(join, "price"), new TableColumn(join, "name")));

            // WHEN
            Scope scope = CsvOperators.readSelectedColumns(selection, List.of(csv), context(null));

            // THEN
            assertEquals(4, ((TableValue) scope.entry(prices).value()).columnCount());
            assertEquals(3, ((TableValue) scope.entry(names).value()).columnCount());
        }

        @Test
        @DisplayName("Tables already in scope are not read again")
        void testSkipsTablesInScope() {
            CsvTable prices = csv.table("prices");
            Selection selection = Selection.project(prices, List.of(new TableColumn(prices, "sym")));
            ExecutionContext context = context(null).withScope(Scope.of(prices, TestData.prices(), null));

            Scope scope = CsvOperators.readSelectedColumns(selection, List.of(csv), context);

            assertTrue(scope.isEmpty());
            assertEquals(0, csv.readCount("prices"));
        }

        @Test
        @DisplayName("A filter without projection reads every column")
        void testFilterReadsAllColumns() {
            CsvTable prices = csv.table("prices");
            Selection selection = Selection.filter(prices,
                    List.of(BinaryOp.equalTo(new TableColumn(prices, "sym"), Literal.of("B"))));

            Scope scope = CsvOperators.readSelectedColumns(selection, List.of(csv), context(null));

            assertEquals(4, ((TableValue) scope.entry(prices).value()).columnCount());
        }

        @Test
        @DisplayName("Evaluating a projection reads the file once")
        void testEvaluationReadsOnce() {
            // GIVEN
            CsvTable prices = csv.table("prices");
            Selection selection = Selection.project(prices, List.of(new TableColumn(prices, "price")));

            // WHEN
            TableValue result = (TableValue) evaluator.execute(selection);

            // THEN
            assertEquals(List.of(10.0, 11.0, 20.0, 12.0, 22.0), result.column("price").cells().castToList());
            assertEquals(1, csv.readCount("prices"));
        }

        @Test
        @DisplayName("Evaluating a projection over a join")
        void testEvaluateJoinSelection() {
            CsvTable prices = csv.table("prices");
            CsvTable names = csv.table("names");
            Join join = new Join(prices, names,
                    List.of(BinaryOp.equalTo(new TableColumn(prices, "sym"), new TableColumn(names, "sym"))),
                    JoinKind.INNER);
            Selection selection = Selection.project(join,
                    List.of(new TableColumn(join, "price"), new TableColumn(join, "name")));

            TableValue result = (TableValue) evaluator.execute(selection);

            assertEquals(List.of("price", "name"), result.columnNames());
            assertEquals(List.of("Apple", "Apple", "Banana", "Apple", "Banana"),
                    result.column("name").cells().castToList());
        }
    }

    @Test
    @DisplayName("Reads are restricted to the time range")
    void testRangeFilter() {
        TableColumn price = new TableColumn(csv.table("prices"), "price");

        Value result = evaluator.execute(price, Map.of(), Scope.empty(), days(2, 4), null);

        assertEquals(List.of(11.0, 20.0), ((ColumnValue) result).cells().castToList());
    }

    @Nested
    @DisplayName("Insert")
    class Insert {

        @Test
        @DisplayName("Writes a value as CSV that reads back")
        void testInsertCsv() {
            // WHEN
            csv.insert("copy.csv", TestData.prices());
            TableValue copy = csv.read(csv.table("copy"), null);

            // THEN
            assertEquals(DataType.TIMESTAMP, csv.table("copy").schema().column("time").dataType());
            assertEquals(TestData.prices().row(4), copy.row(4));
        }

        @Test
        @DisplayName("Writes a scalar as a one-cell JSON table")
        void testInsertJson() throws IOException {
            Path written = csv.insert("total.json",
                    evaluator.execute(new Reduction(ReductionKind.COUNT, new TableColumn(csv.table("prices"), "sym"))));

            assertEquals("[{\"value\":5}]", Files.readString(written));
        }

        @Test
        @DisplayName("Rejects an unknown extension")
        void testInsertUnknownFormat() {
            assertThrows(IllegalArgumentException.class, () -> csv.insert("out.parquet", TestData.prices()));
        }
    }
}
