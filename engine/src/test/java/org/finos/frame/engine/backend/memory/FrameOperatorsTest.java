package org.finos.frame.engine.backend.memory;

import org.finos.frame.engine.TestData;
import org.finos.frame.engine.dispatch.OperatorRegistry;
import org.finos.frame.engine.execution.ColumnValue;
import org.finos.frame.engine.execution.EvaluationException;
import org.finos.frame.engine.execution.Evaluator;
import org.finos.frame.engine.execution.ScalarValue;
import org.finos.frame.engine.execution.Scope;
import org.finos.frame.engine.execution.TableValue;
import org.finos.frame.engine.execution.Value;
import org.finos.frame.engine.execution.aggregation.Summarize;
import org.finos.frame.engine.plan.Aggregation;
import org.finos.frame.engine.plan.Alias;
import org.finos.frame.engine.plan.BinaryOp;
import org.finos.frame.engine.plan.BinaryOperator;
import org.finos.frame.engine.plan.DatabaseTable;
import org.finos.frame.engine.plan.Join;
import org.finos.frame.engine.plan.JoinKind;
import org.finos.frame.engine.plan.Limit;
import org.finos.frame.engine.plan.Literal;
import org.finos.frame.engine.plan.Reduction;
import org.finos.frame.engine.plan.ReductionKind;
import org.finos.frame.engine.plan.Selection;
import org.finos.frame.engine.plan.SortKey;
import org.finos.frame.engine.plan.TableColumn;
import org.finos.frame.engine.plan.WindowOp;
import org.finos.frame.engine.plan.WindowSpec;
import org.finos.frame.engine.store.Column;
import org.finos.frame.engine.store.DataType;
import org.finos.frame.engine.store.Schema;
import org.finos.frame.engine.store.TableNotFoundException;
import org.finos.frame.engine.time.TimeRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.finos.frame.engine.TestData.instant;
import static org.junit.jupiter.api.Assertions.*;

class FrameOperatorsTest {

    private MemoryBackend backend;
    private Evaluator evaluator;
    private DatabaseTable prices;
    private TableColumn time;
    private TableColumn sym;
    private TableColumn price;

    @BeforeEach
    void setUp() {
        backend = new MemoryBackend()
                .register("prices", TestData.prices())
                .register("names", TableValue.fromRows(
                        Schema.of(Column.required("sym", DataType.STRING), Column.required("name", DataType.STRING)),
                        List.of(List.of("A", "Apple"), List.of("C", "Cherry"))));
        evaluator = new Evaluator(OperatorRegistry.create().install(new FrameOperators()), Summarize.INSTANCE);
        prices = backend.table("prices");
        time = new TableColumn(prices, "time");
        sym = new TableColumn(prices, "sym");
        price = new TableColumn(prices, "price");
    }

    private static TimeRange days(int begin, int end) {
        return TimeRange.of(instant(begin), instant(end));
    }

    private static List<Object> cells(Value value) {
        return ((ColumnValue) value).cells().castToList();
    }

    private static List<Object> cells(Value table, String column) {
        return ((TableValue) table).column(column).cells().castToList();
    }

    @Nested
    @DisplayName("Selection")
    class SelectionOperator {

        @Test
        @DisplayName("Projects columns and computed values")
        void testProjection() {
            // GIVEN
            Selection selection = Selection.project(prices, List.of(
                    sym, new Alias(BinaryOp.of(price, BinaryOperator.MULTIPLY, Literal.of(2)), "doubled")));

            // WHEN
            Value result = evaluator.execute(selection);

            // THEN
            assertEquals(List.of("sym", "doubled"), ((TableValue) result).columnNames());
            assertEquals(List.of(20.0, 22.0, 40.0, 24.0, 44.0), cells(result, "doubled"));
        }

        @Test
        @DisplayName("Selecting the source relation keeps all its columns")
        void testSelectWholeTable() {
            Selection selection = Selection.project(prices, List.of(
                    prices, new Alias(BinaryOp.of(price, BinaryOperator.ADD, price), "twice")));

            TableValue result = (TableValue) evaluator.execute(selection);

            assertEquals(List.of("time", "sym", "price", "twice"), result.columnNames());
            assertEquals(20.0, result.column("twice").get(0));
        }

        @Test
        @DisplayName("Keeps only rows where every predicate is true")
        void testFilter() {
            Selection selection = Selection.filter(prices, List.of(
                    BinaryOp.equalTo(sym, Literal.of("A")),
                    BinaryOp.of(price, BinaryOperator.GREATER_THAN_OR_EQUAL, Literal.of(11))));

            Value result = evaluator.execute(selection);

            assertEquals(List.of(11.0, 12.0), cells(result, "price"));
        }

        @Test
        @DisplayName("Sorts by several keys")
        void testSort() {
            Selection selection = Selection.sort(prices, List.of(SortKey.asc(sym), SortKey.desc(price)));

            Value result = evaluator.execute(selection);

            assertEquals(List.of(12.0, 11.0, 10.0, 22.0, 20.0), cells(result, "price"));
            assertEquals(List.of(3, 1, 0, 4, 2), ((TableValue) result).index().labels().castToList());
        }
    }

    @Test
    @DisplayName("Aggregates groups in order of first appearance")
    void testAggregation() {
        // GIVEN
        Aggregation aggregation = new Aggregation(prices, List.of(
                new Alias(new Reduction(ReductionKind.SUM, price), "total"),
                new Alias(new Reduction(ReductionKind.COUNT, price), "n")), List.of(sym));

        // WHEN
        TableValue result = (TableValue) evaluator.execute(aggregation);

        // THEN
        assertEquals(List.of("sym", "total", "n"), result.columnNames());
        assertEquals(List.of("A", 33.0, 3L), result.row(0));
        assertEquals(List.of("B", 42.0, 2L), result.row(1));
    }

    @Test
    @DisplayName("Aggregates without keys into one row")
    void testAggregationWithoutKeys() {
        Aggregation aggregation = new Aggregation(prices,
                List.of(new Alias(new Reduction(ReductionKind.MEAN, price), "avg")), List.of());

        TableValue result = (TableValue) evaluator.execute(aggregation);

        assertEquals(1, result.rowCount());
        assertEquals(15.0, result.column("avg").get(0));
    }

    @Nested
    @DisplayName("Join")
    class JoinOperator {

        private DatabaseTable names;
        private BinaryOp onSym;

        @BeforeEach
        void setUp() {
            names = backend.table("names");
            onSym = BinaryOp.equalTo(sym, new TableColumn(names, "sym"));
        }

        @Test
        @DisplayName("Inner join keeps matching rows")
        void testInnerJoin() {
            TableValue result = (TableValue) evaluator.execute(new Join(prices, names, List.of(onSym), JoinKind.INNER));

            assertEquals(List.of("time", "sym", "price", "sym_right", "name"), result.columnNames());
            assertEquals(List.of(10.0, 11.0, 12.0), result.column("price").cells().castToList());
            assertEquals(List.of("Apple", "Apple", "Apple"), result.column("name").cells().castToList());
        }

        @Test
        @DisplayName("Left join pads unmatched rows with nulls")
        void testLeftJoin() {
            TableValue result = (TableValue) evaluator.execute(new Join(prices, names, List.of(onSym), JoinKind.LEFT));

            assertEquals(5, result.rowCount());
            assertEquals(Arrays.asList("Apple", "Apple", null, "Apple", null), result.column("name").cells().castToList());
        }
    }

    @Test
    @DisplayName("Limit skips then takes rows")
    void testLimit() {
        Value result = evaluator.execute(new Limit(prices, 2, 1));

        assertEquals(List.of(11.0, 20.0), cells(result, "price"));
        assertEquals(List.of(), cells(evaluator.execute(new Limit(prices, 2, 10)), "price"));
    }

    @Test
    @DisplayName("Limit larger than the remaining rows keeps every row after the offset")
    void testUnboundedLimitWithOffset() {
        Value result = evaluator.execute(new Limit(prices, Integer.MAX_VALUE, 1));

        assertEquals(List.of(11.0, 20.0, 12.0, 22.0), cells(result, "price"));
        assertEquals(List.of(1, 2, 3, 4), ((TableValue) result).index().labels().castToList());
    }

    @Test
    @DisplayName("Reductions honour a where mask")
    void testWhereReduction() {
        Reduction total = new Reduction(ReductionKind.SUM, price, BinaryOp.equalTo(sym, Literal.of("A")));

        Value result = evaluator.execute(total);

        assertEquals(33.0, ((ScalarValue) result).value());
    }

    @Test
    @DisplayName("Binary operators broadcast scalars over columns")
    void testBinaryBroadcast() {
        Value shifted = evaluator.execute(BinaryOp.of(Literal.of(100), BinaryOperator.SUBTRACT, price));
        Value halved = evaluator.execute(BinaryOp.of(price, BinaryOperator.DIVIDE, Literal.of(2)));

        assertEquals(List.of(90.0, 89.0, 80.0, 88.0, 78.0), cells(shifted));
        assertEquals(List.of(5.0, 5.5, 10.0, 6.0, 11.0), cells(halved));
    }

    @Nested
    @DisplayName("Time ranges")
    class Ranges {

        @Test
        @DisplayName("Reads keep only the rows in range")
        void testRangeFilter() {
            Value result = evaluator.execute(price, Map.of(), Scope.empty(), days(2, 4), null);

            assertEquals(List.of(11.0, 20.0), cells(result));
            assertEquals(List.of(1, 2), ((ColumnValue) result).index().labels().castToList());
        }

        @Test
        @DisplayName("Filtering a table without a time column fails")
        void testMissingTimeColumn() {
            TableColumn name = new TableColumn(backend.table("names"), "name");

            EvaluationException e = assertThrows(EvaluationException.class,
                    () -> evaluator.execute(name, Map.of(), Scope.empty(), days(1, 2), null));
            assertTrue(e.getMessage().contains("time"));
        }

        @Test
        @DisplayName("Unknown tables fail")
        void testUnknownTable() {
            assertThrows(TableNotFoundException.class, () -> backend.table("missing"));
            assertThrows(TableNotFoundException.class, () -> backend.read("missing"));
        }
    }

    @Nested
    @DisplayName("Windows")
    class Windows {

        @Test
        @DisplayName("A moving window reduces the rows within its duration")
        void testMovingWindow() {
            WindowOp moving = new WindowOp(new Reduction(ReductionKind.SUM, price), time,
                    WindowSpec.trailing(Duration.ofDays(1)));

            assertEquals(List.of(10.0, 21.0, 31.0, 32.0, 34.0), cells(evaluator.execute(moving)));
        }

        @Test
        @DisplayName("A cumulative window reduces every earlier row")
        void testCumulativeWindow() {
            WindowOp cumulative = new WindowOp(new Reduction(ReductionKind.SUM, price), time, WindowSpec.cumulative());

            assertEquals(List.of(10.0, 21.0, 41.0, 53.0, 75.0), cells(evaluator.execute(cumulative)));
        }

        @Test
        @DisplayName("Rows before the range fill the first windows and are trimmed away")
        void testMovingWindowUnderRange() {
            // GIVEN
            WindowOp moving = new WindowOp(new Reduction(ReductionKind.SUM, price), time,
                    WindowSpec.trailing(Duration.ofDays(1)));

            // WHEN
            Value result = evaluator.execute(moving, Map.of(), Scope.empty(), days(3, 6), null);

            // THEN
            assertEquals(List.of(31.0, 32.0, 34.0), cells(result));
            assertEquals(List.of(2, 3, 4), ((ColumnValue) result).index().labels().castToList());
        }

        @Test
        @DisplayName("A cumulative window reads from the start of time")
        void testCumulativeWindowUnderRange() {
            WindowOp count = new WindowOp(new Reduction(ReductionKind.COUNT, price), time, WindowSpec.cumulative());

            Value result = evaluator.execute(count, Map.of(), Scope.empty(), days(4, 6), null);

            assertEquals(List.of(4L, 5L), cells(result));
        }
    }
}
