package org.finos.frame.engine.backend.csv;

import org.finos.frame.engine.dispatch.OperatorModule;
import org.finos.frame.engine.dispatch.OperatorRegistry;
import org.finos.frame.engine.execution.Backend;
import org.finos.frame.engine.execution.ExecutionContext;
import org.finos.frame.engine.execution.Scope;
import org.finos.frame.engine.execution.TableValue;
import org.finos.frame.engine.execution.TimeFilter;
import org.finos.frame.engine.plan.Join;
import org.finos.frame.engine.plan.Limit;
import org.finos.frame.engine.plan.Node;
import org.finos.frame.engine.plan.RelationNode;
import org.finos.frame.engine.plan.Selection;
import org.finos.frame.engine.plan.SortKey;
import org.finos.frame.engine.plan.TableColumn;
import org.finos.frame.engine.time.TimeRanges;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Operators reading CSV tables.
 *
 * Before a selection is evaluated, the CSV tables feeding it are read with
 * only the columns the selection needs, when the file has all of them.
 */
public final class CsvOperators implements OperatorModule {

    private static final Logger LOGGER = LoggerFactory.getLogger(CsvOperators.class);

    @Override
    public void register(OperatorRegistry registry) {
        registry.registerExecuteNode(CsvTable.class, List.of(CsvBackend.class),
                (node, args, ctx) -> TimeFilter.apply(((CsvBackend) args.get(0)).read(node, null), ctx.range()));
        registry.registerPreExecuteAny(Selection.class, CsvBackend.class, CsvOperators::readSelectedColumns);
    }

    static Scope readSelectedColumns(Selection node, List<Backend> backends, ExecutionContext context) {
        List<CsvTable> tables = new ArrayList<>();
        Set<String> requested = new LinkedHashSet<>();
        collectSources(node.table(), tables, requested, Collections.newSetFromMap(new IdentityHashMap<>()));

        Scope result = Scope.empty();
        for (CsvTable table : tables) {
            if (context.scope().contains(table)) {
                continue;
            }
            Set<String> columns = null;
            if (!node.selections().isEmpty()) {
                Set<String> wanted = new LinkedHashSet<>(requested);
                collectColumns(node.selections(), wanted);
                collectColumns(node.predicates(), wanted);
                collectColumns(node.sortKeys(), wanted);
                if (context.range() != null) {
                    wanted.add(TimeRanges.TIME_COLUMN);
                }
                if (table.source().header(table).containsAll(wanted)) {
                    columns = wanted;
                } else {
                    LOGGER.debug("Reading all columns of {}: {} not all in header", table.name(), wanted);
                }
            }
            TableValue data = TimeFilter.apply(table.source().read(table, columns), context.range());
            result = result.store(table, data, context.range());
        }
        return result;
    }

    /**
     * Finds the CSV tables a relation reads directly, through joins and
     * limits. Nested selections and aggregations read their own sources.
     * Join keys are recorded as required columns.
     */
    private static void collectSources(RelationNode relation, List<CsvTable> tables, Set<String> requested,
                                       Set<Node> seen) {
        if (!seen.add(relation)) {
            return;
        }
        if (relation instanceof CsvTable table) {
            tables.add(table);
        } else if (relation instanceof Join join) {
            requested.addAll(join.leftKeys());
            requested.addAll(join.rightKeys());
            collectSources(join.left(), tables, requested, seen);
            collectSources(join.right(), tables, requested, seen);
        } else if (relation instanceof Limit limit) {
            collectSources(limit.table(), tables, requested, seen);
        }
    }

    /**
     * Collects the names of the columns an expression reads: the schema of a
     * whole selected relation, or every referenced column.
     */
    private static void collectColumns(Object input, Set<String> columns) {
        if (input instanceof TableColumn column) {
            columns.add(column.name());
        } else if (input instanceof RelationNode relation) {
            columns.addAll(relation.schema().names());
        } else if (input instanceof Node node) {
            for (Object child : node.inputs()) {
                collectColumns(child, columns);
            }
        } else if (input instanceof List<?> list) {
            for (Object item : list) {
                collectColumns(item, columns);
            }
        } else if (input instanceof SortKey sortKey) {
            collectColumns(sortKey.key(), columns);
        }
    }
}
