package org.finos.frame.engine.backend.jdbc;

import org.finos.frame.engine.dispatch.OperatorModule;
import org.finos.frame.engine.dispatch.OperatorRegistry;
import org.finos.frame.engine.execution.TimeFilter;
import org.finos.frame.engine.plan.DatabaseTable;

import java.util.List;

/**
 * Lets tables of a JDBC backend take part in in-engine evaluation: the table
 * is scanned in the database and every other operator runs on the
 * materialized rows.
 */
public final class JdbcOperators implements OperatorModule {

    @Override
    public void register(OperatorRegistry registry) {
        // Full scan, then the range: row labels are scan positions for every range.
        registry.registerExecuteNode(DatabaseTable.class, List.of(JdbcBackend.class), (node, args, ctx) -> {
            JdbcBackend backend = (JdbcBackend) args.get(0);
            return TimeFilter.apply(backend.query(backend.compile(node, ctx.scope(), null)), ctx.range());
        });
    }
}
