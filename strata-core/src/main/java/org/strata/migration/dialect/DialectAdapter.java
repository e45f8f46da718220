package org.strata.migration.dialect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.strata.migration.operation.OperationKind;
import org.strata.migration.operation.SchemaOperation;
import org.strata.migration.rebuild.RebuildExecutor;
import org.strata.migration.rebuild.RebuildPlan;
import org.strata.migration.rebuild.RebuildPlanner;
import org.strata.model.SchemaSnapshot;

import java.sql.Connection;

/**
 * Picks direct or rebuild execution per operation from the backend's capabilities.
 */
public class DialectAdapter {

    private static final Logger log = LoggerFactory.getLogger(DialectAdapter.class);

    private final Dialect dialect;
    private final RebuildPlanner planner;
    private final RebuildExecutor rebuildExecutor;

    public DialectAdapter(Dialect dialect) {
        this(dialect, new RebuildPlanner(dialect), new RebuildExecutor(dialect));
    }

    DialectAdapter(Dialect dialect, RebuildPlanner planner, RebuildExecutor rebuildExecutor) {
        this.dialect = dialect;
        this.planner = planner;
        this.rebuildExecutor = rebuildExecutor;
    }

    public Dialect getDialect() {
        return dialect;
    }

    public static Strategy strategyFor(OperationKind kind, DialectCapabilities capabilities) {
        return capabilities.supportsInPlace(kind) ? Strategy.DIRECT : Strategy.REBUILD;
    }

    /**
     * Runs {@code op} against the live store. {@code snapshot} is the schema as inspected
     * right before this operation.
     */
    public void execute(Connection connection, SchemaOperation op, SchemaSnapshot snapshot,
                        DialectCapabilities capabilities) {
        Strategy strategy = strategyFor(op.kind(), capabilities);
        if (strategy == Strategy.DIRECT) {
            StatementExecutor.executeAll(connection, dialect.getStatements(op));
            return;
        }
        RebuildPlan plan = planner.plan(op, snapshot);
        log.info("Rebuilding table '{}' for {}", plan.table(), op.kind());
        rebuildExecutor.execute(connection, plan, snapshot);
    }
}
