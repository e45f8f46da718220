package org.strata.migration.rebuild;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.strata.migration.dialect.Dialect;
import org.strata.migration.dialect.StatementExecutor;
import org.strata.migration.error.OperationException;
import org.strata.model.IndexModel;
import org.strata.model.SchemaSnapshot;
import org.strata.model.TableModel;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Copy-and-swap: create the shadow table, copy rows, swap it in, drop the old table,
 * recreate indexes.
 *
 * <p>Resumable. Leftovers of an interrupted run are recognised by their reserved names:
 * <ul>
 *   <li>retired copy present: the swap already happened, only the cleanup is left</li>
 *   <li>original missing but shadow present: the swap stopped halfway and is completed</li>
 *   <li>shadow present next to the original: reused when its structure matches the target
 *       (rows are cleared and copied again), otherwise dropped and recreated</li>
 * </ul>
 * At no point do two live copies of the table remain after this returns.
 */
public class RebuildExecutor {

    private static final Logger log = LoggerFactory.getLogger(RebuildExecutor.class);

    private final Dialect dialect;

    public RebuildExecutor(Dialect dialect) {
        this.dialect = dialect;
    }

    public void execute(Connection connection, RebuildPlan plan, SchemaSnapshot snapshot) {
        String table = plan.table();
        String shadow = dialect.getShadowTableName(table);
        String retired = dialect.getRetiredTableName(table);

        boolean hasTable = snapshot.hasTable(table);
        Optional<TableModel> leftoverShadow = snapshot.table(shadow);

        if (snapshot.hasTable(retired)) {
            log.warn("Dropping retired table '{}' left by an interrupted rebuild", retired);
            StatementExecutor.execute(connection, dialect.getDropTableSql(retired));
            if (hasTable && leftoverShadow.isEmpty()) {
                ensureIndexes(connection, plan);
                return;
            }
        }

        if (!hasTable) {
            if (leftoverShadow.isEmpty()) {
                throw new OperationException("Cannot rebuild '" + table + "': neither the table nor its shadow exists");
            }
            log.warn("Completing interrupted swap of '{}'", table);
            StatementExecutor.execute(connection, dialect.getRenameTableSql(shadow, table));
            ensureIndexes(connection, plan);
            return;
        }

        if (leftoverShadow.isPresent() && matchesTarget(leftoverShadow.get(), plan.target())) {
            log.warn("Reusing shadow table '{}' from an interrupted rebuild", shadow);
            StatementExecutor.execute(connection, "DELETE FROM " + dialect.quoteIdentifier(shadow));
        } else {
            if (leftoverShadow.isPresent()) {
                log.warn("Dropping stale shadow table '{}'", shadow);
                StatementExecutor.execute(connection, dialect.getDropTableSql(shadow));
            }
            StatementExecutor.execute(connection, dialect.getCreateShadowTableSql(plan.target(), shadow));
        }

        if (!plan.columnSources().isEmpty()) {
            StatementExecutor.execute(connection, dialect.getCopyRowsSql(table, shadow, plan.columnSources()));
        }
        StatementExecutor.executeAll(connection, dialect.getSwapTableSql(table, shadow, retired));
        ensureIndexes(connection, plan);
    }

    /**
     * Shadow tables carry no indexes and may carry unnamed foreign keys, so only columns
     * and foreign key structure are compared.
     */
    private boolean matchesTarget(TableModel shadow, TableModel target) {
        TableModel expected = target.toBuilder().name(shadow.getName()).clearIndexes().build();
        return expected.sameStructure(shadow.toBuilder().clearIndexes().build());
    }

    private void ensureIndexes(Connection connection, RebuildPlan plan) {
        if (plan.target().getIndexes().isEmpty()) return;
        TableModel live;
        try {
            live = dialect.getSchemaInspector().table(connection, plan.table())
                    .orElseThrow(() -> new OperationException("Table '" + plan.table() + "' vanished during rebuild"));
        } catch (SQLException e) {
            throw new OperationException("Failed to inspect '" + plan.table() + "' after rebuild", e);
        }
        for (IndexModel index : plan.target().getIndexes()) {
            if (live.findIndex(index.getName()).isEmpty()) {
                StatementExecutor.execute(connection, dialect.getCreateIndexSql(index.ownedBy(plan.table())));
            }
        }
    }
}
