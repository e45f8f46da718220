package org.strata.migration.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.strata.migration.dialect.DialectAdapter;
import org.strata.migration.dialect.DialectCapabilities;
import org.strata.migration.dialect.SchemaInspector;
import org.strata.migration.dialect.Strategy;
import org.strata.migration.error.UnitExecutionException;
import org.strata.migration.graph.RegisteredGraph;
import org.strata.migration.guard.IdempotencyGuard;
import org.strata.migration.operation.SchemaOperation;
import org.strata.migration.state.StateStore;
import org.strata.model.Direction;
import org.strata.model.HistoryEntry;
import org.strata.model.MigrationUnit;
import org.strata.model.PathStep;
import org.strata.model.SchemaSnapshot;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Set;

/**
 * Runs a resolved path unit by unit.
 *
 * <p>With transactional DDL each unit's operations and its state write commit together, so
 * a failure leaves the store exactly as it was before the unit. Without it, operations run
 * one by one and a failure may leave the unit partially applied; the state write is still
 * all-or-nothing, so the store keeps pointing at the previous unit and the idempotency guard
 * lets a later run pick up where this one stopped.
 */
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final Connection connection;
    private final DialectAdapter adapter;
    private final IdempotencyGuard guard;
    private final StateStore stateStore;
    private final Clock clock;

    public ExecutionEngine(Connection connection, DialectAdapter adapter, IdempotencyGuard guard,
                           StateStore stateStore, Clock clock) {
        this.connection = connection;
        this.adapter = adapter;
        this.guard = guard;
        this.stateStore = stateStore;
        this.clock = clock;
    }

    public RunReport apply(RegisteredGraph graph, List<PathStep> path, DialectCapabilities capabilities,
                           CancellationToken cancellation) {
        RunReport report = new RunReport();
        Set<String> current = stateStore.getCurrent();

        for (PathStep step : path) {
            if (cancellation.isCancelled()) {
                log.info("Run cancelled before unit '{}'", step.unitId());
                report.markCancelled();
                return report;
            }
            UnitOutcome outcome = run(graph, step, current, capabilities, cancellation);
            report.record(outcome);
            if (outcome.state() != UnitState.APPLIED) {
                report.markCancelled();
                return report;
            }
            current = graph.headsAfter(current, step.unit(), step.direction());
        }
        return report;
    }

    private UnitOutcome run(RegisteredGraph graph, PathStep step, Set<String> current,
                            DialectCapabilities capabilities, CancellationToken cancellation) {
        MigrationUnit unit = step.unit();
        Direction direction = step.direction();
        UnitState state = direction == Direction.UPGRADE ? UnitState.APPLYING : UnitState.REVERTING;
        boolean transactional = capabilities.isTransactionalDdl();
        List<SchemaOperation> operations = unit.operations(direction);
        SchemaInspector inspector = adapter.getDialect().getSchemaInspector();

        log.info("{} {} ({} operation(s))", state, unit.getId(), operations.size());

        int index = 0;
        int applied = 0;
        int skipped = 0;
        boolean autoCommit = true;
        try {
            autoCommit = connection.getAutoCommit();
            if (transactional) {
                connection.setAutoCommit(false);
            }
            for (; index < operations.size(); index++) {
                if (!transactional && cancellation.isCancelled()) {
                    log.warn("Run cancelled inside unit '{}' before operation #{}; the unit is partially applied",
                            unit.getId(), index);
                    return new UnitOutcome(unit.getId(), direction, state, applied, skipped);
                }
                SchemaOperation op = operations.get(index);
                SchemaSnapshot snapshot = inspector.snapshot(connection);
                Strategy strategy = DialectAdapter.strategyFor(op.kind(), capabilities);
                if (guard.shouldApply(op, snapshot, strategy)) {
                    adapter.execute(connection, op, snapshot, capabilities);
                    applied++;
                } else {
                    log.info("Skipping {} on '{}': already in target state", op.kind(), op.table());
                    skipped++;
                }
            }

            Set<String> heads = graph.headsAfter(current, unit, direction);
            stateStore.setCurrent(heads, HistoryEntry.of(unit.getId(), direction, clock.instant()));
            if (transactional) {
                connection.commit();
            }
            log.info("{} {} -> current {}", UnitState.APPLIED, unit.getId(), heads);
            return new UnitOutcome(unit.getId(), direction, UnitState.APPLIED, applied, skipped);
        } catch (RuntimeException | SQLException e) {
            if (transactional) {
                rollback(e);
            }
            log.error("{} {} at operation #{}", UnitState.FAILED, unit.getId(), index, e);
            throw new UnitExecutionException(unit.getId(), direction, index, e);
        } finally {
            restoreAutoCommit(autoCommit);
        }
    }

    private void rollback(Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    private void restoreAutoCommit(boolean autoCommit) {
        try {
            if (connection.getAutoCommit() != autoCommit) {
                connection.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            log.warn("Could not restore auto-commit: {}", e.getMessage());
        }
    }
}
