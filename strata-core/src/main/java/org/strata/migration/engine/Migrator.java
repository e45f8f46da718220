package org.strata.migration.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.strata.migration.dialect.Dialect;
import org.strata.migration.dialect.DialectAdapter;
import org.strata.migration.dialect.DialectCapabilities;
import org.strata.migration.error.OperationException;
import org.strata.migration.graph.GraphResolver;
import org.strata.migration.graph.RegisteredGraph;
import org.strata.migration.guard.IdempotencyGuard;
import org.strata.migration.state.JdbcStateStore;
import org.strata.migration.state.MigrationLock;
import org.strata.migration.state.StateStore;
import org.strata.model.HistoryEntry;
import org.strata.model.PathStep;

import java.lang.management.ManagementFactory;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Set;

/**
 * Entry point for one target store: resolves paths against the registered graph and runs
 * them under the migration lock.
 */
public class Migrator {

    private static final Logger log = LoggerFactory.getLogger(Migrator.class);

    private final Connection connection;
    private final Dialect dialect;
    private final RegisteredGraph graph;
    private final StateStore stateStore;
    private final GraphResolver resolver;
    private final ExecutionEngine engine;

    public Migrator(Connection connection, Dialect dialect, RegisteredGraph graph) {
        this(connection, dialect, graph, new JdbcStateStore(connection, dialect), Clock.systemUTC());
    }

    public Migrator(Connection connection, Dialect dialect, RegisteredGraph graph, StateStore stateStore, Clock clock) {
        this.connection = connection;
        this.dialect = dialect;
        this.graph = graph;
        this.stateStore = stateStore;
        this.resolver = new GraphResolver();
        this.engine = new ExecutionEngine(connection, new DialectAdapter(dialect), new IdempotencyGuard(), stateStore, clock);
    }

    public RunReport upgrade(String target) {
        return upgrade(target, CancellationToken.none());
    }

    public RunReport upgrade(String target, CancellationToken cancellation) {
        try (MigrationLock lock = new MigrationLock(connection, dialect).acquire(lockOwner())) {
            stateStore.initialize();
            List<PathStep> path = resolver.upgradePath(graph, stateStore.getCurrent(), target);
            return run(path, cancellation);
        }
    }

    public RunReport downgrade(String target) {
        return downgrade(target, CancellationToken.none());
    }

    public RunReport downgrade(String target, CancellationToken cancellation) {
        try (MigrationLock lock = new MigrationLock(connection, dialect).acquire(lockOwner())) {
            stateStore.initialize();
            List<PathStep> path = resolver.downgradePath(graph, stateStore.getCurrent(), target);
            return run(path, cancellation);
        }
    }

    /**
     * Read-only: a store that was never migrated has no current version.
     */
    public Set<String> current() {
        return stateStore.isInitialized() ? stateStore.getCurrent() : Set.of();
    }

    public List<HistoryEntry> history() {
        return stateStore.isInitialized() ? stateStore.history() : List.of();
    }

    public List<String> heads() {
        return graph.heads();
    }

    /**
     * Clears a lock left behind by a crashed run.
     *
     * @return whether a lock was held
     */
    public boolean unlock() {
        boolean released = new MigrationLock(connection, dialect).forceRelease();
        if (released) {
            log.warn("Migration lock force-released");
        }
        return released;
    }

    private RunReport run(List<PathStep> path, CancellationToken cancellation) {
        if (path.isEmpty()) {
            log.info("Nothing to do");
            return RunReport.empty();
        }
        log.info("Path: {}", path);
        DialectCapabilities capabilities;
        try {
            capabilities = dialect.capabilities(connection);
        } catch (SQLException e) {
            throw new OperationException("Failed to query " + dialect.getName() + " capabilities", e);
        }
        return engine.apply(graph, path, capabilities, cancellation);
    }

    private static String lockOwner() {
        return ManagementFactory.getRuntimeMXBean().getName();
    }
}
