package org.strata.cli.service;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.strata.migration.dialect.Dialect;
import org.strata.migration.dialect.Dialects;
import org.strata.migration.engine.Migrator;
import org.strata.migration.error.OperationException;
import org.strata.migration.graph.RegisteredGraph;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Loaded unit graph plus a lazily opened connection to the target store.
 */
public class MigrationSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MigrationSession.class);

    private final ConnectionSettings settings;
    @Getter
    private final RegisteredGraph graph;
    private Connection connection;
    private Migrator migrator;

    public MigrationSession(ConnectionSettings settings, RegisteredGraph graph) {
        this.settings = settings;
        this.graph = graph;
    }

    public Migrator getMigrator() {
        if (migrator == null) {
            if (settings.getUrl() == null || settings.getUrl().isBlank()) {
                throw new IllegalArgumentException("No database url: pass --url or set database.url in "
                        + "the active profile");
            }
            Dialect dialect = settings.getDialect() != null
                    ? Dialects.forName(settings.getDialect())
                    : Dialects.forUrl(settings.getUrl());
            try {
                connection = DriverManager.getConnection(settings.getUrl(), settings.getUser(), settings.getPassword());
            } catch (SQLException e) {
                throw new OperationException("Cannot connect to " + settings.getUrl(), e);
            }
            log.debug("Connected to {} as {}", settings.getUrl(), dialect.getName());
            migrator = new Migrator(connection, dialect, graph);
        }
        return migrator;
    }

    @Override
    public void close() {
        if (connection == null) return;
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close connection: {}", e.getMessage());
        }
    }
}
