package org.strata.migration.dialect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.strata.migration.error.OperationException;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Runs rendered statements, translating driver failures into {@link OperationException}
 * that carries the offending statement.
 */
public final class StatementExecutor {

    private static final Logger log = LoggerFactory.getLogger(StatementExecutor.class);

    private StatementExecutor() {
    }

    public static void execute(Connection connection, String sql) {
        log.debug("SQL: {}", sql);
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        } catch (SQLException e) {
            throw new OperationException("Statement failed: " + e.getMessage(), sql, e);
        }
    }

    public static void executeAll(Connection connection, List<String> statements) {
        for (String sql : statements) {
            execute(connection, sql);
        }
    }
}
