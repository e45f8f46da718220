package org.strata.migration.state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.strata.migration.dialect.Dialect;
import org.strata.migration.error.LockException;
import org.strata.migration.error.OperationException;
import org.strata.options.StrataOptions;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;

/**
 * Exclusive advisory lock: a single row in a reserved table, inserted and deleted with
 * auto-commit so it is visible to other runs immediately. A second run fails fast.
 */
public class MigrationLock implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MigrationLock.class);
    private static final int LOCK_ROW_ID = 1;

    private final Connection connection;
    private final Dialect dialect;
    private final String lockTable;
    private boolean held;

    public MigrationLock(Connection connection, Dialect dialect) {
        this.connection = connection;
        this.dialect = dialect;
        this.lockTable = dialect.quoteIdentifier(StrataOptions.State.LOCK_TABLE);
    }

    /**
     * @throws LockException if another run holds the lock
     */
    public MigrationLock acquire(String owner) {
        String insert = "INSERT INTO " + lockTable + " ("
                + dialect.quoteIdentifier("id") + ", "
                + dialect.quoteIdentifier("locked_at") + ", "
                + dialect.quoteIdentifier("owner") + ") VALUES (?, ?, ?)";
        try {
            ensureTable();
            try (PreparedStatement ps = connection.prepareStatement(insert)) {
                ps.setInt(1, LOCK_ROW_ID);
                ps.setLong(2, Instant.now().toEpochMilli());
                ps.setString(3, owner);
                ps.executeUpdate();
            }
        } catch (SQLException e) {
            if (dialect.isLockContention(e) || isUniqueViolation(e) || isHeldSafely()) {
                throw new LockException("Migration lock is held by another run (" + holderOrUnknown() + ")", e);
            }
            throw new OperationException("Failed to acquire migration lock", insert, e);
        }
        held = true;
        log.debug("Acquired migration lock as '{}'", owner);
        return this;
    }

    public boolean isHeld() {
        return held;
    }

    /**
     * Removes the lock row regardless of who holds it.
     *
     * @return whether a lock row existed
     */
    public boolean forceRelease() {
        String delete = "DELETE FROM " + lockTable + " WHERE " + dialect.quoteIdentifier("id") + " = " + LOCK_ROW_ID;
        try {
            ensureTable();
            try (Statement st = connection.createStatement()) {
                return st.executeUpdate(delete) > 0;
            }
        } catch (SQLException e) {
            throw new OperationException("Failed to release migration lock", delete, e);
        } finally {
            held = false;
        }
    }

    @Override
    public void close() {
        if (held) {
            forceRelease();
            log.debug("Released migration lock");
        }
    }

    private void ensureTable() throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute("CREATE TABLE IF NOT EXISTS " + lockTable + " ("
                    + dialect.quoteIdentifier("id") + " INT NOT NULL PRIMARY KEY, "
                    + dialect.quoteIdentifier("locked_at") + " BIGINT NOT NULL, "
                    + dialect.quoteIdentifier("owner") + " VARCHAR(255))");
        }
    }

    private static boolean isUniqueViolation(SQLException e) {
        return e.getSQLState() != null && e.getSQLState().startsWith("23");
    }

    private boolean isHeldSafely() {
        try {
            return holder() != null;
        } catch (SQLException e) {
            log.debug("Could not read lock holder", e);
            return false;
        }
    }

    private String holderOrUnknown() {
        try {
            String holder = holder();
            return holder == null ? "unknown" : holder;
        } catch (SQLException e) {
            log.debug("Could not read lock holder", e);
            return "unknown";
        }
    }

    private String holder() throws SQLException {
        String sql = "SELECT " + dialect.quoteIdentifier("owner") + " FROM " + lockTable
                + " WHERE " + dialect.quoteIdentifier("id") + " = " + LOCK_ROW_ID;
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery(sql)) {
            return rs.next() ? rs.getString(1) : null;
        }
    }
}
