package org.strata.migration.state;

import org.strata.migration.dialect.Dialect;
import org.strata.migration.error.OperationException;
import org.strata.model.Direction;
import org.strata.model.HistoryEntry;
import org.strata.options.StrataOptions;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * {@link StateStore} in two reserved tables: one row per current head, and an append-only
 * history with epoch-millisecond timestamps.
 */
public class JdbcStateStore implements StateStore {

    private final Connection connection;
    private final Dialect dialect;
    private final String versionTable;
    private final String historyTable;

    public JdbcStateStore(Connection connection, Dialect dialect) {
        this.connection = connection;
        this.dialect = dialect;
        this.versionTable = dialect.quoteIdentifier(StrataOptions.State.VERSION_TABLE);
        this.historyTable = dialect.quoteIdentifier(StrataOptions.State.HISTORY_TABLE);
    }

    @Override
    public void initialize() {
        execute("CREATE TABLE IF NOT EXISTS " + versionTable + " ("
                + dialect.quoteIdentifier("version_id") + " VARCHAR(255) NOT NULL PRIMARY KEY)");
        execute("CREATE TABLE IF NOT EXISTS " + historyTable + " ("
                + dialect.quoteIdentifier("seq") + " BIGINT NOT NULL PRIMARY KEY, "
                + dialect.quoteIdentifier("version_id") + " VARCHAR(255) NOT NULL, "
                + dialect.quoteIdentifier("direction") + " VARCHAR(16) NOT NULL, "
                + dialect.quoteIdentifier("applied_at") + " BIGINT NOT NULL)");
    }

    @Override
    public Set<String> getCurrent() {
        Set<String> heads = new TreeSet<>();
        String sql = "SELECT " + dialect.quoteIdentifier("version_id") + " FROM " + versionTable;
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery(sql)) {
            while (rs.next()) {
                heads.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new OperationException("Failed to read current version", sql, e);
        }
        return heads;
    }

    @Override
    public boolean isInitialized() {
        try {
            return dialect.getSchemaInspector().table(connection, StrataOptions.State.VERSION_TABLE).isPresent();
        } catch (SQLException e) {
            throw new OperationException("Failed to look up " + StrataOptions.State.VERSION_TABLE, e);
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>On an auto-commit connection the three statements are wrapped in their own
     * transaction; otherwise they join the caller's.
     */
    @Override
    public void setCurrent(Set<String> heads, HistoryEntry entry) {
        boolean ownTransaction;
        try {
            ownTransaction = connection.getAutoCommit();
            if (ownTransaction) {
                connection.setAutoCommit(false);
            }
        } catch (SQLException e) {
            throw new OperationException("Failed to begin state write", e);
        }
        try {
            writeCurrent(heads, entry);
            if (ownTransaction) {
                connection.commit();
            }
        } catch (RuntimeException | SQLException e) {
            if (ownTransaction) {
                rollback(e);
            }
            if (e instanceof RuntimeException) {
                throw (RuntimeException) e;
            }
            throw new OperationException("Failed to commit state write", e);
        } finally {
            if (ownTransaction) {
                restoreAutoCommit();
            }
        }
    }

    private void writeCurrent(Set<String> heads, HistoryEntry entry) {
        execute("DELETE FROM " + versionTable);
        String insertHead = "INSERT INTO " + versionTable + " (" + dialect.quoteIdentifier("version_id") + ") VALUES (?)";
        try (PreparedStatement ps = connection.prepareStatement(insertHead)) {
            for (String head : heads) {
                ps.setString(1, head);
                ps.executeUpdate();
            }
        } catch (SQLException e) {
            throw new OperationException("Failed to write current version", insertHead, e);
        }

        String insertHistory = "INSERT INTO " + historyTable + " ("
                + dialect.quoteIdentifier("seq") + ", "
                + dialect.quoteIdentifier("version_id") + ", "
                + dialect.quoteIdentifier("direction") + ", "
                + dialect.quoteIdentifier("applied_at") + ") VALUES (?, ?, ?, ?)";
        try (PreparedStatement ps = connection.prepareStatement(insertHistory)) {
            ps.setLong(1, nextSequence());
            ps.setString(2, entry.getVersionId());
            ps.setString(3, entry.getDirection().name());
            ps.setLong(4, entry.getAppliedAt().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new OperationException("Failed to append history", insertHistory, e);
        }
    }

    private void rollback(Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    private void restoreAutoCommit() {
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            throw new OperationException("Failed to restore auto-commit", e);
        }
    }

    @Override
    public List<HistoryEntry> history() {
        List<HistoryEntry> entries = new ArrayList<>();
        String sql = "SELECT " + dialect.quoteIdentifier("seq") + ", "
                + dialect.quoteIdentifier("version_id") + ", "
                + dialect.quoteIdentifier("direction") + ", "
                + dialect.quoteIdentifier("applied_at")
                + " FROM " + historyTable + " ORDER BY " + dialect.quoteIdentifier("seq");
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery(sql)) {
            while (rs.next()) {
                entries.add(new HistoryEntry(
                        rs.getLong(1),
                        rs.getString(2),
                        Direction.valueOf(rs.getString(3)),
                        Instant.ofEpochMilli(rs.getLong(4))));
            }
        } catch (SQLException e) {
            throw new OperationException("Failed to read history", sql, e);
        }
        return entries;
    }

    private long nextSequence() throws SQLException {
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("SELECT MAX(" + dialect.quoteIdentifier("seq") + ") FROM " + historyTable)) {
            return rs.next() ? rs.getLong(1) + 1 : 1;
        }
    }

    private void execute(String sql) {
        try (Statement st = connection.createStatement()) {
            st.execute(sql);
        } catch (SQLException e) {
            throw new OperationException("State store statement failed", sql, e);
        }
    }
}
