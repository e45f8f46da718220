package org.strata.migration.dialect.sqlite;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.strata.migration.dialect.AbstractDialect;
import org.strata.migration.dialect.DialectCapabilities;
import org.strata.migration.dialect.SchemaInspector;
import org.strata.model.ColumnModel;
import org.strata.model.ForeignKeyModel;
import org.strata.model.IndexModel;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * SQLite. DDL is transactional, but {@code ALTER TABLE} only knows add/rename/drop column,
 * so column alteration and foreign key changes go through a rebuild.
 */
public class SqliteDialect extends AbstractDialect {

    private static final Logger log = LoggerFactory.getLogger(SqliteDialect.class);

    // SQLITE_BUSY, SQLITE_LOCKED (primary result codes)
    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;

    private final SchemaInspector inspector = new SqliteSchemaInspector();

    @Override
    public String getName() {
        return "sqlite";
    }

    @Override
    public String quoteIdentifier(String raw) {
        return "\"" + raw.replace("\"", "\"\"") + "\"";
    }

    @Override
    public DialectCapabilities capabilities(Connection connection) throws SQLException {
        String version = connection.getMetaData().getDatabaseProductVersion();
        int[] v = parseVersion(version);
        DialectCapabilities caps = DialectCapabilities.builder()
                .transactionalDdl(true)
                .inPlaceRenameColumn(atLeast(v, 3, 25))
                .inPlaceDropColumn(atLeast(v, 3, 35))
                .inPlaceAlterColumn(false)
                .inPlaceForeignKeys(false)
                .build();
        log.debug("SQLite {} capabilities: {}", version, caps);
        return caps;
    }

    @Override
    public SchemaInspector getSchemaInspector() {
        return inspector;
    }

    // Table

    @Override
    public String openCreateTable(String tableName) {
        return "CREATE TABLE " + quoteIdentifier(tableName) + " (\n";
    }

    @Override
    public String closeCreateTable() {
        return "\n)";
    }

    // Column

    @Override
    public String getColumnDefinitionSql(ColumnModel c, List<String> pkColumns) {
        if (isInlinePrimaryKey(List.of(c), pkColumns)) {
            // AUTOINCREMENT는 INTEGER PRIMARY KEY 컬럼에만 허용
            return quoteIdentifier(c.getName()) + " INTEGER PRIMARY KEY AUTOINCREMENT";
        }
        return super.getColumnDefinitionSql(c, pkColumns);
    }

    @Override
    public boolean isInlinePrimaryKey(List<ColumnModel> columns, List<String> pkColumns) {
        if (pkColumns == null || pkColumns.size() != 1) return false;
        return columns.stream()
                .anyMatch(c -> c.isAutoIncrement() && c.getName().equalsIgnoreCase(pkColumns.get(0)));
    }

    @Override
    protected String getAlterColumnSql(String table, ColumnModel from, ColumnModel to) {
        throw new UnsupportedOperationException("SQLite cannot alter column '" + to.getName() + "' in place");
    }

    // Constraints & indexes

    @Override
    protected String getAddForeignKeySql(ForeignKeyModel fk) {
        throw new UnsupportedOperationException("SQLite cannot add a foreign key to existing table '" + fk.getTable() + "'");
    }

    @Override
    protected String getDropForeignKeySql(ForeignKeyModel fk) {
        throw new UnsupportedOperationException("SQLite cannot drop a foreign key from table '" + fk.getTable() + "'");
    }

    @Override
    protected String getDropIndexSql(IndexModel index) {
        return "DROP INDEX " + quoteIdentifier(index.getName());
    }

    // Rebuild

    @Override
    public List<String> getSwapTableSql(String table, String shadow, String retired) {
        // 트랜잭션 안에서 실행되므로 retired 단계 없이 바로 교체
        return List.of(getDropTableSql(table), getRenameTableSql(shadow, table));
    }

    @Override
    public boolean isLockContention(SQLException e) {
        int primary = e.getErrorCode() & 0xff;
        return primary == SQLITE_BUSY || primary == SQLITE_LOCKED;
    }

    static int[] parseVersion(String version) {
        int[] parts = new int[3];
        if (version == null) return parts;
        String[] tokens = version.trim().split("[^0-9]+");
        for (int i = 0; i < parts.length && i < tokens.length; i++) {
            if (!tokens[i].isEmpty()) {
                parts[i] = Integer.parseInt(tokens[i]);
            }
        }
        return parts;
    }

    private static boolean atLeast(int[] v, int major, int minor) {
        return v[0] > major || (v[0] == major && v[1] >= minor);
    }
}
