package org.strata.migration.dialect.mysql;

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
 * MySQL / InnoDB. Every structural change runs in place, but each DDL statement commits
 * implicitly, so units run in op-by-op mode.
 */
public class MySqlDialect extends AbstractDialect {

    private static final int ER_LOCK_WAIT_TIMEOUT = 1205;
    private static final int ER_LOCK_DEADLOCK = 1213;

    private final SchemaInspector inspector = new MySqlSchemaInspector();

    @Override
    public String getName() {
        return "mysql";
    }

    @Override
    public String quoteIdentifier(String raw) {
        return "`" + raw.replace("`", "``") + "`";
    }

    @Override
    public DialectCapabilities capabilities(Connection connection) {
        return DialectCapabilities.builder()
                .transactionalDdl(false)
                .inPlaceDropColumn(true)
                .inPlaceRenameColumn(true)
                .inPlaceAlterColumn(true)
                .inPlaceForeignKeys(true)
                .build();
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
        return "\n) ENGINE=InnoDB";
    }

    @Override
    public String getRenameTableSql(String from, String to) {
        return "RENAME TABLE " + quoteIdentifier(from) + " TO " + quoteIdentifier(to);
    }

    /**
     * FK 이름은 스키마 단위로 유일해야 하므로 shadow 테이블의 FK는 이름 없이 생성한다.
     */
    @Override
    protected boolean foreignKeyNamesAreTableScoped() {
        return false;
    }

    // Column

    @Override
    public String getColumnDefinitionSql(ColumnModel c, List<String> pkColumns) {
        StringBuilder sb = new StringBuilder();
        sb.append(quoteIdentifier(c.getName())).append(" ").append(c.getType());
        if (!c.isNullable() || c.isPrimaryKey()) {
            sb.append(" NOT NULL");
        }
        if (c.isAutoIncrement()) {
            sb.append(" AUTO_INCREMENT");
        } else if (c.getDefaultValue() != null) {
            sb.append(" DEFAULT ").append(c.getDefaultValue());
        }
        return sb.toString();
    }

    @Override
    protected String getAlterColumnSql(String table, ColumnModel from, ColumnModel to) {
        return "ALTER TABLE " + quoteIdentifier(table) + " MODIFY COLUMN " + getColumnDefinitionSql(to, List.of());
    }

    // Constraints & indexes

    @Override
    protected String getDropForeignKeySql(ForeignKeyModel fk) {
        if (fk.getName() == null || fk.getName().isBlank()) {
            throw new IllegalArgumentException("MySQL needs the constraint name to drop a foreign key on '" + fk.getTable() + "'");
        }
        return "ALTER TABLE " + quoteIdentifier(fk.getTable()) + " DROP FOREIGN KEY " + quoteIdentifier(fk.getName());
    }

    @Override
    protected String getDropIndexSql(IndexModel index) {
        if (index.getName() == null || index.getName().isBlank()) {
            throw new IllegalArgumentException("Index name must not be null/blank");
        }
        return "DROP INDEX " + quoteIdentifier(index.getName()) + " ON " + quoteIdentifier(index.getTable());
    }

    // Rebuild

    /**
     * {@code RENAME TABLE} swaps both names atomically; the retired copy is dropped afterwards.
     */
    @Override
    public List<String> getSwapTableSql(String table, String shadow, String retired) {
        return List.of(
                "RENAME TABLE " + quoteIdentifier(table) + " TO " + quoteIdentifier(retired)
                        + ", " + quoteIdentifier(shadow) + " TO " + quoteIdentifier(table),
                getDropTableSql(retired));
    }

    @Override
    public boolean isLockContention(SQLException e) {
        return e.getErrorCode() == ER_LOCK_WAIT_TIMEOUT || e.getErrorCode() == ER_LOCK_DEADLOCK;
    }
}
