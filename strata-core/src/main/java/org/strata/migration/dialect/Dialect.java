package org.strata.migration.dialect;

import org.strata.migration.operation.SchemaOperation;
import org.strata.model.ColumnModel;
import org.strata.model.ForeignKeyModel;
import org.strata.model.IndexModel;
import org.strata.model.TableModel;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

public interface Dialect {

    /** Reserved prefix of the shadow table built during a rebuild. */
    String SHADOW_PREFIX = "_strata_shadow_";
    /** Reserved prefix of the original table while it is being swapped out. */
    String RETIRED_PREFIX = "_strata_old_";

    String getName();

    String quoteIdentifier(String raw);

    /**
     * Queries the backend once for what it can do in place.
     */
    DialectCapabilities capabilities(Connection connection) throws SQLException;

    SchemaInspector getSchemaInspector();

    /**
     * Statements that perform {@code op} directly. Only called when the adapter chose the
     * direct strategy for the operation's kind.
     */
    List<String> getStatements(SchemaOperation op);

    // Table
    String openCreateTable(String tableName);
    String closeCreateTable();
    List<String> getCreateTableSql(TableModel table);
    String getCreateShadowTableSql(TableModel target, String shadowName);
    String getDropTableSql(String tableName);
    String getRenameTableSql(String from, String to);

    // Column / constraints
    String getColumnDefinitionSql(ColumnModel column, List<String> pkColumns);
    String getPrimaryKeyDefinitionSql(List<String> pkColumns);
    String getForeignKeyDefinitionSql(ForeignKeyModel fk);
    String getCreateIndexSql(IndexModel index);

    /**
     * @return whether the primary key is declared inline on its (single, auto-increment) column
     */
    default boolean isInlinePrimaryKey(List<ColumnModel> columns, List<String> pkColumns) {
        return false;
    }

    // Rebuild
    String getCopyRowsSql(String source, String target, Map<String, String> targetToSource);

    /**
     * Statements that put {@code shadow} in place of {@code table}. Implementations either
     * drop the original first or move it to {@code retired} and leave it for the caller to
     * drop.
     */
    List<String> getSwapTableSql(String table, String shadow, String retired);

    default String getShadowTableName(String table) {
        return SHADOW_PREFIX + table;
    }

    default String getRetiredTableName(String table) {
        return RETIRED_PREFIX + table;
    }

    /**
     * Whether {@code e} means another connection holds a conflicting lock on the store.
     */
    boolean isLockContention(SQLException e);
}
