package org.strata.migration.dialect.mysql;

import org.strata.migration.dialect.SchemaInspector;
import org.strata.model.ColumnModel;
import org.strata.model.ForeignKeyModel;
import org.strata.model.IndexModel;
import org.strata.model.SchemaSnapshot;
import org.strata.model.TableModel;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Reads the current catalog through {@link DatabaseMetaData}.
 */
public class MySqlSchemaInspector implements SchemaInspector {

    @Override
    public SchemaSnapshot snapshot(Connection connection) throws SQLException {
        DatabaseMetaData meta = connection.getMetaData();
        List<String> names = new ArrayList<>();
        try (ResultSet rs = meta.getTables(connection.getCatalog(), null, "%", new String[]{"TABLE"})) {
            while (rs.next()) {
                names.add(rs.getString("TABLE_NAME"));
            }
        }
        List<TableModel> tables = new ArrayList<>();
        for (String name : names) {
            table(connection, name).ifPresent(tables::add);
        }
        return SchemaSnapshot.of(tables);
    }

    @Override
    public Optional<TableModel> table(Connection connection, String tableName) throws SQLException {
        DatabaseMetaData meta = connection.getMetaData();
        String catalog = connection.getCatalog();

        Set<String> pk = new HashSet<>();
        try (ResultSet rs = meta.getPrimaryKeys(catalog, null, tableName)) {
            while (rs.next()) {
                pk.add(rs.getString("COLUMN_NAME"));
            }
        }

        TableModel.TableModelBuilder table = TableModel.builder().name(tableName);
        boolean found = false;
        try (ResultSet rs = meta.getColumns(catalog, null, tableName, "%")) {
            while (rs.next()) {
                found = true;
                String name = rs.getString("COLUMN_NAME");
                table.column(ColumnModel.builder()
                        .name(name)
                        .type(typeOf(rs))
                        .nullable(rs.getInt("NULLABLE") == DatabaseMetaData.columnNullable)
                        .defaultValue(rs.getString("COLUMN_DEF"))
                        .primaryKey(pk.contains(name))
                        .autoIncrement("YES".equalsIgnoreCase(rs.getString("IS_AUTOINCREMENT")))
                        .build());
            }
        }
        if (!found) {
            return Optional.empty();
        }

        Set<String> fkNames = new HashSet<>();
        Map<String, ForeignKeyModel.ForeignKeyModelBuilder> fks = new LinkedHashMap<>();
        try (ResultSet rs = meta.getImportedKeys(catalog, null, tableName)) {
            while (rs.next()) {
                String name = rs.getString("FK_NAME");
                ForeignKeyModel.ForeignKeyModelBuilder fk = fks.get(name);
                if (fk == null) {
                    fk = ForeignKeyModel.builder()
                            .name(name)
                            .table(tableName)
                            .referencedTable(rs.getString("PKTABLE_NAME"))
                            .onDelete(rule(rs.getShort("DELETE_RULE")))
                            .onUpdate(rule(rs.getShort("UPDATE_RULE")));
                    fks.put(name, fk);
                    fkNames.add(name);
                }
                fk.column(rs.getString("FKCOLUMN_NAME")).referencedColumn(rs.getString("PKCOLUMN_NAME"));
            }
        }
        fks.values().forEach(fk -> table.foreignKey(fk.build()));

        Map<String, TreeMap<Short, String>> indexColumns = new LinkedHashMap<>();
        Map<String, Boolean> unique = new LinkedHashMap<>();
        try (ResultSet rs = meta.getIndexInfo(catalog, null, tableName, false, false)) {
            while (rs.next()) {
                String name = rs.getString("INDEX_NAME");
                // PRIMARY 와 FK가 자동으로 만드는 인덱스는 제외
                if (name == null || "PRIMARY".equals(name) || fkNames.contains(name)) continue;
                indexColumns.computeIfAbsent(name, k -> new TreeMap<>())
                        .put(rs.getShort("ORDINAL_POSITION"), rs.getString("COLUMN_NAME"));
                unique.put(name, !rs.getBoolean("NON_UNIQUE"));
            }
        }
        indexColumns.forEach((name, cols) -> table.index(IndexModel.builder()
                .name(name)
                .table(tableName)
                .columns(cols.values())
                .unique(unique.get(name))
                .build()));

        return Optional.of(table.build());
    }

    private static String typeOf(ResultSet rs) throws SQLException {
        String typeName = rs.getString("TYPE_NAME");
        int dataType = rs.getInt("DATA_TYPE");
        return switch (dataType) {
            case Types.VARCHAR, Types.CHAR -> typeName + "(" + rs.getInt("COLUMN_SIZE") + ")";
            case Types.DECIMAL, Types.NUMERIC ->
                    typeName + "(" + rs.getInt("COLUMN_SIZE") + "," + rs.getInt("DECIMAL_DIGITS") + ")";
            default -> typeName;
        };
    }

    private static String rule(int rule) {
        return switch (rule) {
            case DatabaseMetaData.importedKeyCascade -> "CASCADE";
            case DatabaseMetaData.importedKeySetNull -> "SET NULL";
            case DatabaseMetaData.importedKeySetDefault -> "SET DEFAULT";
            case DatabaseMetaData.importedKeyRestrict -> "RESTRICT";
            default -> null;
        };
    }
}
