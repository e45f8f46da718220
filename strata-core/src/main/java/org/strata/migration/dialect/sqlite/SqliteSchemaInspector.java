package org.strata.migration.dialect.sqlite;

import org.strata.migration.dialect.SchemaInspector;
import org.strata.model.ColumnModel;
import org.strata.model.ForeignKeyModel;
import org.strata.model.IndexModel;
import org.strata.model.SchemaSnapshot;
import org.strata.model.TableModel;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Reads table structure through {@code sqlite_master} and the {@code PRAGMA} table functions.
 */
public class SqliteSchemaInspector implements SchemaInspector {

    @Override
    public SchemaSnapshot snapshot(Connection connection) throws SQLException {
        List<TableModel> tables = new ArrayList<>();
        for (String name : tableNames(connection)) {
            table(connection, name).ifPresent(tables::add);
        }
        return SchemaSnapshot.of(tables);
    }

    @Override
    public Optional<TableModel> table(Connection connection, String tableName) throws SQLException {
        String ddl = createStatement(connection, tableName);
        if (ddl == null) {
            return Optional.empty();
        }
        boolean autoIncrement = ddl.toUpperCase(Locale.ROOT).contains("AUTOINCREMENT");

        TableModel.TableModelBuilder table = TableModel.builder().name(tableName);
        readColumns(connection, tableName, autoIncrement, table);
        readForeignKeys(connection, tableName, table);
        readIndexes(connection, tableName, table);
        return Optional.of(table.build());
    }

    private List<String> tableNames(Connection connection) throws SQLException {
        List<String> names = new ArrayList<>();
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery(
                     "SELECT name FROM sqlite_master WHERE type = 'table' AND name NOT LIKE 'sqlite_%' ORDER BY name")) {
            while (rs.next()) {
                names.add(rs.getString(1));
            }
        }
        return names;
    }

    private String createStatement(Connection connection, String tableName) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT sql FROM sqlite_master WHERE type = 'table' AND name = ? COLLATE NOCASE")) {
            ps.setString(1, tableName);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    private void readColumns(Connection connection, String tableName, boolean autoIncrement,
                             TableModel.TableModelBuilder table) throws SQLException {
        List<ColumnModel> columns = new ArrayList<>();
        int pkCount = 0;
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + quote(tableName) + ")")) {
            while (rs.next()) {
                boolean pk = rs.getInt("pk") > 0;
                if (pk) pkCount++;
                columns.add(ColumnModel.builder()
                        .name(rs.getString("name"))
                        .type(rs.getString("type"))
                        .nullable(rs.getInt("notnull") == 0 && !pk)
                        .defaultValue(rs.getString("dflt_value"))
                        .primaryKey(pk)
                        .build());
            }
        }
        // AUTOINCREMENT는 단일 INTEGER PK에만 붙을 수 있다
        boolean singlePk = pkCount == 1;
        for (ColumnModel c : columns) {
            table.column(autoIncrement && singlePk && c.isPrimaryKey()
                    ? c.toBuilder().autoIncrement(true).build()
                    : c);
        }
    }

    private void readForeignKeys(Connection connection, String tableName,
                                 TableModel.TableModelBuilder table) throws SQLException {
        Map<Integer, ForeignKeyModel.ForeignKeyModelBuilder> byId = new TreeMap<>();
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA foreign_key_list(" + quote(tableName) + ")")) {
            while (rs.next()) {
                int id = rs.getInt("id");
                ForeignKeyModel.ForeignKeyModelBuilder fk = byId.get(id);
                if (fk == null) {
                    fk = ForeignKeyModel.builder()
                            .table(tableName)
                            .referencedTable(rs.getString("table"))
                            .onDelete(action(rs.getString("on_delete")))
                            .onUpdate(action(rs.getString("on_update")));
                    byId.put(id, fk);
                }
                fk.column(rs.getString("from")).referencedColumn(rs.getString("to"));
            }
        }
        byId.values().forEach(fk -> table.foreignKey(fk.build()));
    }

    private void readIndexes(Connection connection, String tableName,
                             TableModel.TableModelBuilder table) throws SQLException {
        Map<String, Boolean> explicit = new LinkedHashMap<>();
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA index_list(" + quote(tableName) + ")")) {
            while (rs.next()) {
                // 'c' = CREATE INDEX 로 만든 인덱스. 'u'/'pk'는 제약에서 자동 생성
                if ("c".equals(rs.getString("origin"))) {
                    explicit.put(rs.getString("name"), rs.getInt("unique") == 1);
                }
            }
        }
        for (Map.Entry<String, Boolean> e : explicit.entrySet()) {
            IndexModel.IndexModelBuilder index = IndexModel.builder()
                    .name(e.getKey())
                    .table(tableName)
                    .unique(e.getValue());
            try (Statement st = connection.createStatement();
                 ResultSet rs = st.executeQuery("PRAGMA index_info(" + quote(e.getKey()) + ")")) {
                Map<Integer, String> ordered = new TreeMap<>();
                while (rs.next()) {
                    ordered.put(rs.getInt("seqno"), rs.getString("name"));
                }
                ordered.values().forEach(index::column);
            }
            table.index(index.build());
        }
    }

    private static String action(String raw) {
        return raw == null || "NO ACTION".equalsIgnoreCase(raw) ? null : raw;
    }

    private static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
