package org.strata.testing;

import org.strata.migration.graph.MigrationRegistry;
import org.strata.migration.graph.RegisteredGraph;
import org.strata.model.ColumnModel;
import org.strata.model.MigrationUnit;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared builders for tests.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static ColumnModel col(String name, String type) {
        return ColumnModel.builder().name(name).type(type).build();
    }

    public static ColumnModel notNull(String name, String type) {
        return ColumnModel.builder().name(name).type(type).nullable(false).build();
    }

    public static ColumnModel id() {
        return ColumnModel.builder().name("id").type("INTEGER").primaryKey(true).autoIncrement(true).build();
    }

    /**
     * Unit without operations.
     */
    public static MigrationUnit unit(String id, String... parents) {
        return MigrationUnit.builder().id(id).parentIds(List.of(parents)).build();
    }

    public static RegisteredGraph graph(MigrationUnit... units) {
        return new MigrationRegistry().load(List.of(units));
    }

    public static String sqliteUrl(Path dir) {
        return "jdbc:sqlite:" + dir.resolve("strata-test.db");
    }

    public static Connection sqlite(Path dir) throws SQLException {
        return DriverManager.getConnection(sqliteUrl(dir));
    }

    public static void exec(Connection connection, String... statements) throws SQLException {
        try (Statement st = connection.createStatement()) {
            for (String sql : statements) {
                st.execute(sql);
            }
        }
    }

    public static List<String> column(Connection connection, String sql) throws SQLException {
        List<String> values = new ArrayList<>();
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery(sql)) {
            while (rs.next()) {
                values.add(rs.getString(1));
            }
        }
        return values;
    }

    public static long count(Connection connection, String table) throws SQLException {
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM \"" + table + "\"")) {
            rs.next();
            return rs.getLong(1);
        }
    }
}
