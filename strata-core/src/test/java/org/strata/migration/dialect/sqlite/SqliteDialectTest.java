package org.strata.migration.dialect.sqlite;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.strata.migration.dialect.DialectAdapter;
import org.strata.migration.dialect.DialectCapabilities;
import org.strata.migration.dialect.Strategy;
import org.strata.migration.operation.AddColumn;
import org.strata.migration.operation.AlterColumn;
import org.strata.migration.operation.DropIndex;
import org.strata.migration.operation.ExecuteSql;
import org.strata.migration.operation.OperationKind;
import org.strata.migration.operation.RenameColumn;
import org.strata.model.ColumnModel;
import org.strata.model.ForeignKeyModel;
import org.strata.model.IndexModel;
import org.strata.model.TableModel;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.strata.testing.Fixtures.col;
import static org.strata.testing.Fixtures.id;
import static org.strata.testing.Fixtures.notNull;

class SqliteDialectTest {

    private final SqliteDialect dialect = new SqliteDialect();

    @Test
    @DisplayName("quoteIdentifier는 큰따옴표로 감싸고 내부 따옴표를 이스케이프한다")
    void quoteIdentifier() {
        assertEquals("\"users\"", dialect.quoteIdentifier("users"));
        assertEquals("\"we\"\"ird\"", dialect.quoteIdentifier("we\"ird"));
    }

    @Test
    @DisplayName("단일 auto-increment PK는 컬럼 정의에 인라인된다")
    void createTableInlinePrimaryKey() {
        TableModel users = TableModel.builder()
                .name("users")
                .column(id())
                .column(notNull("name", "VARCHAR(255)"))
                .column(status())
                .index(IndexModel.builder().name("ix_users_name").column("name").build())
                .build();

        List<String> sql = dialect.getCreateTableSql(users);

        assertThat(sql).containsExactly(
                "CREATE TABLE \"users\" (\n"
                        + "  \"id\" INTEGER PRIMARY KEY AUTOINCREMENT,\n"
                        + "  \"name\" VARCHAR(255) NOT NULL,\n"
                        + "  \"status\" VARCHAR(16) NOT NULL DEFAULT 'OPEN'\n"
                        + ")",
                "CREATE INDEX \"ix_users_name\" ON \"users\" (\"name\")");
    }

    @Test
    @DisplayName("복합 PK와 FK는 테이블 레벨 제약으로 렌더링된다")
    void createTableCompositeKeyAndForeignKey() {
        TableModel link = TableModel.builder()
                .name("expert_instrument")
                .column(keyPart("expert_id"))
                .column(keyPart("instrument_id"))
                .foreignKey(ForeignKeyModel.builder()
                        .column("expert_id").referencedTable("expert").referencedColumn("id")
                        .onDelete("CASCADE")
                        .build())
                .build();

        String sql = dialect.getCreateTableSql(link).get(0);

        assertThat(sql).contains("PRIMARY KEY (\"expert_id\", \"instrument_id\")");
        assertThat(sql).contains("FOREIGN KEY (\"expert_id\") REFERENCES \"expert\" (\"id\") ON DELETE CASCADE");
        assertThat(sql).doesNotContain("AUTOINCREMENT");
    }

    @Test
    @DisplayName("직접 실행 가능한 연산의 SQL")
    void directStatements() {
        assertThat(dialect.getStatements(new AddColumn("users", col("email", "TEXT"))))
                .containsExactly("ALTER TABLE \"users\" ADD COLUMN \"email\" TEXT");
        assertThat(dialect.getStatements(new RenameColumn("users", "name", "full_name")))
                .containsExactly("ALTER TABLE \"users\" RENAME COLUMN \"name\" TO \"full_name\"");
        assertThat(dialect.getStatements(new DropIndex(IndexModel.builder().name("ix_users_name").table("users").build())))
                .containsExactly("DROP INDEX \"ix_users_name\"");
        assertThat(dialect.getStatements(new ExecuteSql("UPDATE users SET name = 'x' WHERE name IS NULL")))
                .containsExactly("UPDATE users SET name = 'x' WHERE name IS NULL");
    }

    @Test
    @DisplayName("컬럼 변경은 직접 렌더링하지 않는다")
    void alterColumnHasNoDirectForm() {
        AlterColumn alter = new AlterColumn("users", col("name", "TEXT"), notNull("name", "TEXT"));

        assertThatThrownBy(() -> dialect.getStatements(alter)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("swap은 원본 삭제 후 shadow 이름 변경")
    void swap() {
        assertThat(dialect.getSwapTableSql("users", "_strata_shadow_users", "_strata_old_users"))
                .containsExactly("DROP TABLE \"users\"", "ALTER TABLE \"_strata_shadow_users\" RENAME TO \"users\"");
    }

    @Test
    @DisplayName("행 복사 SQL은 대상/원본 컬럼을 짝지어 나열한다")
    void copyRows() {
        String sql = dialect.getCopyRowsSql("users", "_strata_shadow_users", Map.of("full_name", "name"));

        assertEquals("INSERT INTO \"_strata_shadow_users\" (\"full_name\") SELECT \"name\" FROM \"users\"", sql);
    }

    @Test
    @DisplayName("엔진 버전에 따라 drop/rename 컬럼의 실행 전략이 달라진다")
    void capabilitiesByVersion() throws SQLException {
        DialectCapabilities old = dialect.capabilities(connectionReporting("3.24.0"));
        DialectCapabilities mid = dialect.capabilities(connectionReporting("3.31.1"));
        DialectCapabilities modern = dialect.capabilities(connectionReporting("3.46.0"));

        assertTrue(old.isTransactionalDdl());
        assertEquals(Strategy.REBUILD, DialectAdapter.strategyFor(OperationKind.RENAME_COLUMN, old));
        assertEquals(Strategy.DIRECT, DialectAdapter.strategyFor(OperationKind.RENAME_COLUMN, mid));
        assertEquals(Strategy.REBUILD, DialectAdapter.strategyFor(OperationKind.DROP_COLUMN, mid));
        assertEquals(Strategy.DIRECT, DialectAdapter.strategyFor(OperationKind.DROP_COLUMN, modern));

        for (DialectCapabilities caps : List.of(old, modern)) {
            assertEquals(Strategy.REBUILD, DialectAdapter.strategyFor(OperationKind.ALTER_COLUMN, caps));
            assertEquals(Strategy.REBUILD, DialectAdapter.strategyFor(OperationKind.ADD_FOREIGN_KEY, caps));
            assertEquals(Strategy.REBUILD, DialectAdapter.strategyFor(OperationKind.DROP_FOREIGN_KEY, caps));
            assertEquals(Strategy.REBUILD, DialectAdapter.strategyFor(OperationKind.REBUILD_TABLE, caps));
            assertEquals(Strategy.DIRECT, DialectAdapter.strategyFor(OperationKind.ADD_COLUMN, caps));
            assertEquals(Strategy.DIRECT, DialectAdapter.strategyFor(OperationKind.CREATE_TABLE, caps));
        }
    }

    @Test
    @DisplayName("SQLITE_BUSY/SQLITE_LOCKED (확장 코드 포함)는 락 경합이다")
    void lockContention() {
        assertTrue(dialect.isLockContention(new SQLException("busy", null, 5)));
        assertTrue(dialect.isLockContention(new SQLException("locked", null, 6)));
        assertTrue(dialect.isLockContention(new SQLException("busy recovery", null, 5 | (1 << 8))));
        assertFalse(dialect.isLockContention(new SQLException("constraint", null, 19)));
    }

    @Test
    @DisplayName("버전 문자열 파싱")
    void parseVersion() {
        assertThat(SqliteDialect.parseVersion("3.46.0")).containsExactly(3, 46, 0);
        assertThat(SqliteDialect.parseVersion("3.8")).containsExactly(3, 8, 0);
        assertThat(SqliteDialect.parseVersion(null)).containsExactly(0, 0, 0);
    }

    private static Connection connectionReporting(String version) throws SQLException {
        Connection connection = mock(Connection.class);
        DatabaseMetaData meta = mock(DatabaseMetaData.class);
        when(connection.getMetaData()).thenReturn(meta);
        when(meta.getDatabaseProductVersion()).thenReturn(version);
        return connection;
    }

    private static ColumnModel status() {
        return notNull("status", "VARCHAR(16)").toBuilder().defaultValue("'OPEN'").build();
    }

    private static ColumnModel keyPart(String name) {
        return ColumnModel.builder().name(name).type("INTEGER").primaryKey(true).build();
    }
}
