package org.strata.migration.guard;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.strata.migration.dialect.Strategy;
import org.strata.migration.error.IdempotencyConflictException;
import org.strata.migration.operation.AddColumn;
import org.strata.migration.operation.AddForeignKey;
import org.strata.migration.operation.AlterColumn;
import org.strata.migration.operation.CreateIndex;
import org.strata.migration.operation.CreateTable;
import org.strata.migration.operation.DropColumn;
import org.strata.migration.operation.DropForeignKey;
import org.strata.migration.operation.DropIndex;
import org.strata.migration.operation.DropTable;
import org.strata.migration.operation.ExecuteSql;
import org.strata.migration.operation.RebuildTable;
import org.strata.migration.operation.RenameColumn;
import org.strata.model.ForeignKeyModel;
import org.strata.model.IndexModel;
import org.strata.model.SchemaSnapshot;
import org.strata.model.TableModel;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.strata.testing.Fixtures.col;
import static org.strata.testing.Fixtures.id;
import static org.strata.testing.Fixtures.notNull;

class IdempotencyGuardTest {

    private final IdempotencyGuard guard = new IdempotencyGuard();

    private final ForeignKeyModel accountFk = ForeignKeyModel.builder()
            .table("tradingorder").column("account_id")
            .referencedTable("account").referencedColumn("id")
            .build();

    private final TableModel tradingOrder = TableModel.builder()
            .name("tradingorder")
            .column(id())
            .column(notNull("symbol", "VARCHAR(32)"))
            .column(col("account_id", "INTEGER"))
            .foreignKey(accountFk)
            .index(IndexModel.builder().name("ix_tradingorder_symbol").table("tradingorder").column("symbol").build())
            .build();

    private final SchemaSnapshot snapshot = SchemaSnapshot.of(List.of(
            tradingOrder,
            TableModel.builder().name("account").column(id()).build()));

    @Test
    @DisplayName("add_column: 없으면 적용, 같은 정의로 있으면 건너뜀, 다른 정의면 충돌")
    void addColumn() {
        assertThat(guard.shouldApply(new AddColumn("tradingorder", col("status", "TEXT")), snapshot)).isTrue();
        assertThat(guard.shouldApply(new AddColumn("tradingorder", col("account_id", "integer")), snapshot)).isFalse();
        assertThatThrownBy(() -> guard.shouldApply(new AddColumn("tradingorder", col("account_id", "TEXT")), snapshot))
                .isInstanceOf(IdempotencyConflictException.class)
                .hasMessageContaining("account_id");
    }

    @Test
    @DisplayName("add_column: 테이블이 없으면 충돌")
    void addColumnMissingTable() {
        assertThatThrownBy(() -> guard.shouldApply(new AddColumn("nope", col("x", "TEXT")), snapshot))
                .isInstanceOf(IdempotencyConflictException.class);
    }

    @Test
    @DisplayName("drop_column: 이미 없으면 건너뜀")
    void dropColumn() {
        assertThat(guard.shouldApply(new DropColumn("tradingorder", col("account_id", "INTEGER")), snapshot)).isTrue();
        assertThat(guard.shouldApply(new DropColumn("tradingorder", col("gone", "INTEGER")), snapshot)).isFalse();
        assertThat(guard.shouldApply(new DropColumn("nope", col("gone", "INTEGER")), snapshot)).isFalse();
    }

    @Test
    @DisplayName("rename_column: from만 있으면 적용, to만 있으면 건너뜀, 그 외 충돌")
    void renameColumn() {
        assertThat(guard.shouldApply(new RenameColumn("tradingorder", "symbol", "ticker"), snapshot)).isTrue();
        assertThat(guard.shouldApply(new RenameColumn("tradingorder", "old_symbol", "symbol"), snapshot)).isFalse();
        assertThatThrownBy(() -> guard.shouldApply(new RenameColumn("tradingorder", "symbol", "account_id"), snapshot))
                .isInstanceOf(IdempotencyConflictException.class)
                .hasMessageContaining("both");
        assertThatThrownBy(() -> guard.shouldApply(new RenameColumn("tradingorder", "a", "b"), snapshot))
                .isInstanceOf(IdempotencyConflictException.class)
                .hasMessageContaining("neither");
    }

    @Test
    @DisplayName("alter_column: 현재가 to면 건너뜀, from이면 적용, 둘 다 아니면 충돌")
    void alterColumn() {
        AlterColumn tighten = new AlterColumn("tradingorder", col("account_id", "INTEGER"), notNull("account_id", "INTEGER"));
        AlterColumn loosen = new AlterColumn("tradingorder", notNull("account_id", "INTEGER"), col("account_id", "INTEGER"));
        AlterColumn retype = new AlterColumn("tradingorder", col("account_id", "BIGINT"), col("account_id", "TEXT"));

        assertThat(guard.shouldApply(tighten, snapshot)).isTrue();
        assertThat(guard.shouldApply(loosen, snapshot)).isFalse();
        assertThatThrownBy(() -> guard.shouldApply(retype, snapshot))
                .isInstanceOf(IdempotencyConflictException.class)
                .hasMessageContaining("expected");
    }

    @Test
    @DisplayName("create_table: 같은 구조로 있으면 건너뜀, 구조가 다르면 충돌")
    void createTable() {
        TableModel newTable = TableModel.builder().name("llm_usage").column(id()).column(col("tokens", "INTEGER")).build();
        TableModel differing = tradingOrder.toBuilder().clearIndexes().build();

        assertThat(guard.shouldApply(new CreateTable(newTable), snapshot)).isTrue();
        assertThat(guard.shouldApply(new CreateTable(tradingOrder), snapshot)).isFalse();
        assertThatThrownBy(() -> guard.shouldApply(new CreateTable(differing), snapshot))
                .isInstanceOf(IdempotencyConflictException.class);
    }

    @Test
    @DisplayName("drop_table: 이미 없으면 건너뜀")
    void dropTable() {
        assertThat(guard.shouldApply(new DropTable(tradingOrder), snapshot)).isTrue();
        assertThat(guard.shouldApply(new DropTable(TableModel.builder().name("nope").build()), snapshot)).isFalse();
    }

    @Test
    @DisplayName("foreign key는 이름이 아닌 구조로 비교한다")
    void foreignKeys() {
        ForeignKeyModel renamed = accountFk.toBuilder().name("fk_whatever").build();
        ForeignKeyModel other = ForeignKeyModel.builder()
                .table("tradingorder").column("symbol").referencedTable("account").referencedColumn("id").build();

        assertThat(guard.shouldApply(new AddForeignKey(renamed), snapshot)).isFalse();
        assertThat(guard.shouldApply(new AddForeignKey(other), snapshot)).isTrue();
        assertThat(guard.shouldApply(new DropForeignKey(renamed), snapshot)).isTrue();
        assertThat(guard.shouldApply(new DropForeignKey(other), snapshot)).isFalse();
    }

    @Test
    @DisplayName("index: 같은 이름과 구조면 건너뜀, 이름만 같으면 충돌")
    void indexes() {
        IndexModel same = IndexModel.builder().name("ix_tradingorder_symbol").table("tradingorder").column("symbol").build();
        IndexModel clash = same.toBuilder().unique(true).build();
        IndexModel fresh = IndexModel.builder().name("ix_tradingorder_account").table("tradingorder").column("account_id").build();

        assertThat(guard.shouldApply(new CreateIndex(same), snapshot)).isFalse();
        assertThat(guard.shouldApply(new CreateIndex(fresh), snapshot)).isTrue();
        assertThatThrownBy(() -> guard.shouldApply(new CreateIndex(clash), snapshot))
                .isInstanceOf(IdempotencyConflictException.class);
        assertThat(guard.shouldApply(new DropIndex(same), snapshot)).isTrue();
        assertThat(guard.shouldApply(new DropIndex(fresh), snapshot)).isFalse();
    }

    @Test
    @DisplayName("rebuild_table: 이미 목표 구조면 건너뜀")
    void rebuildTable() {
        TableModel target = tradingOrder.toBuilder().clearColumns()
                .column(id()).column(notNull("symbol", "VARCHAR(32)")).column(notNull("account_id", "INTEGER"))
                .build();

        assertThat(guard.shouldApply(new RebuildTable(tradingOrder), snapshot)).isFalse();
        assertThat(guard.shouldApply(new RebuildTable(target), snapshot)).isTrue();
    }

    @Test
    @DisplayName("중단된 rebuild의 shadow 테이블이 남아 있으면 rebuild로 실행되는 연산은 다시 적용한다")
    void rebuildLeftoverForcesRebuiltOperations() {
        TableModel shadow = tradingOrder.toBuilder().name("_strata_shadow_tradingorder").build();
        SchemaSnapshot withShadow = SchemaSnapshot.of(List.of(tradingOrder, shadow));

        assertThat(guard.shouldApply(new RebuildTable(tradingOrder), withShadow, Strategy.REBUILD)).isTrue();
        assertThat(guard.shouldApply(new DropColumn("tradingorder", col("gone", "TEXT")), withShadow, Strategy.REBUILD))
                .isTrue();
    }

    @Test
    @DisplayName("직접 실행되는 연산은 같은 테이블의 rebuild 잔여물이 있어도 라이브 구조로만 판단한다")
    void rebuildLeftoverIgnoredForDirectOperations() {
        TableModel retired = tradingOrder.toBuilder().name("_strata_old_tradingorder").build();
        SchemaSnapshot withRetired = SchemaSnapshot.of(List.of(tradingOrder, retired));

        assertThat(guard.shouldApply(new AddColumn("tradingorder", col("account_id", "INTEGER")), withRetired, Strategy.DIRECT))
                .isFalse();
        assertThat(guard.shouldApply(new DropColumn("tradingorder", col("gone", "TEXT")), withRetired, Strategy.DIRECT))
                .isFalse();
        assertThat(guard.shouldApply(new AddColumn("tradingorder", col("status", "TEXT")), withRetired, Strategy.DIRECT))
                .isTrue();
    }

    @Test
    @DisplayName("execute는 항상 실행한다")
    void executeSql() {
        assertThat(guard.shouldApply(new ExecuteSql("UPDATE tradingorder SET symbol = 'X' WHERE symbol IS NULL"), snapshot))
                .isTrue();
    }
}
