package org.strata.migration.guard;

import org.strata.migration.dialect.Dialect;
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
import org.strata.migration.operation.OperationKind;
import org.strata.migration.operation.OperationVisitor;
import org.strata.migration.operation.RebuildTable;
import org.strata.migration.operation.RenameColumn;
import org.strata.migration.operation.SchemaOperation;
import org.strata.model.ColumnModel;
import org.strata.model.IndexModel;
import org.strata.model.SchemaSnapshot;
import org.strata.model.TableModel;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Decides from live schema metadata whether an operation still has to run.
 *
 * <ul>
 *   <li>additive operation already satisfied: skip</li>
 *   <li>destructive operation whose object is already gone: skip</li>
 *   <li>live state matching neither the pre- nor the post-condition:
 *       {@link IdempotencyConflictException}</li>
 * </ul>
 * For an operation executed through a rebuild, a leftover ({@code _strata_shadow_*} or
 * {@code _strata_old_*}) for its table means the rebuild was interrupted and has to be
 * resumed. Directly executed operations are judged by the live table alone, even when a
 * later rebuild of the same table left something behind.
 */
public class IdempotencyGuard {

    private static final Set<OperationKind> NEVER_REBUILT = EnumSet.of(
            OperationKind.CREATE_TABLE, OperationKind.DROP_TABLE,
            OperationKind.CREATE_INDEX, OperationKind.DROP_INDEX, OperationKind.EXECUTE_SQL);

    /**
     * Pre/post-condition check only, as for an operation executed directly.
     */
    public boolean shouldApply(SchemaOperation op, SchemaSnapshot snapshot) {
        return shouldApply(op, snapshot, Strategy.DIRECT);
    }

    public boolean shouldApply(SchemaOperation op, SchemaSnapshot snapshot, Strategy strategy) {
        if (strategy == Strategy.REBUILD
                && !NEVER_REBUILT.contains(op.kind())
                && hasRebuildLeftover(op.table(), snapshot)) {
            return true;
        }
        return op.accept(new Check(snapshot));
    }

    private static boolean hasRebuildLeftover(String table, SchemaSnapshot snapshot) {
        return snapshot.hasTable(Dialect.SHADOW_PREFIX + table) || snapshot.hasTable(Dialect.RETIRED_PREFIX + table);
    }

    private static final class Check implements OperationVisitor<Boolean> {
        private final SchemaSnapshot snapshot;

        Check(SchemaSnapshot snapshot) {
            this.snapshot = snapshot;
        }

        @Override
        public Boolean visitAddColumn(AddColumn op) {
            TableModel table = requireTable(op);
            Optional<ColumnModel> existing = table.findColumn(op.column().getName());
            if (existing.isEmpty()) return true;
            if (existing.get().sameDefinition(op.column())) return false;
            throw conflict(op, "column '" + op.column().getName() + "' exists with a different definition ("
                    + existing.get().getType() + ")");
        }

        @Override
        public Boolean visitDropColumn(DropColumn op) {
            return snapshot.table(op.table())
                    .map(t -> t.hasColumn(op.column().getName()))
                    .orElse(false);
        }

        @Override
        public Boolean visitRenameColumn(RenameColumn op) {
            TableModel table = requireTable(op);
            boolean hasFrom = table.hasColumn(op.from());
            boolean hasTo = table.hasColumn(op.to());
            if (hasFrom && !hasTo) return true;
            if (!hasFrom && hasTo) return false;
            throw conflict(op, hasFrom
                    ? "both '" + op.from() + "' and '" + op.to() + "' exist"
                    : "neither '" + op.from() + "' nor '" + op.to() + "' exists");
        }

        @Override
        public Boolean visitAlterColumn(AlterColumn op) {
            TableModel table = requireTable(op);
            ColumnModel live = table.findColumn(op.columnName())
                    .orElseThrow(() -> conflict(op, "column '" + op.columnName() + "' does not exist"));
            if (live.sameDefinition(op.to())) return false;
            if (live.sameDefinition(op.from())) return true;
            throw conflict(op, "column '" + op.columnName() + "' is " + describe(live)
                    + ", expected " + describe(op.from()) + " or " + describe(op.to()));
        }

        @Override
        public Boolean visitCreateTable(CreateTable op) {
            Optional<TableModel> live = snapshot.table(op.table());
            if (live.isEmpty()) return true;
            if (live.get().sameStructure(op.definition())) return false;
            throw conflict(op, "table exists with a different structure");
        }

        @Override
        public Boolean visitDropTable(DropTable op) {
            return snapshot.hasTable(op.table());
        }

        @Override
        public Boolean visitAddForeignKey(AddForeignKey op) {
            return !requireTable(op).hasForeignKey(op.foreignKey());
        }

        @Override
        public Boolean visitDropForeignKey(DropForeignKey op) {
            return snapshot.table(op.table())
                    .map(t -> t.hasForeignKey(op.foreignKey()))
                    .orElse(false);
        }

        @Override
        public Boolean visitRebuildTable(RebuildTable op) {
            return !requireTable(op).sameStructure(op.definition());
        }

        @Override
        public Boolean visitCreateIndex(CreateIndex op) {
            TableModel table = requireTable(op);
            Optional<IndexModel> existing = table.findIndex(op.index().getName());
            if (existing.isEmpty()) return true;
            if (existing.get().sameStructure(op.index())) return false;
            throw conflict(op, "index '" + op.index().getName() + "' exists with a different definition");
        }

        @Override
        public Boolean visitDropIndex(DropIndex op) {
            return snapshot.table(op.table())
                    .map(t -> t.findIndex(op.index().getName()).isPresent())
                    .orElse(false);
        }

        @Override
        public Boolean visitExecuteSql(ExecuteSql op) {
            return true;
        }

        private TableModel requireTable(SchemaOperation op) {
            return snapshot.table(op.table())
                    .orElseThrow(() -> conflict(op, "table does not exist"));
        }

        private static String describe(ColumnModel c) {
            return c.getType() + (c.isNullable() ? " NULL" : " NOT NULL");
        }

        private static IdempotencyConflictException conflict(SchemaOperation op, String message) {
            return new IdempotencyConflictException(op, message);
        }
    }
}
