package org.strata.migration.rebuild;

import org.strata.migration.dialect.Dialect;
import org.strata.migration.error.OperationException;
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
import org.strata.migration.operation.OperationVisitor;
import org.strata.migration.operation.RebuildTable;
import org.strata.migration.operation.RenameColumn;
import org.strata.migration.operation.SchemaOperation;
import org.strata.model.ColumnModel;
import org.strata.model.ForeignKeyModel;
import org.strata.model.SchemaSnapshot;
import org.strata.model.TableModel;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives the post-operation table structure, and where each of its columns is copied
 * from, for operations that run as a rebuild.
 */
public class RebuildPlanner {

    private final Dialect dialect;

    public RebuildPlanner(Dialect dialect) {
        this.dialect = dialect;
    }

    public RebuildPlan plan(SchemaOperation op, SchemaSnapshot snapshot) {
        String table = op.table();
        TableModel base = snapshot.table(table)
                .or(() -> snapshot.table(dialect.getShadowTableName(table))
                        .map(shadow -> shadow.toBuilder().name(table).build()))
                .orElseThrow(() -> new OperationException(
                        "Cannot rebuild '" + table + "': table does not exist"));
        return op.accept(new Planner(base));
    }

    private static final class Planner implements OperationVisitor<RebuildPlan> {
        private final TableModel base;

        Planner(TableModel base) {
            this.base = base;
        }

        @Override
        public RebuildPlan visitAddColumn(AddColumn op) {
            TableModel target = base.toBuilder().column(op.column()).build();
            return new RebuildPlan(base.getName(), target, identity(base.getColumns()));
        }

        @Override
        public RebuildPlan visitDropColumn(DropColumn op) {
            String dropped = op.column().getName();
            TableModel target = base.toBuilder()
                    .clearColumns()
                    .columns(base.getColumns().stream().filter(c -> !c.getName().equalsIgnoreCase(dropped)).toList())
                    .clearForeignKeys()
                    .foreignKeys(base.getForeignKeys().stream().filter(fk -> !fk.references(dropped)).toList())
                    .clearIndexes()
                    .indexes(base.getIndexes().stream().filter(i -> !i.covers(dropped)).toList())
                    .build();
            return new RebuildPlan(base.getName(), target, identity(target.getColumns()));
        }

        @Override
        public RebuildPlan visitRenameColumn(RenameColumn op) {
            Map<String, String> sources = new LinkedHashMap<>();
            TableModel.TableModelBuilder target = base.toBuilder().clearColumns();
            for (ColumnModel c : base.getColumns()) {
                boolean renamed = c.getName().equalsIgnoreCase(op.from());
                ColumnModel next = renamed ? c.renamed(op.to()) : c;
                target.column(next);
                sources.put(next.getName(), c.getName());
            }
            target.clearForeignKeys().foreignKeys(base.getForeignKeys().stream()
                    .map(fk -> fk.toBuilder().clearColumns().columns(rename(fk.getColumns(), op)).build())
                    .toList());
            target.clearIndexes().indexes(base.getIndexes().stream()
                    .map(i -> i.toBuilder().clearColumns().columns(rename(i.getColumns(), op)).build())
                    .toList());
            return new RebuildPlan(base.getName(), target.build(), sources);
        }

        @Override
        public RebuildPlan visitAlterColumn(AlterColumn op) {
            TableModel target = base.toBuilder()
                    .clearColumns()
                    .columns(base.getColumns().stream()
                            .map(c -> c.getName().equalsIgnoreCase(op.columnName()) ? op.to() : c)
                            .toList())
                    .build();
            return new RebuildPlan(base.getName(), target, identity(target.getColumns()));
        }

        @Override
        public RebuildPlan visitAddForeignKey(AddForeignKey op) {
            TableModel target = base.toBuilder().foreignKey(op.foreignKey()).build();
            return new RebuildPlan(base.getName(), target, identity(base.getColumns()));
        }

        @Override
        public RebuildPlan visitDropForeignKey(DropForeignKey op) {
            List<ForeignKeyModel> remaining = base.getForeignKeys().stream()
                    .filter(fk -> !fk.sameStructure(op.foreignKey()))
                    .toList();
            TableModel target = base.toBuilder().clearForeignKeys().foreignKeys(remaining).build();
            return new RebuildPlan(base.getName(), target, identity(base.getColumns()));
        }

        @Override
        public RebuildPlan visitRebuildTable(RebuildTable op) {
            TableModel target = op.definition();
            Map<String, String> sources = new LinkedHashMap<>();
            for (ColumnModel c : target.getColumns()) {
                String source = op.columnSources().getOrDefault(c.getName(), c.getName());
                if (base.hasColumn(source)) {
                    sources.put(c.getName(), source);
                }
            }
            return new RebuildPlan(base.getName(), target, sources);
        }

        @Override
        public RebuildPlan visitCreateTable(CreateTable op) {
            throw unsupported(op);
        }

        @Override
        public RebuildPlan visitDropTable(DropTable op) {
            throw unsupported(op);
        }

        @Override
        public RebuildPlan visitCreateIndex(CreateIndex op) {
            throw unsupported(op);
        }

        @Override
        public RebuildPlan visitDropIndex(DropIndex op) {
            throw unsupported(op);
        }

        @Override
        public RebuildPlan visitExecuteSql(ExecuteSql op) {
            throw unsupported(op);
        }

        private static Map<String, String> identity(List<ColumnModel> columns) {
            Map<String, String> sources = new LinkedHashMap<>();
            columns.forEach(c -> sources.put(c.getName(), c.getName()));
            return sources;
        }

        private static List<String> rename(List<String> columns, RenameColumn op) {
            return columns.stream().map(c -> c.equalsIgnoreCase(op.from()) ? op.to() : c).toList();
        }

        private static IllegalStateException unsupported(SchemaOperation op) {
            return new IllegalStateException(op.kind() + " never runs as a rebuild");
        }
    }
}
