package org.strata.migration.dialect;

import org.strata.migration.CreateTableBuilder;
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
import org.strata.model.IndexModel;
import org.strata.model.TableModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Standard SQL rendering shared by the concrete dialects. Subclasses supply quoting, the
 * create-table envelope and the statements that differ between backends.
 */
public abstract class AbstractDialect implements Dialect {

    private final OperationVisitor<List<String>> renderer = new DirectRenderer();

    @Override
    public List<String> getStatements(SchemaOperation op) {
        return op.accept(renderer);
    }

    // Table

    @Override
    public List<String> getCreateTableSql(TableModel table) {
        return new CreateTableBuilder(table.getName(), this)
                .defaultsFrom(table, true, true)
                .build();
    }

    @Override
    public String getCreateShadowTableSql(TableModel target, String shadowName) {
        return new CreateTableBuilder(shadowName, this)
                .defaultsFrom(target, false, foreignKeyNamesAreTableScoped())
                .build()
                .get(0);
    }

    /**
     * Whether two tables may carry foreign keys with the same constraint name. When they
     * may not, shadow tables are created with unnamed keys.
     */
    protected boolean foreignKeyNamesAreTableScoped() {
        return true;
    }

    @Override
    public String getDropTableSql(String tableName) {
        return "DROP TABLE " + quoteIdentifier(tableName);
    }

    @Override
    public String getRenameTableSql(String from, String to) {
        return "ALTER TABLE " + quoteIdentifier(from) + " RENAME TO " + quoteIdentifier(to);
    }

    // Column / constraints

    @Override
    public String getColumnDefinitionSql(ColumnModel c, List<String> pkColumns) {
        StringBuilder sb = new StringBuilder();
        sb.append(quoteIdentifier(c.getName())).append(" ").append(c.getType());
        if (!c.isNullable()) {
            sb.append(" NOT NULL");
        }
        if (c.getDefaultValue() != null) {
            sb.append(" DEFAULT ").append(c.getDefaultValue());
        }
        return sb.toString();
    }

    @Override
    public String getPrimaryKeyDefinitionSql(List<String> pkColumns) {
        return "PRIMARY KEY (" + quoteAll(pkColumns) + ")";
    }

    @Override
    public String getForeignKeyDefinitionSql(ForeignKeyModel fk) {
        StringBuilder sb = new StringBuilder();
        if (fk.getName() != null && !fk.getName().isBlank()) {
            sb.append("CONSTRAINT ").append(quoteIdentifier(fk.getName())).append(" ");
        }
        sb.append("FOREIGN KEY (").append(quoteAll(fk.getColumns())).append(")")
                .append(" REFERENCES ").append(quoteIdentifier(fk.getReferencedTable()))
                .append(" (").append(quoteAll(fk.getReferencedColumns())).append(")");
        if (fk.getOnDelete() != null) {
            sb.append(" ON DELETE ").append(fk.getOnDelete());
        }
        if (fk.getOnUpdate() != null) {
            sb.append(" ON UPDATE ").append(fk.getOnUpdate());
        }
        return sb.toString();
    }

    @Override
    public String getCreateIndexSql(IndexModel index) {
        return "CREATE " + (index.isUnique() ? "UNIQUE " : "") + "INDEX " + quoteIdentifier(index.getName())
                + " ON " + quoteIdentifier(index.getTable()) + " (" + quoteAll(index.getColumns()) + ")";
    }

    protected String getAddColumnSql(String table, ColumnModel column) {
        return "ALTER TABLE " + quoteIdentifier(table) + " ADD COLUMN " + getColumnDefinitionSql(column, List.of());
    }

    protected String getDropColumnSql(String table, ColumnModel column) {
        return "ALTER TABLE " + quoteIdentifier(table) + " DROP COLUMN " + quoteIdentifier(column.getName());
    }

    protected String getRenameColumnSql(String table, String from, String to) {
        return "ALTER TABLE " + quoteIdentifier(table)
                + " RENAME COLUMN " + quoteIdentifier(from) + " TO " + quoteIdentifier(to);
    }

    protected String getAddForeignKeySql(ForeignKeyModel fk) {
        return "ALTER TABLE " + quoteIdentifier(fk.getTable()) + " ADD " + getForeignKeyDefinitionSql(fk);
    }

    protected abstract String getAlterColumnSql(String table, ColumnModel from, ColumnModel to);

    protected abstract String getDropForeignKeySql(ForeignKeyModel fk);

    protected abstract String getDropIndexSql(IndexModel index);

    // Rebuild

    @Override
    public String getCopyRowsSql(String source, String target, Map<String, String> targetToSource) {
        String targetColumns = targetToSource.keySet().stream()
                .map(this::quoteIdentifier)
                .collect(Collectors.joining(", "));
        String sourceColumns = targetToSource.values().stream()
                .map(this::quoteIdentifier)
                .collect(Collectors.joining(", "));
        return "INSERT INTO " + quoteIdentifier(target) + " (" + targetColumns + ") SELECT "
                + sourceColumns + " FROM " + quoteIdentifier(source);
    }

    protected String quoteAll(List<String> identifiers) {
        return identifiers.stream().map(this::quoteIdentifier).collect(Collectors.joining(", "));
    }

    private final class DirectRenderer implements OperationVisitor<List<String>> {

        @Override
        public List<String> visitAddColumn(AddColumn op) {
            return List.of(getAddColumnSql(op.table(), op.column()));
        }

        @Override
        public List<String> visitDropColumn(DropColumn op) {
            return List.of(getDropColumnSql(op.table(), op.column()));
        }

        @Override
        public List<String> visitRenameColumn(RenameColumn op) {
            return List.of(getRenameColumnSql(op.table(), op.from(), op.to()));
        }

        @Override
        public List<String> visitAlterColumn(AlterColumn op) {
            return List.of(getAlterColumnSql(op.table(), op.from(), op.to()));
        }

        @Override
        public List<String> visitCreateTable(CreateTable op) {
            return getCreateTableSql(op.definition());
        }

        @Override
        public List<String> visitDropTable(DropTable op) {
            return List.of(getDropTableSql(op.table()));
        }

        @Override
        public List<String> visitAddForeignKey(AddForeignKey op) {
            return List.of(getAddForeignKeySql(op.foreignKey()));
        }

        @Override
        public List<String> visitDropForeignKey(DropForeignKey op) {
            return List.of(getDropForeignKeySql(op.foreignKey()));
        }

        @Override
        public List<String> visitRebuildTable(RebuildTable op) {
            throw new UnsupportedOperationException("rebuild_table has no direct form; it always runs as a rebuild");
        }

        @Override
        public List<String> visitCreateIndex(CreateIndex op) {
            return List.of(getCreateIndexSql(op.index()));
        }

        @Override
        public List<String> visitDropIndex(DropIndex op) {
            return List.of(getDropIndexSql(op.index()));
        }

        @Override
        public List<String> visitExecuteSql(ExecuteSql op) {
            List<String> statements = new ArrayList<>();
            statements.add(op.sql());
            return statements;
        }
    }
}
