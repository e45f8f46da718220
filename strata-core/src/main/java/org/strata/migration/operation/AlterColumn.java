package org.strata.migration.operation;

import org.strata.model.ColumnModel;

import java.util.Objects;

/**
 * Changes type and/or nullability of a column. {@code from} is the expected existing
 * definition, {@code to} the target; both must name the same column.
 */
public record AlterColumn(String table, ColumnModel from, ColumnModel to) implements SchemaOperation {
    public AlterColumn {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        if (!from.getName().equalsIgnoreCase(to.getName())) {
            throw new IllegalArgumentException("alter_column cannot rename (" + from.getName()
                    + " -> " + to.getName() + "); use rename_column");
        }
    }

    public String columnName() {
        return to.getName();
    }

    @Override
    public OperationKind kind() {
        return OperationKind.ALTER_COLUMN;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitAlterColumn(this);
    }
}
