package org.strata.migration.operation;

import org.strata.model.ColumnModel;

import java.util.Objects;

/**
 * Drops a column. The full definition is carried so the step can be inverted.
 */
public record DropColumn(String table, ColumnModel column) implements SchemaOperation {
    public DropColumn {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(column, "column must not be null");
    }

    @Override
    public OperationKind kind() {
        return OperationKind.DROP_COLUMN;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitDropColumn(this);
    }
}
