package org.strata.migration.operation;

import org.strata.model.ColumnModel;

import java.util.Objects;

public record AddColumn(String table, ColumnModel column) implements SchemaOperation {
    public AddColumn {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(column, "column must not be null");
    }

    @Override
    public OperationKind kind() {
        return OperationKind.ADD_COLUMN;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitAddColumn(this);
    }
}
