package org.strata.migration.operation;

import org.strata.model.ForeignKeyModel;

import java.util.Objects;

public record AddForeignKey(ForeignKeyModel foreignKey) implements SchemaOperation {
    public AddForeignKey {
        Objects.requireNonNull(foreignKey, "foreignKey must not be null");
        Objects.requireNonNull(foreignKey.getTable(), "foreignKey.table must not be null");
    }

    @Override
    public String table() {
        return foreignKey.getTable();
    }

    @Override
    public OperationKind kind() {
        return OperationKind.ADD_FOREIGN_KEY;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitAddForeignKey(this);
    }
}
