package org.strata.migration.operation;

import org.strata.model.IndexModel;

import java.util.Objects;

public record DropIndex(IndexModel index) implements SchemaOperation {
    public DropIndex {
        Objects.requireNonNull(index, "index must not be null");
        Objects.requireNonNull(index.getTable(), "index.table must not be null");
    }

    @Override
    public String table() {
        return index.getTable();
    }

    @Override
    public OperationKind kind() {
        return OperationKind.DROP_INDEX;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitDropIndex(this);
    }
}
