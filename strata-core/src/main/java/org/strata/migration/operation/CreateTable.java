package org.strata.migration.operation;

import org.strata.model.TableModel;

import java.util.Objects;

public record CreateTable(TableModel definition) implements SchemaOperation {
    public CreateTable {
        Objects.requireNonNull(definition, "definition must not be null");
    }

    @Override
    public String table() {
        return definition.getName();
    }

    @Override
    public OperationKind kind() {
        return OperationKind.CREATE_TABLE;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitCreateTable(this);
    }
}
