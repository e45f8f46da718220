package org.strata.migration.operation;

import org.strata.model.TableModel;

import java.util.Objects;

public record DropTable(TableModel definition) implements SchemaOperation {
    public DropTable {
        Objects.requireNonNull(definition, "definition must not be null");
    }

    @Override
    public String table() {
        return definition.getName();
    }

    @Override
    public OperationKind kind() {
        return OperationKind.DROP_TABLE;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitDropTable(this);
    }
}
