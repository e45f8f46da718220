package org.strata.migration.operation;

import java.util.Objects;

public record RenameColumn(String table, String from, String to) implements SchemaOperation {
    public RenameColumn {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
    }

    @Override
    public OperationKind kind() {
        return OperationKind.RENAME_COLUMN;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitRenameColumn(this);
    }
}
