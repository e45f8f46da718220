package org.strata.migration.operation;

import java.util.Objects;

/**
 * Raw data statement run between structural steps, e.g. a backfill before tightening
 * nullability. Live metadata cannot tell whether it already ran, so it is always executed
 * and must be written to be re-runnable ({@code UPDATE t SET c = 'X' WHERE c IS NULL}).
 */
public record ExecuteSql(String sql, String table) implements SchemaOperation {
    public ExecuteSql {
        Objects.requireNonNull(sql, "sql must not be null");
    }

    public ExecuteSql(String sql) {
        this(sql, null);
    }

    @Override
    public OperationKind kind() {
        return OperationKind.EXECUTE_SQL;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitExecuteSql(this);
    }
}
