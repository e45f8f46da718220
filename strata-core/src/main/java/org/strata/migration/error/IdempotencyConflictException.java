package org.strata.migration.error;

import lombok.Getter;
import org.strata.migration.operation.SchemaOperation;

/**
 * Live schema matches neither the pre- nor the post-condition of an operation, e.g. the
 * column exists with a different type. Needs an operator to decide what is intended.
 */
@Getter
public class IdempotencyConflictException extends MigrationException {

    private final transient SchemaOperation operation;

    public IdempotencyConflictException(SchemaOperation operation, String message) {
        super(operation.kind() + " on '" + operation.table() + "': " + message);
        this.operation = operation;
    }
}
