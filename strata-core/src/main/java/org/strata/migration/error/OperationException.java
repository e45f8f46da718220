package org.strata.migration.error;

import lombok.Getter;

/**
 * An underlying statement failed against the target store.
 */
@Getter
public class OperationException extends MigrationException {

    private final String statement;

    public OperationException(String message) {
        this(message, null, null);
    }

    public OperationException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public OperationException(String message, String statement, Throwable cause) {
        super(statement == null ? message : message + " [" + statement.strip() + "]", cause);
        this.statement = statement;
    }
}
