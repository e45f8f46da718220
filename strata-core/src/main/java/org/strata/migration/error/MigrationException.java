package org.strata.migration.error;

/**
 * Base type of every failure raised by the migration engine.
 */
public abstract class MigrationException extends RuntimeException {

    protected MigrationException(String message) {
        super(message);
    }

    protected MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
