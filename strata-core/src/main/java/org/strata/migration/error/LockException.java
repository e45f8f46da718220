package org.strata.migration.error;

/**
 * Another run holds the migration lock.
 */
public class LockException extends MigrationException {

    public LockException(String message) {
        super(message);
    }

    public LockException(String message, Throwable cause) {
        super(message, cause);
    }
}
