package org.strata.migration.error;

import lombok.Getter;

import java.nio.file.Path;

/**
 * A unit file could not be read or does not describe a valid unit.
 */
@Getter
public class UnitFileException extends MigrationException {

    private final transient Path file;

    public UnitFileException(Path file, String message, Throwable cause) {
        super(file + ": " + message, cause);
        this.file = file;
    }

    public UnitFileException(Path file, String message) {
        this(file, message, null);
    }
}
