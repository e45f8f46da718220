package org.strata.migration.error;

import lombok.Getter;

/**
 * Structural problem with the unit graph or a requested target. Always raised before any
 * DDL runs.
 */
@Getter
public class GraphException extends MigrationException {

    public enum Kind {
        DUPLICATE_ID,
        DANGLING_PARENT,
        CYCLE,
        MULTIPLE_UNMERGED_HEADS,
        UNKNOWN_VERSION,
        INVALID_TARGET
    }

    private final Kind kind;

    public GraphException(Kind kind, String message) {
        super(kind + ": " + message);
        this.kind = kind;
    }
}
