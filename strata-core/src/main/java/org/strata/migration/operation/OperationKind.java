package org.strata.migration.operation;

public enum OperationKind {
    ADD_COLUMN,
    DROP_COLUMN,
    RENAME_COLUMN,
    ALTER_COLUMN,
    CREATE_TABLE,
    DROP_TABLE,
    ADD_FOREIGN_KEY,
    DROP_FOREIGN_KEY,
    REBUILD_TABLE,
    CREATE_INDEX,
    DROP_INDEX,
    EXECUTE_SQL;

    /**
     * Additive kinds are skipped when the target object already exists.
     */
    public boolean isAdditive() {
        return switch (this) {
            case ADD_COLUMN, CREATE_TABLE, ADD_FOREIGN_KEY, CREATE_INDEX -> true;
            default -> false;
        };
    }

    /**
     * Destructive kinds are skipped when the target object is already absent.
     */
    public boolean isDestructive() {
        return switch (this) {
            case DROP_COLUMN, DROP_TABLE, DROP_FOREIGN_KEY, DROP_INDEX -> true;
            default -> false;
        };
    }
}
