package org.strata.migration.dialect;

public enum Strategy {
    /** A single structural statement against the live table. */
    DIRECT,
    /** Shadow table, copy rows, swap, drop the old table. */
    REBUILD
}
