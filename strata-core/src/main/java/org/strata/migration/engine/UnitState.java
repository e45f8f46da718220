package org.strata.migration.engine;

/**
 * Lifecycle of one unit within a run. {@link #FAILED} is terminal; nothing is retried.
 */
public enum UnitState {
    PENDING,
    APPLYING,
    REVERTING,
    APPLIED,
    FAILED;

    public boolean isTerminal() {
        return this == APPLIED || this == FAILED;
    }
}
