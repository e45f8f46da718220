package org.strata.migration.state;

import org.strata.model.HistoryEntry;

import java.util.List;
import java.util.Set;

/**
 * Applied-version record kept inside the target store.
 */
public interface StateStore {

    /**
     * Creates the bookkeeping tables if they are missing.
     */
    void initialize();

    /**
     * @return whether {@link #initialize()} has run against this store; read-only
     */
    boolean isInitialized();

    /**
     * @return current heads; empty when nothing was ever applied
     */
    Set<String> getCurrent();

    /**
     * Replaces the current heads and appends {@code entry} to the history in one write,
     * on the connection (and transaction) the schema changes ran on. Either all of it
     * lands or none of it does.
     */
    void setCurrent(Set<String> heads, HistoryEntry entry);

    /**
     * @return history entries, oldest first
     */
    List<HistoryEntry> history();
}
