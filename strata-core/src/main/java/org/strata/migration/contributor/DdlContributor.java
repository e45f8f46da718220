package org.strata.migration.contributor;

public interface DdlContributor {
    /**
     * Lower values contribute first.
     */
    int priority();
}
