package org.strata.migration.contributor;

import org.strata.migration.dialect.Dialect;

import java.util.List;

/**
 * Adds standalone statements that run after the table exists (indexes).
 */
public interface PostCreateContributor extends DdlContributor {
    void contribute(List<String> statements, Dialect dialect);
}
