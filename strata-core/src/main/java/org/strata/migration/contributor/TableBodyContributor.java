package org.strata.migration.contributor;

import org.strata.migration.dialect.Dialect;

/**
 * Writes definitions inside the {@code CREATE TABLE (...)} body, one per line, each
 * terminated by {@code ",\n"}.
 */
public interface TableBodyContributor extends DdlContributor {
    void contribute(StringBuilder sb, Dialect dialect);
}
