package org.strata.migration.rebuild;

import org.strata.model.TableModel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Target structure of a copy-and-swap rebuild.
 *
 * @param table         live table being rebuilt
 * @param target        structure the table has once the rebuild completes
 * @param columnSources target column name to source column name, in copy order
 */
public record RebuildPlan(String table, TableModel target, Map<String, String> columnSources) {
    public RebuildPlan {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(target, "target");
        columnSources = Collections.unmodifiableMap(new LinkedHashMap<>(columnSources));
    }
}
