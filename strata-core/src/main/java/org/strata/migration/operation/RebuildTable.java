package org.strata.migration.operation;

import org.strata.model.TableModel;

import java.util.Map;
import java.util.Objects;

/**
 * Rebuilds a table into {@code definition} by copy-and-swap.
 *
 * @param definition   target table shape
 * @param columnSources target column name to source column name, for columns renamed by the
 *                     rebuild; unmapped target columns are copied from the same-named source
 *                     column when one exists
 */
public record RebuildTable(TableModel definition, Map<String, String> columnSources) implements SchemaOperation {
    public RebuildTable {
        Objects.requireNonNull(definition, "definition must not be null");
        columnSources = columnSources == null ? Map.of() : Map.copyOf(columnSources);
    }

    public RebuildTable(TableModel definition) {
        this(definition, Map.of());
    }

    @Override
    public String table() {
        return definition.getName();
    }

    @Override
    public OperationKind kind() {
        return OperationKind.REBUILD_TABLE;
    }

    @Override
    public <R> R accept(OperationVisitor<R> visitor) {
        return visitor.visitRebuildTable(this);
    }
}
