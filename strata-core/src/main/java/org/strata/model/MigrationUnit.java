package org.strata.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import org.strata.migration.operation.SchemaOperation;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Immutable descriptor of one versioned, reversible schema change step.
 *
 * <p>{@code parentIds} is an ordered set: empty for a root, one entry for a normal step,
 * two or more for a merge node. Duplicate parent entries collapse to their first occurrence.
 */
@Getter
@ToString(of = {"id", "parentIds"})
@EqualsAndHashCode(of = "id")
public final class MigrationUnit {

    private final String id;
    private final List<String> parentIds;
    private final List<SchemaOperation> forwardOps;
    private final List<SchemaOperation> backwardOps;
    private final String description;

    @Builder
    private MigrationUnit(String id,
                          @Singular List<String> parentIds,
                          @Singular List<SchemaOperation> forwardOps,
                          @Singular List<SchemaOperation> backwardOps,
                          String description) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Migration unit id must not be blank");
        }
        this.id = id.trim();
        this.parentIds = List.copyOf(new LinkedHashSet<>(Objects.requireNonNull(parentIds)));
        this.forwardOps = List.copyOf(forwardOps);
        this.backwardOps = List.copyOf(backwardOps);
        this.description = description;
    }

    public boolean isRoot() {
        return parentIds.isEmpty();
    }

    public boolean isMerge() {
        return parentIds.size() > 1;
    }

    public List<SchemaOperation> operations(Direction direction) {
        return direction == Direction.UPGRADE ? forwardOps : backwardOps;
    }
}
