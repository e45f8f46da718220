package org.strata.model;

import java.util.Objects;

/**
 * One entry of a resolved migration path: the unit and the direction to run it in.
 */
public record PathStep(MigrationUnit unit, Direction direction) {
    public PathStep {
        Objects.requireNonNull(unit, "unit must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
    }

    public String unitId() {
        return unit.getId();
    }

    @Override
    public String toString() {
        return (direction == Direction.UPGRADE ? "+" : "-") + unit.getId();
    }
}
