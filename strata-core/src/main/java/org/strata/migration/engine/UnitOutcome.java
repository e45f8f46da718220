package org.strata.migration.engine;

import org.strata.model.Direction;

/**
 * @param appliedOperations operations that changed the schema
 * @param skippedOperations operations the live schema already satisfied
 */
public record UnitOutcome(String unitId, Direction direction, UnitState state,
                          int appliedOperations, int skippedOperations) {
}
