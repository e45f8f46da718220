package org.strata.migration.error;

import lombok.Getter;
import org.strata.model.Direction;

import java.util.Locale;

/**
 * A unit failed part-way. The state store still points at the last completed unit, so the
 * run can be resumed once the cause has been fixed.
 */
@Getter
public class UnitExecutionException extends MigrationException {

    private final String unitId;
    private final Direction direction;
    private final int operationIndex;

    public UnitExecutionException(String unitId, Direction direction, int operationIndex, Throwable cause) {
        super(String.format("Unit '%s' failed during %s at operation #%d: %s",
                unitId, direction.name().toLowerCase(Locale.ROOT), operationIndex, cause.getMessage()), cause);
        this.unitId = unitId;
        this.direction = direction;
        this.operationIndex = operationIndex;
    }
}
