package org.strata.migration.dialect;

import lombok.Builder;
import lombok.Value;
import org.strata.migration.operation.OperationKind;

/**
 * What a backend can do without rebuilding a table. Queried once per run.
 */
@Value
@Builder
public class DialectCapabilities {
    boolean transactionalDdl;
    @Builder.Default boolean inPlaceAddColumn = true;
    boolean inPlaceDropColumn;
    boolean inPlaceRenameColumn;
    boolean inPlaceAlterColumn;
    boolean inPlaceForeignKeys;

    public boolean supportsInPlace(OperationKind kind) {
        return switch (kind) {
            case ADD_COLUMN -> inPlaceAddColumn;
            case DROP_COLUMN -> inPlaceDropColumn;
            case RENAME_COLUMN -> inPlaceRenameColumn;
            case ALTER_COLUMN -> inPlaceAlterColumn;
            case ADD_FOREIGN_KEY, DROP_FOREIGN_KEY -> inPlaceForeignKeys;
            case REBUILD_TABLE -> false;
            case CREATE_TABLE, DROP_TABLE, CREATE_INDEX, DROP_INDEX, EXECUTE_SQL -> true;
        };
    }
}
