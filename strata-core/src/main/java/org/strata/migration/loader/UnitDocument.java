package org.strata.migration.loader;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import org.strata.migration.operation.SchemaOperation;

import java.util.ArrayList;
import java.util.List;

/**
 * On-disk form of a migration unit.
 *
 * <pre>
 * id: 3271f7f4e2f2
 * down_revision: 0d97964e8ad8        # string, list (merge) or null (root)
 * description: add account_id to tradingorder
 * upgrade:
 *   - op: add_column
 *     table: tradingorder
 *     column: { name: account_id, type: INTEGER }
 * downgrade:
 *   - op: drop_column
 *     table: tradingorder
 *     column: { name: account_id, type: INTEGER }
 * </pre>
 */
@Data
public class UnitDocument {

    @JsonProperty("id")
    private String id;

    @JsonProperty("down_revision")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> downRevision;

    @JsonProperty("description")
    private String description;

    @JsonProperty("upgrade")
    private List<SchemaOperation> upgrade = new ArrayList<>();

    @JsonProperty("downgrade")
    private List<SchemaOperation> downgrade = new ArrayList<>();
}
