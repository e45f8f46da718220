package org.strata.migration.operation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A single structural change. The set of kinds is closed; every implementation is a record
 * in this package and is dispatched through {@link OperationVisitor}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "op")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AddColumn.class, name = "add_column"),
        @JsonSubTypes.Type(value = DropColumn.class, name = "drop_column"),
        @JsonSubTypes.Type(value = RenameColumn.class, name = "rename_column"),
        @JsonSubTypes.Type(value = AlterColumn.class, name = "alter_column"),
        @JsonSubTypes.Type(value = CreateTable.class, name = "create_table"),
        @JsonSubTypes.Type(value = DropTable.class, name = "drop_table"),
        @JsonSubTypes.Type(value = AddForeignKey.class, name = "add_foreign_key"),
        @JsonSubTypes.Type(value = DropForeignKey.class, name = "drop_foreign_key"),
        @JsonSubTypes.Type(value = RebuildTable.class, name = "rebuild_table"),
        @JsonSubTypes.Type(value = CreateIndex.class, name = "create_index"),
        @JsonSubTypes.Type(value = DropIndex.class, name = "drop_index"),
        @JsonSubTypes.Type(value = ExecuteSql.class, name = "execute")
})
public interface SchemaOperation {

    @JsonIgnore
    OperationKind kind();

    /**
     * Table the operation targets, or {@code null} for raw statements without one.
     */
    String table();

    <R> R accept(OperationVisitor<R> visitor);
}
