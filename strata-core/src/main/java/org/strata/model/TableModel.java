package org.strata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Optional;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class TableModel {
    String name;
    @Singular List<ColumnModel> columns;
    @Singular List<ForeignKeyModel> foreignKeys;
    @Singular List<IndexModel> indexes;

    public Optional<ColumnModel> findColumn(String columnName) {
        return columns.stream().filter(c -> c.getName().equalsIgnoreCase(columnName)).findFirst();
    }

    public boolean hasColumn(String columnName) {
        return findColumn(columnName).isPresent();
    }

    public Optional<IndexModel> findIndex(String indexName) {
        return indexes.stream().filter(i -> i.getName().equalsIgnoreCase(indexName)).findFirst();
    }

    public boolean hasForeignKey(ForeignKeyModel fk) {
        return foreignKeys.stream().anyMatch(existing -> existing.sameStructure(fk));
    }

    @JsonIgnore
    public List<String> getPrimaryKeyColumns() {
        return columns.stream().filter(ColumnModel::isPrimaryKey).map(ColumnModel::getName).toList();
    }

    /**
     * Compares column set, column definitions, foreign keys and index structure.
     * Column order and constraint names are ignored.
     */
    @JsonIgnore
    public boolean sameStructure(TableModel other) {
        if (other == null || !name.equalsIgnoreCase(other.name)) return false;
        if (columns.size() != other.columns.size()) return false;
        for (ColumnModel column : columns) {
            if (!column.sameDefinition(other.findColumn(column.getName()).orElse(null))) {
                return false;
            }
        }
        if (foreignKeys.size() != other.foreignKeys.size()
                || !foreignKeys.stream().allMatch(other::hasForeignKey)) {
            return false;
        }
        return indexes.size() == other.indexes.size()
                && indexes.stream().allMatch(i -> i.sameStructure(other.findIndex(i.getName()).orElse(null)));
    }
}
