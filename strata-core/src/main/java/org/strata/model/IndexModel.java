package org.strata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Locale;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class IndexModel {
    String name;
    String table;
    @Singular List<String> columns;
    @Builder.Default boolean unique = false;

    @JsonIgnore
    public boolean sameStructure(IndexModel other) {
        if (other == null) return false;
        return name.equalsIgnoreCase(other.name)
                && unique == other.unique
                && columns.stream().map(c -> c.toLowerCase(Locale.ROOT)).toList()
                    .equals(other.columns.stream().map(c -> c.toLowerCase(Locale.ROOT)).toList());
    }

    public IndexModel ownedBy(String owner) {
        return toBuilder().table(owner).build();
    }

    public boolean covers(String column) {
        return columns.stream().anyMatch(c -> c.equalsIgnoreCase(column));
    }
}
