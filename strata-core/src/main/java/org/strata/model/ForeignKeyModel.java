package org.strata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Locale;

/**
 * Foreign key definition. {@code table} names the owning (referencing) table and may be
 * omitted when the key is declared inside a {@link TableModel}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ForeignKeyModel {
    String name;
    String table;
    @Singular List<String> columns;
    String referencedTable;
    @Singular List<String> referencedColumns;
    String onDelete;
    String onUpdate;

    /**
     * 이름이 아닌 구조(컬럼, 참조 테이블, 참조 컬럼)로 비교합니다.
     * SQLite는 FK 제약 이름을 메타데이터에 보존하지 않기 때문입니다.
     */
    @JsonIgnore
    public boolean sameStructure(ForeignKeyModel other) {
        if (other == null) return false;
        return lower(columns).equals(lower(other.columns))
                && referencedTable.equalsIgnoreCase(other.referencedTable)
                && lower(referencedColumns).equals(lower(other.referencedColumns));
    }

    public ForeignKeyModel ownedBy(String owner) {
        return toBuilder().table(owner).build();
    }

    public boolean references(String column) {
        return columns.stream().anyMatch(c -> c.equalsIgnoreCase(column));
    }

    private static List<String> lower(List<String> values) {
        return values.stream().map(v -> v.toLowerCase(Locale.ROOT)).toList();
    }
}
