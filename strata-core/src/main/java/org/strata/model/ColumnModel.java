package org.strata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Locale;
import java.util.Objects;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class ColumnModel {
    String name;
    String type;
    @Builder.Default boolean nullable = true;
    @Builder.Default String defaultValue = null; // SQL 표현식 그대로 ('MANUAL', 0, CURRENT_TIMESTAMP)
    @Builder.Default boolean primaryKey = false;
    @Builder.Default boolean autoIncrement = false;

    public ColumnModel renamed(String newName) {
        return toBuilder().name(newName).build();
    }

    /**
     * Structural comparison used by the idempotency guard and rebuild detection.
     * Names compare case-insensitively, types after whitespace/case normalization.
     * Nullability is not compared between two primary key columns.
     */
    @JsonIgnore
    public boolean sameDefinition(ColumnModel other) {
        if (other == null) return false;
        return name.equalsIgnoreCase(other.name)
                && normalizeType(type).equals(normalizeType(other.type))
                && primaryKey == other.primaryKey
                && (primaryKey || nullable == other.nullable);
    }

    public static String normalizeType(String type) {
        if (type == null) return "";
        return type.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
    }

    @JsonIgnore
    public long getDefinitionHash() {
        return Objects.hash(name.toLowerCase(Locale.ROOT), normalizeType(type), nullable, primaryKey);
    }
}
