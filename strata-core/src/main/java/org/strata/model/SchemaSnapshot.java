package org.strata.model;

import lombok.ToString;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Point-in-time view of the live schema, keyed by case-normalized table name.
 */
@ToString
public final class SchemaSnapshot {

    private final Map<String, TableModel> tables;

    private SchemaSnapshot(Map<String, TableModel> tables) {
        this.tables = Collections.unmodifiableMap(tables);
    }

    public static SchemaSnapshot of(Collection<TableModel> tables) {
        Map<String, TableModel> byName = new LinkedHashMap<>();
        for (TableModel table : tables) {
            byName.put(key(table.getName()), table);
        }
        return new SchemaSnapshot(byName);
    }

    public static SchemaSnapshot empty() {
        return new SchemaSnapshot(Map.of());
    }

    public Optional<TableModel> table(String name) {
        return Optional.ofNullable(tables.get(key(name)));
    }

    public boolean hasTable(String name) {
        return tables.containsKey(key(name));
    }

    public Set<String> tableNames() {
        return tables.keySet();
    }

    public Collection<TableModel> tables() {
        return tables.values();
    }

    private static String key(String name) {
        return name == null ? "" : name.toLowerCase(Locale.ROOT);
    }
}
