package org.strata.migration.dialect;

import org.strata.migration.dialect.mysql.MySqlDialect;
import org.strata.migration.dialect.sqlite.SqliteDialect;

import java.util.Locale;

public final class Dialects {

    private Dialects() {
    }

    public static Dialect forName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Dialect name is required");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "sqlite" -> new SqliteDialect();
            case "mysql" -> new MySqlDialect();
            default -> throw new IllegalArgumentException("Unsupported dialect: " + name);
        };
    }

    /**
     * Guesses the dialect from a JDBC URL such as {@code jdbc:sqlite:app.db}.
     */
    public static Dialect forUrl(String jdbcUrl) {
        if (jdbcUrl == null || !jdbcUrl.startsWith("jdbc:")) {
            throw new IllegalArgumentException("Not a JDBC url: " + jdbcUrl);
        }
        String rest = jdbcUrl.substring("jdbc:".length());
        int colon = rest.indexOf(':');
        return forName(colon < 0 ? rest : rest.substring(0, colon));
    }
}
