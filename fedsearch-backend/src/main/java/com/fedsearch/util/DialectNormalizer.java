package com.fedsearch.util;

import java.util.Locale;
import java.util.Map;

/**
 * Normalizes configured dialect names (and aliases) into canonical dialect strings.
 */
public final class DialectNormalizer {

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("postgresql", "postgres"),
            Map.entry("pg", "postgres"),
            Map.entry("mssql", "sqlserver"),
            Map.entry("sql_server", "sqlserver"),
            Map.entry("mariadb", "mysql"),
            Map.entry("sqlite3", "sqlite")
    );

    private DialectNormalizer() {
    }

    /**
     * Normalize a dialect name.
     *
     * @param dialect configured dialect
     * @return normalized dialect (lowercased + alias mapping), empty for null/blank
     */
    public static String normalize(String dialect) {
        if (dialect == null) {
            return "";
        }
        String v = dialect.trim().toLowerCase(Locale.ROOT);
        if (v.isBlank()) {
            return "";
        }
        return ALIASES.getOrDefault(v, v);
    }
}
