package com.dbexplorer.util;

import java.util.Locale;
import java.util.Map;

/**
 * Normalizes DSN schemes and JDBC sub-protocols into canonical dbType strings.
 */
public final class DbTypeNormalizer {

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("postgresql", "postgres"),
            Map.entry("postgres", "postgres"),
            Map.entry("pg", "postgres"),
            Map.entry("pgsql", "postgres"),
            Map.entry("h2", "h2")
    );

    private DbTypeNormalizer() {
    }

    /**
     * Normalize dbType.
     *
     * @param dbType incoming dbType, DSN scheme or JDBC sub-protocol
     * @return normalized dbType (lowercased + alias mapping)
     */
    public static String normalize(String dbType) {
        if (dbType == null) {
            return "";
        }
        String v = dbType.trim().toLowerCase(Locale.ROOT);
        if (v.isBlank()) {
            return "";
        }
        return ALIASES.getOrDefault(v, v);
    }

    public static boolean isPostgres(String dbType) {
        return "postgres".equals(normalize(dbType));
    }
}
