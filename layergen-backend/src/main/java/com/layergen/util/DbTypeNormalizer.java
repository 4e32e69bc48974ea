package com.layergen.util;

import java.util.Locale;
import java.util.Map;

/**
 * Normalizes DSN schemes and dbType aliases into canonical dbType strings.
 */
public final class DbTypeNormalizer {

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("postgresql", "postgres"),
            Map.entry("pg", "postgres"),
            Map.entry("postgres", "postgres"),
            Map.entry("mysql", "mysql"),
            Map.entry("mariadb", "mysql"),
            Map.entry("h2", "h2")
    );

    private DbTypeNormalizer() {
    }

    /**
     * Normalize dbType.
     *
     * @param dbType incoming dbType
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

    /**
     * Derive the dbType from a JDBC URL such as {@code jdbc:postgresql://...}.
     *
     * @param jdbcUrl jdbc url
     * @return normalized dbType, empty if the URL is not a JDBC URL
     */
    public static String fromJdbcUrl(String jdbcUrl) {
        if (jdbcUrl == null || !jdbcUrl.startsWith("jdbc:")) {
            return "";
        }
        String rest = jdbcUrl.substring("jdbc:".length());
        int colon = rest.indexOf(':');
        return normalize(colon == -1 ? rest : rest.substring(0, colon));
    }
}
