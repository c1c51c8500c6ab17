package com.dbexplorer.model;

import java.util.Locale;
import java.util.Set;

/**
 * Coarse type family of a column, enough to coerce filter values and pick default orderings.
 */
public enum ColumnCategory {
    NUMERIC,
    TIMESTAMP,
    TEXT,
    BOOLEAN,
    OTHER;

    private static final Set<String> NUMERIC_TYPES = Set.of(
            "smallint", "integer", "int", "int2", "int4", "int8", "bigint", "tinyint",
            "numeric", "decimal", "real", "double precision", "double", "float", "float4", "float8",
            "decfloat", "money", "serial", "bigserial", "smallserial"
    );

    private static final Set<String> TEXT_TYPES = Set.of("text", "citext", "name", "varchar", "char", "bpchar");

    /**
     * Map an {@code information_schema.columns.data_type} value to a category.
     *
     * @param dataType declared type as reported by the database
     * @return category, {@link #OTHER} when unknown
     */
    public static ColumnCategory fromDataType(String dataType) {
        if (dataType == null || dataType.isBlank()) {
            return OTHER;
        }
        String t = dataType.trim().toLowerCase(Locale.ROOT);
        int paren = t.indexOf('(');
        if (paren > 0) {
            t = t.substring(0, paren).trim();
        }

        if (t.equals("date") || t.startsWith("timestamp") || t.startsWith("time")) {
            return TIMESTAMP;
        }
        if (t.equals("boolean") || t.equals("bool")) {
            return BOOLEAN;
        }
        if (NUMERIC_TYPES.contains(t)) {
            return NUMERIC;
        }
        if (TEXT_TYPES.contains(t) || t.startsWith("character") || t.startsWith("varchar")) {
            return TEXT;
        }
        return OTHER;
    }
}
