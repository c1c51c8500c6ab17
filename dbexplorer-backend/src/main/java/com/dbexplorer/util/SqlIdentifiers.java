package com.dbexplorer.util;

/**
 * Quoting for identifiers that were already checked against the schema catalog.
 *
 * Only names read back from {@code information_schema} may be passed here; user text never is.
 */
public final class SqlIdentifiers {

    private SqlIdentifiers() {
    }

    public static String quote(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier must not be empty");
        }
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    public static String qualified(String schema, String table) {
        if (schema == null || schema.isEmpty()) {
            return quote(table);
        }
        return quote(schema) + "." + quote(table);
    }
}
