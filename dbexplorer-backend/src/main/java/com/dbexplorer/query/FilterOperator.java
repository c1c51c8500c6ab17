package com.dbexplorer.query;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of filter operators offered by the guided builder.
 */
public enum FilterOperator {
    EQ("eq", "=", true),
    NE("ne", "<>", true),
    GT("gt", ">", true),
    GE("ge", ">=", true),
    LT("lt", "<", true),
    LE("le", "<=", true),
    CONTAINS("contains", "LIKE", true),
    IS_NULL("null", "IS NULL", false),
    IS_NOT_NULL("notnull", "IS NOT NULL", false);

    private final String code;
    private final String sql;
    private final boolean valueRequired;

    FilterOperator(String code, String sql, boolean valueRequired) {
        this.code = code;
        this.sql = sql;
        this.valueRequired = valueRequired;
    }

    /**
     * Short code used in callback payloads.
     */
    public String getCode() {
        return code;
    }

    public String getSql() {
        return sql;
    }

    public boolean isValueRequired() {
        return valueRequired;
    }

    public static Optional<FilterOperator> fromCode(String code) {
        return Arrays.stream(values()).filter(op -> op.code.equalsIgnoreCase(code)).findFirst();
    }
}
