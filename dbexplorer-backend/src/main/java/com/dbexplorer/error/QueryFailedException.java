package com.dbexplorer.error;

import java.util.Set;

/**
 * The database refused a statement that passed validation (syntax error, unknown relation, ...).
 */
public class QueryFailedException extends ExplorerException {
    // undefined table / undefined column, PostgreSQL and SQL:2003 flavours
    private static final Set<String> SCHEMA_MISMATCH_STATES = Set.of("42P01", "42703", "42S02", "42S22");

    private final String sqlState;

    public QueryFailedException(String message, String sqlState, Throwable cause) {
        super(message, cause);
        this.sqlState = sqlState;
    }

    public String getSqlState() {
        return sqlState;
    }

    /**
     * Whether the failure means a relation or column the caller relied on no longer exists.
     *
     * @return true for undefined table/column states
     */
    public boolean isSchemaMismatch() {
        return sqlState != null && SCHEMA_MISMATCH_STATES.contains(sqlState);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.QUERY_FAILED;
    }
}
