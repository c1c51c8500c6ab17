package com.dbexplorer.service;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.Set;

/**
 * HikariCP SQL exception override that keeps connections alive for errors a read-only explorer
 * expects to see during normal use.
 *
 * <p>A user query hitting a read-only transaction, an undefined table or column, a syntax error or
 * a cancellation leaves the connection perfectly usable, so it must not be evicted.
 */
public class HikariSqlExceptionOverride implements SQLExceptionOverride {

    private static final Set<String> NON_FATAL_STATES = Set.of(
            "25006", // read_only_sql_transaction
            "42P01", // undefined_table
            "42703", // undefined_column
            "42601", // syntax_error
            "42883", // undefined_function
            "22P02", // invalid_text_representation
            "57014"  // query_canceled
    );

    /**
     * Decide whether Hikari should evict a connection based on the exception.
     *
     * @param sqlException SQL exception
     * @return override decision
     */
    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }

        if (sqlException instanceof SQLFeatureNotSupportedException) {
            return Override.DO_NOT_EVICT;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState == null) {
            return Override.CONTINUE_EVICT;
        }
        if (sqlState.startsWith("0A") || NON_FATAL_STATES.contains(sqlState)) {
            return Override.DO_NOT_EVICT;
        }
        return Override.CONTINUE_EVICT;
    }
}
