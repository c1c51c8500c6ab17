package com.dbexplorer.error;

/**
 * Stable error categories that cross the core boundary.
 *
 * Raw driver errors are converted into one of these before they reach the interaction layer.
 */
public enum ErrorKind {
    CATALOG_UNAVAILABLE,
    DOMAIN_UNAVAILABLE,
    VALIDATION_REJECTED,
    POOL_TIMEOUT,
    INVALID_CURSOR,
    QUERY_FAILED,
    TABLE_NOT_FOUND,
    CANCELLED
}
