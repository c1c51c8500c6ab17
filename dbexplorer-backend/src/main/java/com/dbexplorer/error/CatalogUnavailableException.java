package com.dbexplorer.error;

/**
 * The database could not be reached. Transient: callers retry on the next user action and must
 * never read this as "table absent".
 */
public class CatalogUnavailableException extends ExplorerException {

    public CatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CATALOG_UNAVAILABLE;
    }
}
