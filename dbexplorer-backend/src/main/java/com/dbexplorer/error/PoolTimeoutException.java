package com.dbexplorer.error;

/**
 * Every pooled connection stayed busy for the whole acquire timeout.
 */
public class PoolTimeoutException extends ExplorerException {

    public PoolTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.POOL_TIMEOUT;
    }
}
