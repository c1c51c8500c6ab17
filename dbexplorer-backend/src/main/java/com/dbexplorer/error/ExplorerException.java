package com.dbexplorer.error;

/**
 * Base type for every failure the explorer core reports to its callers.
 */
public abstract class ExplorerException extends RuntimeException {

    protected ExplorerException(String message) {
        super(message);
    }

    protected ExplorerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Category used by callers to pick a user-facing message.
     *
     * @return error kind
     */
    public abstract ErrorKind getKind();
}
