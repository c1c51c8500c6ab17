package com.dbexplorer.error;

/**
 * The interaction that owned the query was cancelled while the statement was running.
 */
public class QueryCancelledException extends ExplorerException {

    public QueryCancelledException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CANCELLED;
    }
}
