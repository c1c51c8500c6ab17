package com.dbexplorer.error;

/**
 * A user query was refused before reaching the database.
 */
public class QueryRejectedException extends ExplorerException {
    private final RejectionReason reason;

    public QueryRejectedException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RejectionReason getReason() {
        return reason;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.VALIDATION_REJECTED;
    }
}
