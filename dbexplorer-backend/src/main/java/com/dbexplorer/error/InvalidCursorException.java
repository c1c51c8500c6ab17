package com.dbexplorer.error;

/**
 * A pagination token is malformed, forged, or was issued for a different view.
 */
public class InvalidCursorException extends ExplorerException {

    public InvalidCursorException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.INVALID_CURSOR;
    }
}
