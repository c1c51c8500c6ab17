package com.dbexplorer.error;

public class TableNotFoundException extends ExplorerException {
    private final String table;

    public TableNotFoundException(String table) {
        super("Table not found: " + table);
        this.table = table;
    }

    public String getTable() {
        return table;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.TABLE_NOT_FOUND;
    }
}
