package com.dbexplorer.bot;

public enum GuidedStep {
    PICK_TABLE,
    PICK_COLUMNS,
    PICK_FILTER,
    AWAIT_FILTER_VALUE,
    PICK_ORDER,
    PICK_PAGE_SIZE,
    READY,
    AWAIT_RAW_SQL
}
