package com.dbexplorer.query;

import lombok.Value;

@Value
public class OrderChoice {
    String column;
    SortDirection direction;
}
