package com.dbexplorer.query;

import lombok.Value;

/**
 * A single WHERE condition. {@code rawValue} is the text the user typed, coerced later by column type.
 */
@Value
public class FilterChoice {
    String column;
    FilterOperator operator;
    String rawValue;
}
