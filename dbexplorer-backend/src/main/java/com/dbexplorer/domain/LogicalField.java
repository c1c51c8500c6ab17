package com.dbexplorer.domain;

import lombok.Value;

import java.util.List;

/**
 * A semantic column of a domain and the physical names it may go by, most preferred first.
 */
@Value
public class LogicalField {
    String name;
    boolean required;
    List<String> candidates;

    public static LogicalField required(String name, String... candidates) {
        return new LogicalField(name, true, List.of(candidates));
    }

    public static LogicalField optional(String name, String... candidates) {
        return new LogicalField(name, false, List.of(candidates));
    }
}
