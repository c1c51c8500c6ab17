package com.dbexplorer.domain;

import lombok.Value;

import java.util.List;
import java.util.Optional;

@Value
public class DomainSpec {
    String id;
    String label;
    List<String> candidateTables;
    List<LogicalField> fields;

    public Optional<LogicalField> field(String name) {
        return fields.stream().filter(f -> f.getName().equals(name)).findFirst();
    }
}
