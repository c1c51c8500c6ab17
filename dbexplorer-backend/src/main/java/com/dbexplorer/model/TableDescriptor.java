package com.dbexplorer.model;

import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Introspected shape of one table. Identity is (schema, name) as spelled in the catalog.
 */
@Value
public class TableDescriptor {
    String schema;
    String name;
    List<ColumnDescriptor> columns;

    public TableDescriptor(String schema, String name, List<ColumnDescriptor> columns) {
        this.schema = schema;
        this.name = name;
        this.columns = List.copyOf(columns);
    }

    /**
     * Find a column ignoring case.
     *
     * @param columnName name as typed or configured
     * @return descriptor carrying the canonical column name
     */
    public Optional<ColumnDescriptor> findColumn(String columnName) {
        if (columnName == null) {
            return Optional.empty();
        }
        for (ColumnDescriptor c : columns) {
            if (c.getName().equals(columnName)) {
                return Optional.of(c);
            }
        }
        for (ColumnDescriptor c : columns) {
            if (c.getName().equalsIgnoreCase(columnName)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    public boolean hasColumn(String columnName) {
        return findColumn(columnName).isPresent();
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnDescriptor::getName).collect(Collectors.toList());
    }
}
