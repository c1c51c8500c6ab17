package com.dbexplorer.domain;

import com.dbexplorer.model.TableDescriptor;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * A domain bound to one physical table, with every matched logical field mapped to its actual
 * column name. Optional fields that did not match are simply absent from {@code columns}.
 */
@Value
public class ResolvedDomain {
    String domainId;
    TableDescriptor table;
    Map<String, String> columns;

    public ResolvedDomain(String domainId, TableDescriptor table, Map<String, String> columns) {
        this.domainId = domainId;
        this.table = table;
        this.columns = Map.copyOf(columns);
    }

    public Optional<String> column(String field) {
        return Optional.ofNullable(columns.get(field));
    }

    public String timestampColumn() {
        return columns.get(DomainSpecs.TIMESTAMP);
    }
}
