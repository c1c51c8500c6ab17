package com.dbexplorer.query;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Choices collected by the guided flow. An empty column list selects every column.
 */
@Value
@Builder(toBuilder = true)
public class GuidedQueryRequest {
    String table;
    @Builder.Default
    List<String> columns = List.of();
    FilterChoice filter;
    OrderChoice order;
    int page;
    int pageSize;
}
