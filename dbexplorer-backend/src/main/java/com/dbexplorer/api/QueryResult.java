package com.dbexplorer.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Rows returned by one read-only execution.
 *
 * <p>Cells are transport-safe: numbers, booleans, strings, lists of those, or null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResult {
    private List<String> columns;
    private List<List<Object>> rows;
    private int appliedLimit;
    private long elapsedMs;
    private boolean truncated;
}
