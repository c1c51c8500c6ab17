package com.dbexplorer.bot;

import com.dbexplorer.query.FilterChoice;
import com.dbexplorer.query.FilterOperator;
import com.dbexplorer.query.GuidedQueryRequest;
import com.dbexplorer.query.OrderChoice;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Choices a user made so far in the guided flow.
 */
@Data
public class GuidedSession {
    private final Long userId;
    private GuidedStep step = GuidedStep.PICK_TABLE;
    private String table;
    private List<String> columns = new ArrayList<>();
    private String filterColumn;
    private FilterOperator filterOperator;
    private String filterValue;
    private OrderChoice order;
    private int pageSize;
    private Long fingerprint;
    private Instant lastAccessedAt;

    public GuidedSession(Long userId, Instant now) {
        this.userId = userId;
        this.lastAccessedAt = now;
    }

    public void clearFilter() {
        filterColumn = null;
        filterOperator = null;
        filterValue = null;
    }

    public GuidedQueryRequest toRequest(int page) {
        FilterChoice filter = filterColumn == null ? null : new FilterChoice(filterColumn, filterOperator, filterValue);
        return GuidedQueryRequest.builder()
                .table(table)
                .columns(List.copyOf(columns))
                .filter(filter)
                .order(order)
                .page(page)
                .pageSize(pageSize)
                .build();
    }
}
