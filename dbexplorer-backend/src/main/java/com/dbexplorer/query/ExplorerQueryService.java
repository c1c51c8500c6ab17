package com.dbexplorer.query;

import com.dbexplorer.api.QueryResult;
import com.dbexplorer.error.QueryFailedException;
import com.dbexplorer.service.ConnectionPool;
import com.dbexplorer.service.SchemaCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs user-originated queries: raw SELECTs through the validator, guided and browse listings
 * through the builder.
 */
@Slf4j
@Service
public class ExplorerQueryService {

    private final QueryValidator validator;
    private final GuidedQueryBuilder builder;
    private final ConnectionPool pool;
    private final SchemaCatalog catalog;
    private final int rawMaxRows;
    private final int browsePageSize;

    public ExplorerQueryService(QueryValidator validator,
                                GuidedQueryBuilder builder,
                                ConnectionPool pool,
                                SchemaCatalog catalog,
                                @Value("${explorer.query.raw-max-rows:100}") int rawMaxRows,
                                @Value("${explorer.query.browse-page-size:20}") int browsePageSize) {
        this.validator = validator;
        this.builder = builder;
        this.pool = pool;
        this.catalog = catalog;
        this.rawMaxRows = rawMaxRows;
        this.browsePageSize = browsePageSize;
    }

    public int getRawMaxRows() {
        return rawMaxRows;
    }

    public int getBrowsePageSize() {
        return browsePageSize;
    }

    /**
     * Validate and run free-text SQL.
     *
     * @param rawText text as typed
     * @return rows, at most the applied limit
     */
    public QueryResult runRaw(String rawText) {
        ValidatedQuery query = validator.validate(rawText, rawMaxRows);
        log.info("Running raw query with limit {}", query.getAppliedLimit());
        QueryResult result = pool.executeReadOnly(query.getSql(), List.of(), query.getAppliedLimit());
        result.setAppliedLimit(query.getAppliedLimit());
        return result;
    }

    /**
     * Build and run one page of a guided query together with its total row count. When the
     * database no longer knows the table or a column, the table shape is read again and the query
     * rebuilt and run once more.
     */
    public GuidedPage runGuided(GuidedQueryRequest request) {
        try {
            return runGuidedOnce(request);
        } catch (QueryFailedException e) {
            if (!e.isSchemaMismatch()) {
                throw e;
            }
            log.warn("Schema mismatch on table {}: {}; re-reading its columns", request.getTable(), e.getMessage());
            catalog.invalidate(request.getTable());
            return runGuidedOnce(request);
        }
    }

    private GuidedPage runGuidedOnce(GuidedQueryRequest request) {
        BuiltQuery query = builder.build(request);
        QueryResult count = pool.executeReadOnly(query.getCountSql(), query.getCountParams(), 1);
        long total = 0;
        if (!count.getRows().isEmpty() && count.getRows().get(0).get(0) instanceof Number number) {
            total = number.longValue();
        }
        QueryResult rows = pool.executeReadOnly(query.getSql(), query.getParams(), query.getPageSize());
        return new GuidedPage(query, rows, total);
    }

    /**
     * Fingerprint of the listing a request describes, whatever page it asks for.
     */
    public long fingerprintOf(GuidedQueryRequest request) {
        return builder.build(request.toBuilder().page(0).build()).getFingerprint();
    }

    public GuidedQueryRequest browseRequest(String table, int page) {
        return GuidedQueryRequest.builder()
                .table(table)
                .page(page)
                .pageSize(browsePageSize)
                .build();
    }
}
