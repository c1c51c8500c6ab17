package com.dbexplorer.query;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Executable form of a guided request: identifiers checked and quoted, every value bound.
 */
@Value
@Builder
public class BuiltQuery {
    String table;
    List<String> columns;
    String sql;
    List<Object> params;
    String countSql;
    List<Object> countParams;
    int page;
    int pageSize;
    long offset;
    long fingerprint;
}
