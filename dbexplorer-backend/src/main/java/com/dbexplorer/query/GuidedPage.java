package com.dbexplorer.query;

import com.dbexplorer.api.QueryResult;
import lombok.Value;

@Value
public class GuidedPage {
    BuiltQuery query;
    QueryResult result;
    long total;

    public boolean isHasNext() {
        return query.getOffset() + query.getPageSize() < total;
    }
}
