package com.dbexplorer.domain;

import com.dbexplorer.api.QueryResult;
import lombok.Value;

@Value
public class DomainPage {
    String domainId;
    QueryResult result;
    int page;
    int pageSize;
    long total;

    public boolean isHasNext() {
        return (long) (page + 1) * pageSize < total;
    }
}
