package com.dbexplorer.paging;

import lombok.Value;

/**
 * Position in a paged listing, bound to the filter it was issued for.
 */
@Value
public class QueryCursor {
    int page;
    long fingerprint;
    boolean totalKnown;
}
