package com.dbexplorer.query;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A raw SELECT that passed every validation rule. Only {@link QueryValidator} creates these.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public class ValidatedQuery {
    String sql;
    int appliedLimit;
}
