package com.dbexplorer.domain;

import lombok.Value;

@Value
public class RangeAggregate {
    long count;
    Double sum;
    Double average;
    Double min;
    Double max;
}
