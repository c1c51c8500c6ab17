package com.dbexplorer.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PeriodSummary {
    int days;
    String timeZone;
    Double weightFirst;
    Double weightLast;
    Double weightDelta;
    Double stepsAverage;
    Double stepsTotal;
    Double sleepAverageDuration;
    RangeAggregate heart;
}
