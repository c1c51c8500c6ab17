package com.dbexplorer.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

@Value
@Builder
public class TodaySummary {
    LocalDate date;
    String timeZone;
    Map<String, Object> weightLatest;
    Double stepsToday;
    Map<String, Object> sleepLast;
    RangeAggregate heart;
}
