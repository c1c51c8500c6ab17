package com.dbexplorer.domain;

import lombok.Value;

/**
 * Average of the latest {@code window} values against the {@code window} values before them.
 * Either average is null when there were not enough rows.
 */
@Value
public class Trend {
    String domainId;
    int window;
    Double recentAverage;
    Double previousAverage;

    public Double getDelta() {
        if (recentAverage == null || previousAverage == null) {
            return null;
        }
        return recentAverage - previousAverage;
    }
}
