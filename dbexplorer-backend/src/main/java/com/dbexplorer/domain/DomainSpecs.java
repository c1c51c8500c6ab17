package com.dbexplorer.domain;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The built-in domains and where their data is usually found.
 */
public final class DomainSpecs {
    public static final String TIMESTAMP = "timestamp";
    public static final String VALUE = "value";
    public static final String SOURCE = "source";
    public static final String END = "end";
    public static final String DURATION = "duration";
    public static final String STAGES = "stages";
    public static final String MIN = "min";
    public static final String MAX = "max";

    public static final DomainSpec WEIGHT = new DomainSpec("weight", "Weight",
            List.of("measurements_weight", "weight", "weight_measurements", "body_weight"),
            List.of(
                    LogicalField.required(TIMESTAMP, "date", "measured_at", "timestamp", "created_at", "time"),
                    LogicalField.required(VALUE, "weight_kg", "weight", "value", "kg"),
                    LogicalField.optional(SOURCE, "source", "data_source", "origin")
            ));

    public static final DomainSpec STEPS = new DomainSpec("steps", "Steps",
            List.of("steps_daily", "steps", "daily_steps", "activity_steps"),
            List.of(
                    LogicalField.required(TIMESTAMP, "date", "measured_at", "timestamp", "created_at", "day"),
                    LogicalField.required(VALUE, "steps", "step_count", "value", "total_steps"),
                    LogicalField.optional(SOURCE, "source", "data_source", "origin")
            ));

    public static final DomainSpec SLEEP = new DomainSpec("sleep", "Sleep",
            List.of("sleep_sessions", "sleep", "sleep_data", "sleep_records"),
            List.of(
                    LogicalField.required(TIMESTAMP, "start", "start_time", "sleep_start", "bedtime", "started_at",
                            "date", "night", "created_at"),
                    LogicalField.optional(END, "end", "end_time", "sleep_end", "wake_time", "ended_at"),
                    LogicalField.optional(DURATION, "duration", "duration_minutes", "total_minutes", "sleep_duration"),
                    LogicalField.optional(STAGES, "stages", "stages_summary", "sleep_stages")
            ));

    public static final DomainSpec HEART = new DomainSpec("heart", "Heart rate",
            List.of("heart_rate_daily", "heart_rate_samples", "heart_rate", "heartrate", "hr_data"),
            List.of(
                    LogicalField.required(TIMESTAMP, "date", "measured_at", "timestamp", "created_at", "time", "day"),
                    LogicalField.required(VALUE, "bpm", "heart_rate", "avg_bpm", "value", "resting_hr", "avg_hr"),
                    LogicalField.optional(MIN, "min_bpm", "min_hr", "resting_hr"),
                    LogicalField.optional(MAX, "max_bpm", "max_hr")
            ));

    public static final List<DomainSpec> ALL = List.of(WEIGHT, STEPS, SLEEP, HEART);

    private DomainSpecs() {
    }

    public static Optional<DomainSpec> find(String domainId) {
        if (domainId == null) {
            return Optional.empty();
        }
        String id = domainId.trim().toLowerCase(Locale.ROOT);
        return ALL.stream().filter(s -> s.getId().equals(id)).findFirst();
    }
}
