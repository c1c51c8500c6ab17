package com.dbexplorer.domain;

import com.dbexplorer.error.DomainUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.function.Supplier;

/**
 * Cross-domain snapshots for today and for the last N days. Domains that are not available are
 * left out of the summary rather than failing it.
 */
@Slf4j
@Service
public class SummaryService {

    private final DomainQueryService queries;
    private final DomainResolver resolver;
    private final ZoneId zone;
    private final Clock clock;

    public SummaryService(DomainQueryService queries, DomainResolver resolver, ZoneId explorerZone, Clock clock) {
        this.queries = queries;
        this.resolver = resolver;
        this.zone = explorerZone;
        this.clock = clock;
    }

    public TodaySummary today() {
        TimeRanges.Range today = TimeRanges.todayRange(zone, clock);
        TodaySummary.TodaySummaryBuilder summary = TodaySummary.builder()
                .date(TimeRanges.today(zone, clock))
                .timeZone(zone.getId());

        summary.weightLatest(ifAvailable(DomainSpecs.WEIGHT,
                () -> queries.latestRow(DomainSpecs.WEIGHT.getId()).orElse(null)));
        summary.stepsToday(ifAvailable(DomainSpecs.STEPS,
                () -> queries.aggregate(DomainSpecs.STEPS.getId(), DomainSpecs.VALUE, today.getStart(), today.getEnd()).getSum()));
        summary.sleepLast(ifAvailable(DomainSpecs.SLEEP,
                () -> queries.latestInRange(DomainSpecs.SLEEP.getId(), today.getStart(), today.getEnd()).orElse(null)));
        summary.heart(ifAvailable(DomainSpecs.HEART,
                () -> queries.aggregate(DomainSpecs.HEART.getId(), DomainSpecs.VALUE, today.getStart(), today.getEnd())));
        return summary.build();
    }

    /**
     * Summary from local midnight {@code days} days ago up to the end of today.
     *
     * @param days number of days, at least 1
     * @return period summary
     */
    public PeriodSummary period(int days) {
        if (days < 1) {
            throw new IllegalArgumentException("Period must be at least one day: " + days);
        }
        Instant start = TimeRanges.daysAgo(days, zone, clock);
        Instant end = TimeRanges.todayRange(zone, clock).getEnd();
        PeriodSummary.PeriodSummaryBuilder summary = PeriodSummary.builder()
                .days(days)
                .timeZone(zone.getId());

        List<Double> weights = ifAvailable(DomainSpecs.WEIGHT,
                () -> queries.valuesInRange(DomainSpecs.WEIGHT.getId(), DomainSpecs.VALUE, start, end));
        if (weights != null && !weights.isEmpty()) {
            double first = weights.get(0);
            double last = weights.get(weights.size() - 1);
            summary.weightFirst(first).weightLast(last).weightDelta(last - first);
        }

        RangeAggregate steps = ifAvailable(DomainSpecs.STEPS,
                () -> queries.aggregate(DomainSpecs.STEPS.getId(), DomainSpecs.VALUE, start, end));
        if (steps != null) {
            summary.stepsAverage(steps.getAverage()).stepsTotal(steps.getSum());
        }

        summary.sleepAverageDuration(ifAvailable(DomainSpecs.SLEEP, () -> {
            ResolvedDomain sleep = resolver.require(DomainSpecs.SLEEP.getId());
            if (sleep.column(DomainSpecs.DURATION).isEmpty()) {
                return null;
            }
            return queries.aggregate(DomainSpecs.SLEEP.getId(), DomainSpecs.DURATION, start, end).getAverage();
        }));
        summary.heart(ifAvailable(DomainSpecs.HEART,
                () -> queries.aggregate(DomainSpecs.HEART.getId(), DomainSpecs.VALUE, start, end)));
        return summary.build();
    }

    private <T> T ifAvailable(DomainSpec spec, Supplier<T> part) {
        try {
            return part.get();
        } catch (DomainUnavailableException e) {
            log.info("Summary skips {}: {}", spec.getId(), e.getMessage());
            return null;
        }
    }
}
