package com.dbexplorer.domain;

import com.dbexplorer.support.ExplorerStack;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SummaryServiceTest {

    private ExplorerStack stack;

    @BeforeEach
    void setUp() {
        stack = new ExplorerStack(10);
    }

    @AfterEach
    void tearDown() {
        stack.close();
    }

    @Test
    void todayUsesLatestWeightAndSkipsMissingDomains() {
        TodaySummary today = stack.summaries.today();

        assertThat(today.getDate()).isEqualTo(LocalDate.of(2024, 1, 5));
        assertThat(today.getTimeZone()).isEqualTo("Atlantic/Reykjavik");
        assertThat(today.getWeightLatest()).containsEntry("weight_kg", 84.0);
        assertThat(today.getStepsToday()).isNull();
        assertThat(today.getHeart()).isNull();
        assertThat(today.getSleepLast()).isNull();
    }

    @Test
    void weekComparesFirstAndLastWeight() {
        PeriodSummary week = stack.summaries.period(7);

        assertThat(week.getDays()).isEqualTo(7);
        assertThat(week.getWeightFirst()).isEqualTo(80.0);
        assertThat(week.getWeightLast()).isEqualTo(84.0);
        assertThat(week.getWeightDelta()).isCloseTo(4.0, within(1e-9));
        assertThat(week.getSleepAverageDuration()).isCloseTo(450.0, within(1e-9));
        assertThat(week.getStepsTotal()).isNull();
    }

    @Test
    void periodStartsAtLocalMidnight() {
        // local day starts at 10:00 UTC, so the 08:00 UTC weigh-in of 2024-01-03 falls outside
        ZoneId honolulu = ZoneId.of("Pacific/Honolulu");
        Clock clock = Clock.fixed(Instant.parse("2024-01-05T07:00:00Z"), ZoneOffset.UTC);
        SummaryService local = new SummaryService(stack.domains, stack.resolver, honolulu, clock);

        PeriodSummary summary = local.period(1);

        assertThat(summary.getWeightFirst()).isEqualTo(83.0);
        assertThat(summary.getWeightLast()).isEqualTo(84.0);
        assertThat(local.today().getDate()).isEqualTo(LocalDate.of(2024, 1, 4));
    }

    @Test
    void periodNeedsAtLeastOneDay() {
        assertThatThrownBy(() -> stack.summaries.period(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
