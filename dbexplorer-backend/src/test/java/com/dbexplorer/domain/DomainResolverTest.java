package com.dbexplorer.domain;

import com.dbexplorer.error.CatalogUnavailableException;
import com.dbexplorer.error.DomainUnavailableException;
import com.dbexplorer.error.PoolTimeoutException;
import com.dbexplorer.error.QueryFailedException;
import com.dbexplorer.model.ColumnCategory;
import com.dbexplorer.model.ColumnDescriptor;
import com.dbexplorer.model.TableDescriptor;
import com.dbexplorer.service.CatalogView;
import com.dbexplorer.service.SchemaCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DomainResolverTest {

    private SchemaCatalog catalog;
    private DomainResolver resolver;

    @BeforeEach
    void setUp() {
        catalog = mock(SchemaCatalog.class);
        when(catalog.find(anyString())).thenReturn(Optional.empty());
        resolver = new DomainResolver(catalog);
    }

    @Test
    void firstSatisfyingTableWins() {
        CatalogView view = view(
                table("weight", "measured_at", "kg"),
                table("body_weight", "date", "weight_kg"));

        DomainResolution r = DomainResolver.resolve(DomainSpecs.WEIGHT, view);

        assertThat(r.isAvailable()).isTrue();
        ResolvedDomain d = r.getDomain().orElseThrow();
        assertThat(d.getTable().getName()).isEqualTo("weight");
        assertThat(d.getColumns()).containsEntry("timestamp", "measured_at").containsEntry("value", "kg");
    }

    @Test
    void columnCandidatesAreTriedInOrder() {
        CatalogView view = view(table("steps", "created_at", "date", "value", "steps"));

        ResolvedDomain d = DomainResolver.resolve(DomainSpecs.STEPS, view).getDomain().orElseThrow();

        assertThat(d.timestampColumn()).isEqualTo("date");
        assertThat(d.column(DomainSpecs.VALUE)).contains("steps");
        assertThat(d.column(DomainSpecs.SOURCE)).isEmpty();
    }

    @Test
    void skipsTableMissingRequiredFieldWithoutMixingTables() {
        CatalogView view = view(
                table("measurements_weight", "measured_at"),
                table("weight_measurements", "timestamp", "value"));

        ResolvedDomain d = DomainResolver.resolve(DomainSpecs.WEIGHT, view).getDomain().orElseThrow();

        assertThat(d.getTable().getName()).isEqualTo("weight_measurements");
        assertThat(d.getColumns()).containsEntry("timestamp", "timestamp");
    }

    @Test
    void everyCandidateAbsentIsUnavailableNotAnError() {
        DomainResolution r = DomainResolver.resolve(DomainSpecs.HEART, view());

        assertThat(r.isAvailable()).isFalse();
        assertThat(r.isTransientFailure()).isFalse();
        assertThat(r.getReason()).startsWith("no table among heart_rate_daily");
    }

    @Test
    void reportsMissingFieldsOfRejectedTables() {
        DomainResolution r = DomainResolver.resolve(DomainSpecs.WEIGHT, view(table("weight", "id", "note")));

        assertThat(r.isAvailable()).isFalse();
        assertThat(r.getReason()).isEqualTo("weight lacks timestamp, value");
    }

    @Test
    void columnMatchingIgnoresCase() {
        ResolvedDomain d = DomainResolver.resolve(DomainSpecs.SLEEP, view(table("sleep", "Start_Time", "Duration_Minutes")))
                .getDomain().orElseThrow();

        assertThat(d.timestampColumn()).isEqualTo("Start_Time");
        assertThat(d.column(DomainSpecs.DURATION)).contains("Duration_Minutes");
    }

    @Test
    void outageAtStartupIsRetriedOnUse() {
        doThrow(new CatalogUnavailableException("connection refused", null)).when(catalog).find(anyString());

        List<DomainStatus> statuses = resolver.resolveAll();

        assertThat(statuses).hasSize(4).noneMatch(DomainStatus::isAvailable);
        assertThat(resolver.current("weight").isTransientFailure()).isTrue();

        TableDescriptor weight = table("weight", "date", "value");
        doReturn(Optional.empty()).when(catalog).find(anyString());
        doReturn(Optional.of(weight)).when(catalog).find("weight");

        assertThat(resolver.require("weight").getTable()).isSameAs(weight);
        assertThat(resolver.current("weight").isAvailable()).isTrue();
    }

    @Test
    void poolTimeoutAtStartupDoesNotFailInit() {
        doThrow(new PoolTimeoutException("No database connection available within 30000 ms", null))
                .when(catalog).find(anyString());

        resolver.init();

        assertThat(resolver.statuses()).hasSize(4).noneMatch(DomainStatus::isAvailable);
        assertThat(resolver.current("heart").isTransientFailure()).isTrue();
    }

    @Test
    void lastingOutageIsReportedAsUnreachableDatabase() {
        doThrow(new CatalogUnavailableException("connection refused", null)).when(catalog).find(anyString());
        resolver.resolveAll();

        assertThatThrownBy(() -> resolver.require("weight")).isInstanceOf(CatalogUnavailableException.class);
        assertThat(resolver.current("weight").isTransientFailure()).isTrue();
    }

    @Test
    void outageDuringReResolutionIsNotReportedAsMissingData() {
        when(catalog.find("weight"))
                .thenReturn(Optional.of(table("weight", "date", "value")))
                .thenThrow(new CatalogUnavailableException("connection reset", null));
        resolver.resolveAll();
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> resolver.execute("weight", d -> {
            calls.incrementAndGet();
            throw new QueryFailedException("relation does not exist", "42P01", null);
        })).isInstanceOf(CatalogUnavailableException.class);

        assertThat(calls).hasValue(1);
        assertThat(resolver.current("weight").isTransientFailure()).isTrue();
    }

    @Test
    void requireFailsForUnavailableDomain() {
        resolver.resolveAll();

        assertThatThrownBy(() -> resolver.require("sleep")).isInstanceOf(DomainUnavailableException.class);
        assertThatThrownBy(() -> resolver.require("mood")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void schemaMismatchTriggersExactlyOneReResolution() {
        when(catalog.find("weight")).thenReturn(Optional.of(table("weight", "date", "value")));
        resolver.resolveAll();
        AtomicInteger calls = new AtomicInteger();

        String out = resolver.execute("weight", d -> {
            if (calls.incrementAndGet() == 1) {
                throw new QueryFailedException("relation does not exist", "42P01", null);
            }
            return "ok";
        });

        assertThat(out).isEqualTo("ok");
        assertThat(calls).hasValue(2);
        verify(catalog, times(1)).invalidate("weight");
    }

    @Test
    void secondMismatchMarksDomainUnavailable() {
        when(catalog.find("weight")).thenReturn(Optional.of(table("weight", "date", "value")));
        resolver.resolveAll();
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> resolver.execute("weight", d -> {
            calls.incrementAndGet();
            throw new QueryFailedException("column does not exist", "42703", null);
        })).isInstanceOf(DomainUnavailableException.class);

        assertThat(calls).hasValue(2);
        assertThat(resolver.current("weight").isAvailable()).isFalse();
        assertThat(resolver.current("weight").isTransientFailure()).isFalse();
    }

    @Test
    void otherQueryFailuresAreNotRetried() {
        when(catalog.find("weight")).thenReturn(Optional.of(table("weight", "date", "value")));
        resolver.resolveAll();
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> resolver.execute("weight", d -> {
            calls.incrementAndGet();
            throw new QueryFailedException("syntax error", "42601", null);
        })).isInstanceOf(QueryFailedException.class);

        assertThat(calls).hasValue(1);
        verify(catalog, never()).invalidate(anyString());
    }

    @Test
    void refreshDropsCachedShapes() {
        resolver.refresh();

        verify(catalog).invalidateAll();
    }

    @Test
    void exposesTimestampColumnOfBackingTable() {
        when(catalog.find("steps_daily")).thenReturn(Optional.of(table("steps_daily", "day", "total_steps")));
        resolver.resolveAll();

        assertThat(resolver.timestampColumnFor("STEPS_DAILY")).contains("day");
        assertThat(resolver.timestampColumnFor("other")).isEmpty();
    }

    private static TableDescriptor table(String name, String... columns) {
        List<ColumnDescriptor> cols = Arrays.stream(columns)
                .map(c -> ColumnDescriptor.builder().name(c).category(ColumnCategory.OTHER).dataType("text").nullable(true).build())
                .collect(Collectors.toList());
        return new TableDescriptor("public", name, cols);
    }

    private static CatalogView view(TableDescriptor... tables) {
        Map<String, TableDescriptor> byName = new HashMap<>();
        for (TableDescriptor t : tables) {
            byName.put(t.getName(), t);
        }
        return name -> Optional.ofNullable(byName.get(name));
    }
}
