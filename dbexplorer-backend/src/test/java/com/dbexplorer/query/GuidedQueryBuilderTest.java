package com.dbexplorer.query;

import com.dbexplorer.domain.DomainResolver;
import com.dbexplorer.error.QueryRejectedException;
import com.dbexplorer.error.RejectionReason;
import com.dbexplorer.error.TableNotFoundException;
import com.dbexplorer.model.ColumnCategory;
import com.dbexplorer.model.ColumnDescriptor;
import com.dbexplorer.model.TableDescriptor;
import com.dbexplorer.service.SchemaCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GuidedQueryBuilderTest {

    private static final TableDescriptor WEIGHT = new TableDescriptor("public", "weight", List.of(
            col("id", ColumnCategory.NUMERIC),
            col("measured_at", ColumnCategory.TIMESTAMP),
            col("weight_kg", ColumnCategory.NUMERIC),
            col("source", ColumnCategory.TEXT),
            col("manual", ColumnCategory.BOOLEAN),
            col("payload", ColumnCategory.OTHER)));

    private SchemaCatalog catalog;
    private DomainResolver resolver;
    private GuidedQueryBuilder builder;

    @BeforeEach
    void setUp() {
        catalog = mock(SchemaCatalog.class);
        resolver = mock(DomainResolver.class);
        when(catalog.describe("weight")).thenReturn(WEIGHT);
        when(catalog.describe("missing")).thenThrow(new TableNotFoundException("missing"));
        when(resolver.timestampColumnFor(anyString())).thenReturn(Optional.empty());
        builder = new GuidedQueryBuilder(catalog, resolver, 100);
    }

    @Test
    void bindsFilterValueAndPaging() {
        BuiltQuery q = builder.build(request()
                .columns(List.of("measured_at", "WEIGHT_KG"))
                .filter(new FilterChoice("weight_kg", FilterOperator.GT, "80.5"))
                .order(new OrderChoice("measured_at", SortDirection.ASC))
                .page(2)
                .pageSize(10)
                .build());

        assertThat(q.getSql()).isEqualTo("SELECT \"measured_at\", \"weight_kg\" FROM \"public\".\"weight\""
                + " WHERE \"weight_kg\" > ? ORDER BY \"measured_at\" ASC LIMIT ? OFFSET ?");
        assertThat(q.getParams()).containsExactly(new BigDecimal("80.5"), 10, 20L);
        assertThat(q.getCountSql()).isEqualTo("SELECT count(*) FROM \"public\".\"weight\" WHERE \"weight_kg\" > ?");
        assertThat(q.getCountParams()).containsExactly(new BigDecimal("80.5"));
        assertThat(q.getOffset()).isEqualTo(20L);
    }

    @Test
    void filterValueNeverAppearsInSqlText() {
        String hostile = "x'); DROP TABLE weight; --";

        BuiltQuery q = builder.build(request()
                .filter(new FilterChoice("source", FilterOperator.EQ, hostile))
                .build());

        assertThat(q.getSql()).doesNotContain("DROP").doesNotContain("x'");
        assertThat(q.getParams()).first().isEqualTo(hostile);
    }

    @Test
    void containsIsCaseInsensitiveAndEscaped() {
        BuiltQuery q = builder.build(request()
                .filter(new FilterChoice("source", FilterOperator.CONTAINS, "Scale_100%"))
                .build());

        assertThat(q.getSql()).contains("WHERE lower(\"source\") LIKE ? ESCAPE '\\'");
        assertThat(q.getParams()).first().isEqualTo("%scale\\_100\\%%");
    }

    @Test
    void nullChecksTakeNoValue() {
        BuiltQuery q = builder.build(request()
                .filter(new FilterChoice("payload", FilterOperator.IS_NULL, null))
                .build());

        assertThat(q.getSql()).contains("WHERE \"payload\" IS NULL");
        assertThat(q.getCountParams()).isEmpty();
    }

    @Test
    void rejectsUnknownTableAndColumns() {
        assertRejected(request().table("missing").build(), RejectionReason.UNKNOWN_IDENTIFIER);
        assertRejected(request().columns(List.of("id", "weight\"; --")).build(), RejectionReason.UNKNOWN_IDENTIFIER);
        assertRejected(request().order(new OrderChoice("nope", SortDirection.DESC)).build(), RejectionReason.UNKNOWN_IDENTIFIER);
        assertRejected(request().filter(new FilterChoice("nope", FilterOperator.EQ, "1")).build(), RejectionReason.UNKNOWN_IDENTIFIER);
    }

    @Test
    void rejectsValuesThatDoNotParse() {
        assertRejected(request().filter(new FilterChoice("weight_kg", FilterOperator.EQ, "heavy")).build(),
                RejectionReason.INVALID_FILTER_VALUE);
        assertRejected(request().filter(new FilterChoice("measured_at", FilterOperator.GE, "yesterday")).build(),
                RejectionReason.INVALID_FILTER_VALUE);
        assertRejected(request().filter(new FilterChoice("manual", FilterOperator.EQ, "maybe")).build(),
                RejectionReason.INVALID_FILTER_VALUE);
        assertRejected(request().filter(new FilterChoice("weight_kg", FilterOperator.CONTAINS, "8")).build(),
                RejectionReason.INVALID_FILTER_VALUE);
        assertRejected(request().filter(new FilterChoice("payload", FilterOperator.EQ, "{}")).build(),
                RejectionReason.INVALID_FILTER_VALUE);
        assertRejected(request().filter(new FilterChoice("source", FilterOperator.EQ, " ")).build(),
                RejectionReason.INVALID_FILTER_VALUE);
    }

    @Test
    void coercesTemporalAndBooleanInput() {
        ColumnDescriptor ts = col("measured_at", ColumnCategory.TIMESTAMP);
        ColumnDescriptor flag = col("manual", ColumnCategory.BOOLEAN);

        assertThat(GuidedQueryBuilder.coerce(ts, "2024-01-31")).isEqualTo(LocalDate.of(2024, 1, 31));
        assertThat(GuidedQueryBuilder.coerce(ts, "2024-01-31 08:00")).isEqualTo(LocalDateTime.of(2024, 1, 31, 8, 0));
        assertThat(GuidedQueryBuilder.coerce(ts, "2024-01-31T08:00:00+02:00"))
                .isEqualTo(OffsetDateTime.parse("2024-01-31T08:00:00+02:00"));
        assertThat(GuidedQueryBuilder.coerce(flag, "Yes")).isEqualTo(Boolean.TRUE);
        assertThat(GuidedQueryBuilder.coerce(flag, "0")).isEqualTo(Boolean.FALSE);
    }

    @Test
    void capsPageSize() {
        BuiltQuery q = builder.build(request().pageSize(5000).page(1).build());

        assertThat(q.getPageSize()).isEqualTo(100);
        assertThat(q.getParams()).containsExactly(100, 100L);
    }

    @Test
    void defaultOrderPrefersDomainTimestamp() {
        when(resolver.timestampColumnFor("weight")).thenReturn(Optional.of("MEASURED_AT"));

        BuiltQuery q = builder.build(request().build());

        assertThat(q.getSql()).contains("ORDER BY \"measured_at\" DESC");
    }

    @Test
    void defaultOrderFallsBackToFirstTimestampThenFirstColumn() {
        TableDescriptor notes = new TableDescriptor("public", "notes", List.of(
                col("title", ColumnCategory.TEXT), col("body", ColumnCategory.TEXT)));

        assertThat(builder.defaultOrderColumn(WEIGHT)).isEqualTo("measured_at");
        assertThat(builder.defaultOrderColumn(notes)).isEqualTo("title");
    }

    @Test
    void fingerprintFollowsFilterButNotPage() {
        BuiltQuery first = builder.build(request().page(0).build());
        BuiltQuery later = builder.build(request().page(3).build());
        BuiltQuery filtered = builder.build(request()
                .filter(new FilterChoice("source", FilterOperator.EQ, "scale")).build());

        assertThat(later.getFingerprint()).isEqualTo(first.getFingerprint());
        assertThat(filtered.getFingerprint()).isNotEqualTo(first.getFingerprint());
    }

    @Test
    void rejectsNegativePage() {
        assertThatThrownBy(() -> builder.build(request().page(-1).build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static GuidedQueryRequest.GuidedQueryRequestBuilder request() {
        return GuidedQueryRequest.builder().table("weight").page(0).pageSize(10);
    }

    private void assertRejected(GuidedQueryRequest request, RejectionReason reason) {
        assertThatThrownBy(() -> builder.build(request))
                .isInstanceOfSatisfying(QueryRejectedException.class,
                        e -> assertThat(e.getReason()).isEqualTo(reason));
    }

    private static ColumnDescriptor col(String name, ColumnCategory category) {
        return ColumnDescriptor.builder().name(name).category(category).dataType(category.name().toLowerCase()).nullable(true).build();
    }
}
