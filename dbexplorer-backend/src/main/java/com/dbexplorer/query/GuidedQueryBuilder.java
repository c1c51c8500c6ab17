package com.dbexplorer.query;

import com.dbexplorer.domain.DomainResolver;
import com.dbexplorer.error.QueryRejectedException;
import com.dbexplorer.error.RejectionReason;
import com.dbexplorer.error.TableNotFoundException;
import com.dbexplorer.model.ColumnCategory;
import com.dbexplorer.model.ColumnDescriptor;
import com.dbexplorer.model.TableDescriptor;
import com.dbexplorer.paging.FilterFingerprint;
import com.dbexplorer.service.SchemaCatalog;
import com.dbexplorer.util.SqlIdentifiers;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Turns guided choices into a parameterized SELECT and its matching count query.
 *
 * <p>The table and every column are looked up in the schema catalog and only the canonical names
 * read back from it are quoted into the SQL text. Filter values, page size and offset are always
 * bound parameters.
 */
@Component
public class GuidedQueryBuilder {
    private static final Set<String> TRUE_WORDS = Set.of("true", "t", "yes", "y", "1");
    private static final Set<String> FALSE_WORDS = Set.of("false", "f", "no", "n", "0");

    // 2024-01-31, 2024-01-31T08:00, 2024-01-31T08:00:00+02:00
    private static final DateTimeFormatter TEMPORAL_INPUT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    private final SchemaCatalog catalog;
    private final DomainResolver resolver;
    private final int maxPageSize;

    /**
     * Create a guided query builder.
     *
     * @param catalog schema catalog
     * @param resolver domain resolver, consulted for default orderings
     * @param maxPageSize upper bound applied to requested page sizes
     */
    public GuidedQueryBuilder(SchemaCatalog catalog, DomainResolver resolver,
                              @Value("${explorer.query.max-page-size:100}") int maxPageSize) {
        this.catalog = catalog;
        this.resolver = resolver;
        this.maxPageSize = maxPageSize;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    /**
     * Build the statements for a request.
     *
     * @param request guided choices
     * @return page query and count query with their parameters
     * @throws QueryRejectedException with {@code unknownIdentifier} or {@code invalidFilterValue}
     */
    public BuiltQuery build(GuidedQueryRequest request) {
        if (request.getPage() < 0) {
            throw new IllegalArgumentException("Page must not be negative: " + request.getPage());
        }
        if (request.getPageSize() < 1) {
            throw new IllegalArgumentException("Page size must be positive: " + request.getPageSize());
        }

        TableDescriptor table = describe(request.getTable());
        List<String> columns = selectColumns(table, request.getColumns());

        StringBuilder where = new StringBuilder();
        List<Object> filterParams = new ArrayList<>();
        String filterKey = null;
        if (request.getFilter() != null) {
            FilterChoice filter = request.getFilter();
            ColumnDescriptor column = column(table, filter.getColumn());
            appendFilter(where, filterParams, column, filter);
            filterKey = column.getName() + "|" + filter.getOperator().getCode() + "|" + filter.getRawValue();
        }

        String orderColumn;
        SortDirection direction;
        if (request.getOrder() != null) {
            orderColumn = column(table, request.getOrder().getColumn()).getName();
            direction = request.getOrder().getDirection() != null ? request.getOrder().getDirection() : SortDirection.ASC;
        } else {
            orderColumn = defaultOrderColumn(table);
            direction = SortDirection.DESC;
        }

        int pageSize = Math.min(request.getPageSize(), maxPageSize);
        long offset = (long) request.getPage() * pageSize;
        String from = SqlIdentifiers.qualified(table.getSchema(), table.getName());

        StringBuilder sql = new StringBuilder("SELECT ");
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            sql.append(SqlIdentifiers.quote(columns.get(i)));
        }
        sql.append(" FROM ").append(from).append(where)
                .append(" ORDER BY ").append(SqlIdentifiers.quote(orderColumn)).append(' ').append(direction.name())
                .append(" LIMIT ? OFFSET ?");

        List<Object> params = new ArrayList<>(filterParams);
        params.add(pageSize);
        params.add(offset);

        long fingerprint = FilterFingerprint.of("guided", table.getSchema(), table.getName(),
                String.join(",", columns), filterKey, orderColumn + " " + direction.name(), pageSize);

        return BuiltQuery.builder()
                .table(table.getName())
                .columns(columns)
                .sql(sql.toString())
                .params(List.copyOf(params))
                .countSql("SELECT count(*) FROM " + from + where)
                .countParams(List.copyOf(filterParams))
                .page(request.getPage())
                .pageSize(pageSize)
                .offset(offset)
                .fingerprint(fingerprint)
                .build();
    }

    /**
     * Column the listing is ordered by when the user made no choice: the timestamp column of the
     * domain stored in this table, else the first date/time column, else the first column.
     */
    String defaultOrderColumn(TableDescriptor table) {
        Optional<String> domainTimestamp = resolver.timestampColumnFor(table.getName())
                .flatMap(table::findColumn)
                .map(ColumnDescriptor::getName);
        if (domainTimestamp.isPresent()) {
            return domainTimestamp.get();
        }
        return table.getColumns().stream()
                .filter(c -> c.getCategory() == ColumnCategory.TIMESTAMP)
                .map(ColumnDescriptor::getName)
                .findFirst()
                .orElse(table.getColumns().get(0).getName());
    }

    private TableDescriptor describe(String tableName) {
        if (tableName == null || tableName.isBlank()) {
            throw new QueryRejectedException(RejectionReason.UNKNOWN_IDENTIFIER, "No table chosen");
        }
        try {
            TableDescriptor table = catalog.describe(tableName);
            if (table.getColumns().isEmpty()) {
                throw new QueryRejectedException(RejectionReason.UNKNOWN_IDENTIFIER, "Table has no columns: " + tableName);
            }
            return table;
        } catch (TableNotFoundException e) {
            throw new QueryRejectedException(RejectionReason.UNKNOWN_IDENTIFIER, "Unknown table: " + tableName);
        }
    }

    private static List<String> selectColumns(TableDescriptor table, List<String> requested) {
        if (requested == null || requested.isEmpty()) {
            return table.columnNames();
        }
        Set<String> out = new LinkedHashSet<>();
        for (String name : requested) {
            out.add(column(table, name).getName());
        }
        return new ArrayList<>(out);
    }

    private static ColumnDescriptor column(TableDescriptor table, String name) {
        return table.findColumn(name).orElseThrow(() -> new QueryRejectedException(
                RejectionReason.UNKNOWN_IDENTIFIER, "Unknown column " + name + " in " + table.getName()));
    }

    private static void appendFilter(StringBuilder where, List<Object> params, ColumnDescriptor column, FilterChoice filter) {
        FilterOperator op = filter.getOperator();
        if (op == null) {
            throw new QueryRejectedException(RejectionReason.INVALID_FILTER_VALUE, "No filter operator chosen");
        }
        String quoted = SqlIdentifiers.quote(column.getName());
        if (!op.isValueRequired()) {
            where.append(" WHERE ").append(quoted).append(' ').append(op.getSql());
            return;
        }

        String raw = filter.getRawValue();
        if (raw == null || raw.isBlank()) {
            throw new QueryRejectedException(RejectionReason.INVALID_FILTER_VALUE, "A value is required for " + op.getCode());
        }

        if (op == FilterOperator.CONTAINS) {
            if (column.getCategory() != ColumnCategory.TEXT) {
                throw new QueryRejectedException(RejectionReason.INVALID_FILTER_VALUE,
                        "contains only applies to text columns");
            }
            where.append(" WHERE lower(").append(quoted).append(") LIKE ? ESCAPE '\\'");
            params.add("%" + escapeLike(raw.toLowerCase(Locale.ROOT)) + "%");
            return;
        }

        where.append(" WHERE ").append(quoted).append(' ').append(op.getSql()).append(" ?");
        params.add(coerce(column, raw.trim()));
    }

    /**
     * Convert typed text to a value of the column's type family.
     *
     * @throws QueryRejectedException with {@code invalidFilterValue} when the text does not parse
     */
    static Object coerce(ColumnDescriptor column, String raw) {
        switch (column.getCategory()) {
            case NUMERIC:
                try {
                    return new BigDecimal(raw);
                } catch (NumberFormatException e) {
                    throw invalid(column, raw, "a number");
                }
            case TIMESTAMP:
                return parseTemporal(column, raw);
            case BOOLEAN:
                String word = raw.toLowerCase(Locale.ROOT);
                if (TRUE_WORDS.contains(word)) {
                    return Boolean.TRUE;
                }
                if (FALSE_WORDS.contains(word)) {
                    return Boolean.FALSE;
                }
                throw invalid(column, raw, "true or false");
            case TEXT:
                return raw;
            default:
                throw new QueryRejectedException(RejectionReason.INVALID_FILTER_VALUE,
                        "Column " + column.getName() + " of type " + column.getDataType() + " only supports null checks");
        }
    }

    private static Object parseTemporal(ColumnDescriptor column, String raw) {
        try {
            return TEMPORAL_INPUT.parseBest(raw.replace(' ', 'T'), OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
        } catch (DateTimeParseException e) {
            throw invalid(column, raw, "a date like 2024-01-31 or 2024-01-31 08:00");
        }
    }

    private static QueryRejectedException invalid(ColumnDescriptor column, String raw, String expected) {
        return new QueryRejectedException(RejectionReason.INVALID_FILTER_VALUE,
                "'" + raw + "' is not valid for " + column.getName() + ": expected " + expected);
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
