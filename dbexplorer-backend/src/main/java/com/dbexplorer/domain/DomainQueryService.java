package com.dbexplorer.domain;

import com.dbexplorer.api.QueryResult;
import com.dbexplorer.error.DomainUnavailableException;
import com.dbexplorer.service.ConnectionPool;
import com.dbexplorer.util.SqlIdentifiers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read operations over a resolved domain. Table and column names come only from the resolver;
 * every value is bound.
 */
@Slf4j
@Service
public class DomainQueryService {

    private final DomainResolver resolver;
    private final ConnectionPool pool;

    /**
     * Create a domain query service.
     *
     * @param resolver domain resolver
     * @param pool connection pool
     */
    public DomainQueryService(DomainResolver resolver, ConnectionPool pool) {
        this.resolver = resolver;
        this.pool = pool;
    }

    public QueryResult latest(String domainId) {
        return resolver.execute(domainId, d -> pool.executeReadOnly(
                "SELECT * FROM " + table(d) + " ORDER BY " + ts(d) + " DESC LIMIT 1", List.of(), 1));
    }

    public Optional<Map<String, Object>> latestRow(String domainId) {
        return firstRow(latest(domainId));
    }

    /**
     * One page of rows, newest first.
     *
     * @param domainId domain id
     * @param page zero-based page index
     * @param pageSize rows per page
     * @return page with the total row count
     */
    public DomainPage recent(String domainId, int page, int pageSize) {
        if (page < 0 || pageSize < 1) {
            throw new IllegalArgumentException("Invalid page " + page + " / size " + pageSize);
        }
        return resolver.execute(domainId, d -> {
            long total = countRows(d);
            QueryResult rows = pool.executeReadOnly(
                    "SELECT * FROM " + table(d) + " ORDER BY " + ts(d) + " DESC LIMIT ? OFFSET ?",
                    List.of(pageSize, (long) page * pageSize), pageSize);
            return new DomainPage(d.getDomainId(), rows, page, pageSize, total);
        });
    }

    public long count(String domainId) {
        return resolver.execute(domainId, this::countRows);
    }

    /**
     * Rows with a timestamp in {@code [start, end)}, oldest first.
     */
    public QueryResult inRange(String domainId, Instant start, Instant end) {
        return resolver.execute(domainId, d -> pool.executeReadOnly(
                "SELECT * FROM " + table(d) + " WHERE " + ts(d) + " >= ? AND " + ts(d) + " < ? ORDER BY " + ts(d) + " ASC",
                List.of(bound(start), bound(end)), 0));
    }

    /**
     * Most recent row with a timestamp in {@code [start, end)}.
     */
    public Optional<Map<String, Object>> latestInRange(String domainId, Instant start, Instant end) {
        QueryResult result = resolver.execute(domainId, d -> pool.executeReadOnly(
                "SELECT * FROM " + table(d) + " WHERE " + ts(d) + " >= ? AND " + ts(d) + " < ? ORDER BY " + ts(d) + " DESC LIMIT 1",
                List.of(bound(start), bound(end)), 1));
        return firstRow(result);
    }

    /**
     * Non-null values of one field with a timestamp in {@code [start, end)}, oldest first.
     */
    public List<Double> valuesInRange(String domainId, String field, Instant start, Instant end) {
        QueryResult result = resolver.execute(domainId, d -> {
            String column = SqlIdentifiers.quote(column(d, field));
            return pool.executeReadOnly(
                    "SELECT " + column + " FROM " + table(d) + " WHERE " + ts(d) + " >= ? AND " + ts(d) + " < ? "
                            + "AND " + column + " IS NOT NULL ORDER BY " + ts(d) + " ASC",
                    List.of(bound(start), bound(end)), 0);
        });
        return firstColumnAsDoubles(result);
    }

    /**
     * Last {@code n} values of the domain's numeric field, oldest first.
     *
     * @param domainId domain id
     * @param n number of values
     * @return values, null entries where the row had none
     */
    public List<Double> series(String domainId, int n) {
        if (n < 1) {
            throw new IllegalArgumentException("Series length must be positive: " + n);
        }
        List<Double> newestFirst = resolver.execute(domainId, d -> firstColumnAsDoubles(pool.executeReadOnly(
                "SELECT " + SqlIdentifiers.quote(numericColumn(d)) + " FROM " + table(d) + " ORDER BY " + ts(d) + " DESC LIMIT ?",
                List.of(n), n)));
        List<Double> out = new ArrayList<>(newestFirst);
        Collections.reverse(out);
        return out;
    }

    /**
     * Compare the average of the latest {@code window} values with the {@code window} before them.
     */
    public Trend trend(String domainId, int window) {
        if (window < 1) {
            throw new IllegalArgumentException("Trend window must be positive: " + window);
        }
        List<Double> newestFirst = resolver.execute(domainId, d -> firstColumnAsDoubles(pool.executeReadOnly(
                "SELECT " + SqlIdentifiers.quote(numericColumn(d)) + " FROM " + table(d) + " ORDER BY " + ts(d) + " DESC LIMIT ?",
                List.of(window * 2), window * 2)));
        List<Double> values = new ArrayList<>();
        for (Double v : newestFirst) {
            if (v != null) {
                values.add(v);
            }
        }
        if (values.isEmpty()) {
            return new Trend(domainId, window, null, null);
        }
        if (values.size() <= window) {
            return new Trend(domainId, window, average(values), null);
        }
        return new Trend(domainId, window, average(values.subList(0, window)), average(values.subList(window, values.size())));
    }

    /**
     * Count, sum, average, min and max of one field over {@code [start, end)}. A null bound leaves
     * that side of the range open.
     */
    public RangeAggregate aggregate(String domainId, String field, Instant start, Instant end) {
        QueryResult result = resolver.execute(domainId, d -> {
            String column = SqlIdentifiers.quote(column(d, field));
            StringBuilder sql = new StringBuilder("SELECT count(").append(column).append("), sum(").append(column)
                    .append("), avg(").append(column).append("), min(").append(column).append("), max(").append(column)
                    .append(") FROM ").append(table(d)).append(" WHERE 1 = 1");
            List<Object> params = new ArrayList<>();
            if (start != null) {
                sql.append(" AND ").append(ts(d)).append(" >= ?");
                params.add(bound(start));
            }
            if (end != null) {
                sql.append(" AND ").append(ts(d)).append(" < ?");
                params.add(bound(end));
            }
            return pool.executeReadOnly(sql.toString(), params, 1);
        });
        List<Object> row = result.getRows().isEmpty() ? List.of() : result.getRows().get(0);
        if (row.isEmpty()) {
            return new RangeAggregate(0, null, null, null, null);
        }
        Double count = toDouble(row.get(0));
        return new RangeAggregate(count == null ? 0 : count.longValue(),
                toDouble(row.get(1)), toDouble(row.get(2)), toDouble(row.get(3)), toDouble(row.get(4)));
    }

    private long countRows(ResolvedDomain d) {
        QueryResult result = pool.executeReadOnly("SELECT count(*) FROM " + table(d), List.of(), 1);
        Double count = result.getRows().isEmpty() ? null : toDouble(result.getRows().get(0).get(0));
        return count == null ? 0 : count.longValue();
    }

    private static String table(ResolvedDomain d) {
        return SqlIdentifiers.qualified(d.getTable().getSchema(), d.getTable().getName());
    }

    private static String ts(ResolvedDomain d) {
        return SqlIdentifiers.quote(d.timestampColumn());
    }

    private static String column(ResolvedDomain d, String field) {
        return d.column(field).orElseThrow(() ->
                new DomainUnavailableException(d.getDomainId(), "field '" + field + "' is not mapped"));
    }

    // Sleep has no value column; its duration is the series.
    private static String numericColumn(ResolvedDomain d) {
        return d.column(DomainSpecs.VALUE)
                .or(() -> d.column(DomainSpecs.DURATION))
                .orElseThrow(() -> new DomainUnavailableException(d.getDomainId(), "no numeric column mapped"));
    }

    private static OffsetDateTime bound(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    static Optional<Map<String, Object>> firstRow(QueryResult result) {
        if (result.getRows() == null || result.getRows().isEmpty()) {
            return Optional.empty();
        }
        List<Object> row = result.getRows().get(0);
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i < result.getColumns().size(); i++) {
            out.put(result.getColumns().get(i), row.get(i));
        }
        return Optional.of(out);
    }

    private static List<Double> firstColumnAsDoubles(QueryResult result) {
        List<Double> out = new ArrayList<>(result.getRows().size());
        for (List<Object> row : result.getRows()) {
            out.add(toDouble(row.get(0)));
        }
        return out;
    }

    static Double toDouble(Object cell) {
        if (cell instanceof Number number) {
            return number.doubleValue();
        }
        if (cell instanceof String s) {
            try {
                return Double.parseDouble(s);
            } catch (NumberFormatException e) {
                log.debug("Non-numeric cell ignored: {}", s);
                return null;
            }
        }
        return null;
    }

    private static Double average(List<Double> values) {
        double sum = 0;
        for (Double v : values) {
            sum += v;
        }
        return sum / values.size();
    }
}
