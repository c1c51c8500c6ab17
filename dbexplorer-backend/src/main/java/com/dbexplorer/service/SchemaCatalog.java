package com.dbexplorer.service;

import com.dbexplorer.error.CatalogUnavailableException;
import com.dbexplorer.error.QueryFailedException;
import com.dbexplorer.error.TableNotFoundException;
import com.dbexplorer.model.ColumnCategory;
import com.dbexplorer.model.ColumnDescriptor;
import com.dbexplorer.model.IndexDescriptor;
import com.dbexplorer.model.TableDescriptor;
import com.dbexplorer.util.DbTypeNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Table and column introspection through {@code information_schema}, cached per table.
 *
 * <p>The cache is an immutable map replaced wholesale on every change, so readers never observe a
 * half-updated entry. Only tables that exist are cached; a miss always asks the database again.
 */
@Slf4j
@Service
public class SchemaCatalog implements CatalogView {

    private static final String LIST_TABLES_SQL = "SELECT table_name FROM information_schema.tables "
            + "WHERE lower(table_schema) = lower(?) AND table_type = 'BASE TABLE' "
            + "ORDER BY table_name";

    private static final String DESCRIBE_SQL = "SELECT table_schema, table_name, column_name, data_type, is_nullable "
            + "FROM information_schema.columns "
            + "WHERE lower(table_schema) = lower(?) AND lower(table_name) = lower(?) "
            + "ORDER BY table_name, ordinal_position";

    private static final String LIST_INDEXES_SQL = "SELECT indexname, indexdef FROM pg_indexes "
            + "WHERE schemaname = ? AND tablename = ? "
            + "ORDER BY indexname";

    private final ConnectionPool pool;
    private final String schema;
    private final AtomicReference<Map<String, TableDescriptor>> tables = new AtomicReference<>(Map.of());

    /**
     * Create a schema catalog.
     *
     * @param pool connection pool
     * @param schema schema to introspect
     */
    public SchemaCatalog(ConnectionPool pool, @Value("${explorer.catalog.schema:public}") String schema) {
        this.pool = pool;
        this.schema = schema;
    }

    public String getSchema() {
        return schema;
    }

    public boolean tableExists(String tableName) {
        return find(tableName).isPresent();
    }

    /**
     * Describe a table, from the cache when possible.
     *
     * @param tableName table name, any letter case
     * @return descriptor with canonical names
     * @throws TableNotFoundException when the table does not exist
     */
    public TableDescriptor describe(String tableName) {
        return find(tableName).orElseThrow(() -> new TableNotFoundException(tableName));
    }

    /**
     * Describe a table straight from the database and refresh the cached entry.
     *
     * @param tableName table name, any letter case
     * @return descriptor with canonical names
     * @throws TableNotFoundException when the table does not exist
     */
    public TableDescriptor describeFresh(String tableName) {
        invalidate(tableName);
        return describe(tableName);
    }

    @Override
    public Optional<TableDescriptor> find(String tableName) {
        if (tableName == null || tableName.isBlank()) {
            return Optional.empty();
        }
        String key = cacheKey(tableName);
        TableDescriptor cached = tables.get().get(key);
        if (cached != null) {
            return Optional.of(cached);
        }

        Optional<TableDescriptor> loaded = load(tableName);
        loaded.ifPresent(descriptor -> tables.updateAndGet(current -> {
            Map<String, TableDescriptor> next = new HashMap<>(current);
            next.put(key, descriptor);
            return Map.copyOf(next);
        }));
        return loaded;
    }

    /**
     * List base tables of the configured schema.
     *
     * @return table names in a stable alphabetical order
     */
    public List<String> listTables() {
        List<String> names = query(LIST_TABLES_SQL, List.of(schema), rs -> rs.getString(1));
        names.sort(Comparator.comparing((String n) -> n.toLowerCase(Locale.ROOT)).thenComparing(Comparator.naturalOrder()));
        return names;
    }

    /**
     * List indexes of a table. Only PostgreSQL exposes them; other databases give an empty list.
     *
     * @param tableName table name, any letter case
     * @return index names with their definitions
     */
    public List<IndexDescriptor> listIndexes(String tableName) {
        TableDescriptor table = describe(tableName);
        if (!DbTypeNormalizer.isPostgres(pool.getDbType())) {
            return List.of();
        }
        return query(LIST_INDEXES_SQL, List.of(table.getSchema(), table.getName()),
                rs -> new IndexDescriptor(rs.getString(1), rs.getString(2)));
    }

    public void invalidate(String tableName) {
        if (tableName == null) {
            return;
        }
        String key = cacheKey(tableName);
        tables.updateAndGet(current -> {
            if (!current.containsKey(key)) {
                return current;
            }
            Map<String, TableDescriptor> next = new HashMap<>(current);
            next.remove(key);
            return Map.copyOf(next);
        });
    }

    public void invalidateAll() {
        tables.set(Map.of());
        log.info("Schema catalog cache cleared");
    }

    private Optional<TableDescriptor> load(String tableName) {
        List<String[]> rows = query(DESCRIBE_SQL, List.of(schema, tableName), rs -> new String[]{
                rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getString(5)
        });
        if (rows.isEmpty()) {
            return Optional.empty();
        }

        // Several tables may differ only in case; the exact spelling wins, then the first one.
        Map<String, List<String[]>> byTable = new LinkedHashMap<>();
        for (String[] row : rows) {
            byTable.computeIfAbsent(row[1], k -> new ArrayList<>()).add(row);
        }
        String chosen = byTable.containsKey(tableName) ? tableName : byTable.keySet().iterator().next();

        List<ColumnDescriptor> columns = new ArrayList<>();
        String tableSchema = null;
        for (String[] row : byTable.get(chosen)) {
            tableSchema = row[0];
            columns.add(ColumnDescriptor.builder()
                    .name(row[2])
                    .dataType(row[3])
                    .category(ColumnCategory.fromDataType(row[3]))
                    .nullable("YES".equalsIgnoreCase(row[4]))
                    .build());
        }
        log.debug("Introspected table {}.{} with {} columns", tableSchema, chosen, columns.size());
        return Optional.of(new TableDescriptor(tableSchema, chosen, columns));
    }

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    private <T> List<T> query(String sql, List<String> params, RowMapper<T> mapper) {
        try {
            return pool.withReadOnlyConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    for (int i = 0; i < params.size(); i++) {
                        ps.setString(i + 1, params.get(i));
                    }
                    List<T> out = new ArrayList<>();
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            out.add(mapper.map(rs));
                        }
                    }
                    return out;
                }
            });
        } catch (QueryFailedException e) {
            throw new CatalogUnavailableException("Schema introspection failed: " + e.getMessage(), e);
        }
    }

    private static String cacheKey(String tableName) {
        return tableName.trim().toLowerCase(Locale.ROOT);
    }
}
