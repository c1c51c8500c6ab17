package com.dbexplorer.service;

import com.dbexplorer.api.QueryResult;
import com.dbexplorer.error.CatalogUnavailableException;
import com.dbexplorer.error.ExplorerException;
import com.dbexplorer.error.PoolTimeoutException;
import com.dbexplorer.error.QueryCancelledException;
import com.dbexplorer.error.QueryFailedException;
import com.dbexplorer.error.QueryRejectedException;
import com.dbexplorer.error.RejectionReason;
import com.dbexplorer.query.SqlTokenScanner;
import com.dbexplorer.util.DbTypeNormalizer;
import com.dbexplorer.util.JdbcCells;
import com.dbexplorer.util.JdbcConnectionInfo;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Bounded pool of database connections with a single read-only execution primitive.
 *
 * <p>Every execution runs with autocommit off inside a transaction marked read-only and is rolled
 * back before the connection returns to the pool, whatever the outcome.
 */
@Slf4j
public class ConnectionPool implements Closeable {
    private static final int MAX_RECORDED_SQL_CHARS = 200;

    private final HikariDataSource dataSource;
    private final String dbType;
    private final int statementTimeoutSeconds;
    private final AtomicReference<LastQuery> lastSuccessfulQuery = new AtomicReference<>();

    /**
     * Work done on a borrowed connection.
     *
     * @param <T> result type
     */
    @FunctionalInterface
    public interface ConnectionCallback<T> {
        T doInConnection(Connection connection) throws SQLException;
    }

    @Value
    public static class LastQuery {
        String sql;
        Instant at;
    }

    @Value
    public static class PoolStats {
        int active;
        int idle;
        int total;
        int waiting;
        int max;
    }

    /**
     * Create the pool. Connections are opened lazily so the process starts even while the
     * database is down.
     *
     * @param settings pool settings
     * @throws IllegalArgumentException when the settings are invalid
     */
    public ConnectionPool(PoolSettings settings) {
        settings.validate();
        this.dbType = DbTypeNormalizer.normalize(settings.getConnection().getDbType());
        this.statementTimeoutSeconds = settings.getStatementTimeoutSeconds();
        this.dataSource = new HikariDataSource(buildHikariConfig(settings));
    }

    private HikariConfig buildHikariConfig(PoolSettings settings) {
        JdbcConnectionInfo info = settings.getConnection();
        HikariConfig config = new HikariConfig();
        config.setExceptionOverrideClassName(HikariSqlExceptionOverride.class.getName());
        config.setJdbcUrl(info.getUrl());
        config.setUsername(info.getUsername());
        config.setPassword(info.getPassword());
        if (info.getDriverClassName() != null) {
            config.setDriverClassName(info.getDriverClassName());
        }
        if (DbTypeNormalizer.isPostgres(info.getDbType())) {
            // Shows up as pg_stat_activity.application_name
            config.addDataSourceProperty("ApplicationName", "dbexplorer");
        }
        config.setConnectionTimeout(settings.getAcquireTimeoutMs());
        config.setMaximumPoolSize(settings.getMaxPoolSize());
        config.setMinimumIdle(settings.getMinIdle());
        config.setInitializationFailTimeout(-1);
        config.setPoolName(settings.getPoolName());
        return config;
    }

    public String getDbType() {
        return dbType;
    }

    /**
     * Borrow a connection. Closing it returns it to the pool.
     *
     * @return live connection
     * @throws PoolTimeoutException when no connection frees up within the acquire timeout
     * @throws CatalogUnavailableException when the database cannot be reached
     */
    public Connection acquire() {
        try {
            return dataSource.getConnection();
        } catch (SQLException e) {
            throw translateAcquireFailure(e);
        }
    }

    /**
     * Run work on a connection inside a read-only transaction that is always rolled back.
     *
     * @param callback work to run
     * @param <T> result type
     * @return callback result
     */
    public <T> T withReadOnlyConnection(ConnectionCallback<T> callback) {
        try (Connection conn = acquire()) {
            conn.setAutoCommit(false);
            conn.setReadOnly(true);
            try {
                return callback.doInConnection(conn);
            } finally {
                rollback(conn);
            }
        } catch (SQLException e) {
            throw translateExecutionFailure(e);
        }
    }

    /**
     * Execute one SELECT with bound parameters.
     *
     * @param sql statement text, parameters as {@code ?}
     * @param params values bound in order
     * @param maxRows rows to return at most, 0 for no cap
     * @return converted rows
     * @throws QueryRejectedException when the text is recognized as mutating
     */
    public QueryResult executeReadOnly(String sql, List<?> params, int maxRows) {
        rejectMutating(sql);

        Optional<CancellationSignal> signal = CancellationSignal.current();
        if (signal.map(CancellationSignal::isCancelled).orElse(false)) {
            throw new QueryCancelledException("Interaction cancelled before execution", null);
        }

        long startNanos = System.nanoTime();
        QueryResult result = withReadOnlyConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                if (statementTimeoutSeconds > 0) {
                    ps.setQueryTimeout(statementTimeoutSeconds);
                }
                if (maxRows > 0) {
                    ps.setMaxRows(maxRows + 1);
                }
                bind(ps, params);
                signal.ifPresent(s -> s.attach(ps));
                try (ResultSet rs = ps.executeQuery()) {
                    return readRows(rs, maxRows);
                } finally {
                    signal.ifPresent(CancellationSignal::detach);
                }
            }
        });
        result.setElapsedMs((System.nanoTime() - startNanos) / 1_000_000);

        lastSuccessfulQuery.set(new LastQuery(abbreviate(sql), Instant.now()));
        log.debug("Query returned {} rows in {} ms", result.getRows().size(), result.getElapsedMs());
        return result;
    }

    /**
     * Probe the database with a trivial query.
     *
     * @return true when a connection could be borrowed and answered
     */
    public boolean healthCheck() {
        try {
            Integer one = withReadOnlyConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement("SELECT 1");
                     ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : null;
                }
            });
            return one != null && one == 1;
        } catch (ExplorerException e) {
            log.warn("Health check failed: {}", e.getMessage());
            return false;
        }
    }

    public Optional<LastQuery> lastSuccessfulQuery() {
        return Optional.ofNullable(lastSuccessfulQuery.get());
    }

    public PoolStats stats() {
        HikariPoolMXBean bean = dataSource.getHikariPoolMXBean();
        if (bean == null) {
            return new PoolStats(0, 0, 0, 0, dataSource.getMaximumPoolSize());
        }
        return new PoolStats(bean.getActiveConnections(), bean.getIdleConnections(),
                bean.getTotalConnections(), bean.getThreadsAwaitingConnection(), dataSource.getMaximumPoolSize());
    }

    @Override
    public void close() {
        dataSource.close();
    }

    static void rejectMutating(String sql) {
        String body = sql == null ? "" : sql.strip();
        if (body.endsWith(";")) {
            body = body.substring(0, body.length() - 1);
        }
        SqlTokenScanner.Scan scan = SqlTokenScanner.scan(body);
        Optional<String> blocked = scan.firstBlockedKeyword();
        if (blocked.isPresent()) {
            throw new QueryRejectedException(RejectionReason.BLOCKED_KEYWORD,
                    "Keyword " + blocked.get() + " is not allowed");
        }
        if (scan.getSeparatorCount() > 0) {
            throw new QueryRejectedException(RejectionReason.MULTI_STATEMENT,
                    "Only a single statement is allowed");
        }
        boolean reading = scan.firstToken()
                .map(t -> t.isWord("SELECT") || t.isWord("WITH"))
                .orElse(false);
        if (!reading) {
            throw new QueryRejectedException(RejectionReason.NOT_SELECT,
                    "Only SELECT statements are allowed");
        }
    }

    private static void bind(PreparedStatement ps, List<?> params) throws SQLException {
        if (params == null) {
            return;
        }
        for (int i = 0; i < params.size(); i++) {
            ps.setObject(i + 1, params.get(i));
        }
    }

    private static QueryResult readRows(ResultSet rs, int maxRows) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int columnCount = md.getColumnCount();
        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(md.getColumnLabel(i));
        }

        List<List<Object>> rows = new ArrayList<>();
        boolean truncated = false;
        while (rs.next()) {
            if (maxRows > 0 && rows.size() >= maxRows) {
                truncated = true;
                break;
            }
            List<Object> row = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                row.add(JdbcCells.read(rs, i));
            }
            rows.add(row);
        }

        return QueryResult.builder()
                .columns(columns)
                .rows(rows)
                .appliedLimit(maxRows)
                .truncated(truncated)
                .build();
    }

    private void rollback(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed, connection will be discarded by the pool: {}", e.getMessage());
        }
    }

    private ExplorerException translateAcquireFailure(SQLException e) {
        if (e instanceof SQLTransientConnectionException && e.getCause() == null) {
            return new PoolTimeoutException("No database connection available within "
                    + dataSource.getConnectionTimeout() + " ms", e);
        }
        log.warn("Database unreachable: {}", e.getMessage());
        return new CatalogUnavailableException("Database unreachable: " + e.getMessage(), e);
    }

    private ExplorerException translateExecutionFailure(SQLException e) {
        boolean cancelled = CancellationSignal.current().map(CancellationSignal::isCancelled).orElse(false);
        if (cancelled) {
            return new QueryCancelledException("Query cancelled", e);
        }
        String sqlState = e.getSQLState();
        if (sqlState != null && sqlState.startsWith("08")) {
            return new CatalogUnavailableException("Database connection lost: " + e.getMessage(), e);
        }
        if (e instanceof SQLTimeoutException || "57014".equals(sqlState)) {
            return new QueryFailedException("Query timed out after " + statementTimeoutSeconds + " s", sqlState, e);
        }
        return new QueryFailedException(e.getMessage(), sqlState, e);
    }

    private static String abbreviate(String sql) {
        String oneLine = sql.replaceAll("\\s+", " ").trim();
        return oneLine.length() <= MAX_RECORDED_SQL_CHARS ? oneLine : oneLine.substring(0, MAX_RECORDED_SQL_CHARS) + "...";
    }
}
