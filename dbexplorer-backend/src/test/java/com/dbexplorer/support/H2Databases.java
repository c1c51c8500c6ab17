package com.dbexplorer.support;

import com.dbexplorer.service.ConnectionPool;
import com.dbexplorer.service.PoolSettings;
import com.dbexplorer.util.DsnParser;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * In-memory H2 databases in PostgreSQL mode for pool, catalog and domain tests.
 */
public final class H2Databases {

    private H2Databases() {
    }

    public static String newUrl() {
        return "jdbc:h2:mem:explorer-" + UUID.randomUUID()
                + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH;DB_CLOSE_DELAY=-1";
    }

    public static ConnectionPool newPool() {
        return newPool(PoolSettings.builder().maxPoolSize(3).minIdle(0).acquireTimeoutMs(1_000));
    }

    public static ConnectionPool newPool(PoolSettings.PoolSettingsBuilder settings) {
        return new ConnectionPool(settings
                .connection(DsnParser.resolve(newUrl(), "sa", ""))
                .poolName("test-" + UUID.randomUUID())
                .build());
    }

    /**
     * Run setup statements with autocommit, outside the read-only path.
     */
    public static void exec(ConnectionPool pool, String... statements) {
        try (Connection conn = pool.acquire(); Statement st = conn.createStatement()) {
            for (String sql : statements) {
                st.execute(sql);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Test setup failed", e);
        }
    }
}
