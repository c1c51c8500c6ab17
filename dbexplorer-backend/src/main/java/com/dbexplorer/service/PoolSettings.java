package com.dbexplorer.service;

import com.dbexplorer.util.JdbcConnectionInfo;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class PoolSettings {
    public static final int MIN_POOL_SIZE = 2;
    public static final long MIN_ACQUIRE_TIMEOUT_MS = 250;

    private JdbcConnectionInfo connection;
    @Builder.Default
    private String poolName = "explorer-pool";
    @Builder.Default
    private int maxPoolSize = 5;
    @Builder.Default
    private int minIdle = 2;
    @Builder.Default
    private long acquireTimeoutMs = 5_000;
    @Builder.Default
    private int statementTimeoutSeconds = 30;

    /**
     * Fail fast on settings the pool cannot honour.
     *
     * @throws IllegalArgumentException on an invalid value
     */
    public void validate() {
        if (connection == null || connection.getUrl() == null || connection.getUrl().isBlank()) {
            throw new IllegalArgumentException("Database URL is required");
        }
        if (maxPoolSize < MIN_POOL_SIZE) {
            throw new IllegalArgumentException("Pool max size must be at least " + MIN_POOL_SIZE + ", got " + maxPoolSize);
        }
        if (minIdle < 0 || minIdle > maxPoolSize) {
            throw new IllegalArgumentException("Pool min idle must be between 0 and " + maxPoolSize + ", got " + minIdle);
        }
        if (acquireTimeoutMs < MIN_ACQUIRE_TIMEOUT_MS) {
            throw new IllegalArgumentException("Acquire timeout must be at least " + MIN_ACQUIRE_TIMEOUT_MS + " ms, got " + acquireTimeoutMs);
        }
        if (statementTimeoutSeconds < 0) {
            throw new IllegalArgumentException("Statement timeout must not be negative");
        }
    }
}
