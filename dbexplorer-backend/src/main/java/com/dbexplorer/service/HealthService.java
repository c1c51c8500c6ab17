package com.dbexplorer.service;

import com.dbexplorer.api.HealthResponse;
import com.dbexplorer.domain.DomainResolver;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

@Service
public class HealthService {

    private final ConnectionPool pool;
    private final DomainResolver resolver;
    private final ZoneId zone;
    private final Clock clock;
    private final Instant startedAt;

    public HealthService(ConnectionPool pool, DomainResolver resolver, ZoneId explorerZone, Clock clock) {
        this.pool = pool;
        this.resolver = resolver;
        this.zone = explorerZone;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    /**
     * Probe the database and collect process status.
     *
     * @return health snapshot
     */
    public HealthResponse check() {
        boolean databaseOk = pool.healthCheck();
        ConnectionPool.PoolStats stats = pool.stats();
        HealthResponse.HealthResponseBuilder health = HealthResponse.builder()
                .databaseOk(databaseOk)
                .uptimeSeconds(Duration.between(startedAt, clock.instant()).getSeconds())
                .timeZone(zone.getId())
                .poolActive(stats.getActive())
                .poolIdle(stats.getIdle())
                .poolMax(stats.getMax())
                .domains(resolver.statuses());
        pool.lastSuccessfulQuery().ifPresent(q -> health.lastQuery(q.getSql()).lastQueryAt(q.getAt()));
        return health.build();
    }
}
