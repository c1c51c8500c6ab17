package com.dbexplorer.support;

import com.dbexplorer.bot.AuthorizationPolicy;
import com.dbexplorer.bot.ExplorerCommandHandler;
import com.dbexplorer.bot.GuidedQueryFlow;
import com.dbexplorer.bot.GuidedSessionStore;
import com.dbexplorer.domain.DomainQueryService;
import com.dbexplorer.domain.DomainResolver;
import com.dbexplorer.domain.SummaryService;
import com.dbexplorer.paging.PaginationCodec;
import com.dbexplorer.query.ExplorerQueryService;
import com.dbexplorer.query.GuidedQueryBuilder;
import com.dbexplorer.query.QueryValidator;
import com.dbexplorer.service.ConnectionPool;
import com.dbexplorer.service.HealthService;
import com.dbexplorer.service.SchemaCatalog;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * The whole explorer wired by hand over an H2 database holding a weight table, a sleep table and a
 * notes table. Steps and heart rate have no table.
 */
public final class ExplorerStack implements AutoCloseable {

    public static final long OWNER = 42L;
    public static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-05T12:00:00Z"), ZoneOffset.UTC);
    public static final ZoneId ZONE = ZoneId.of("Atlantic/Reykjavik");

    public final ConnectionPool pool;
    public final SchemaCatalog catalog;
    public final DomainResolver resolver;
    public final DomainQueryService domains;
    public final SummaryService summaries;
    public final ExplorerQueryService queries;
    public final PaginationCodec codec;
    public final GuidedSessionStore sessions;
    public final GuidedQueryFlow guided;
    public final HealthService health;
    public final ExplorerCommandHandler handler;

    public ExplorerStack(int pageSize) {
        pool = H2Databases.newPool();
        H2Databases.exec(pool,
                "CREATE TABLE measurements_weight (id INTEGER, measured_at TIMESTAMP WITH TIME ZONE,"
                        + " weight_kg DOUBLE PRECISION, source VARCHAR(20))",
                "INSERT INTO measurements_weight VALUES"
                        + " (1, TIMESTAMP WITH TIME ZONE '2024-01-01 08:00:00+00', 80.0, 'scale'),"
                        + " (2, TIMESTAMP WITH TIME ZONE '2024-01-02 08:00:00+00', 81.0, 'scale'),"
                        + " (3, TIMESTAMP WITH TIME ZONE '2024-01-03 08:00:00+00', 82.0, 'manual'),"
                        + " (4, TIMESTAMP WITH TIME ZONE '2024-01-04 08:00:00+00', 83.0, 'scale'),"
                        + " (5, TIMESTAMP WITH TIME ZONE '2024-01-05 08:00:00+00', 84.0, 'scale')",
                "CREATE TABLE sleep_sessions (start_time TIMESTAMP WITH TIME ZONE,"
                        + " end_time TIMESTAMP WITH TIME ZONE, duration_minutes INTEGER)",
                "INSERT INTO sleep_sessions VALUES"
                        + " (TIMESTAMP WITH TIME ZONE '2024-01-01 23:00:00+00', TIMESTAMP WITH TIME ZONE '2024-01-02 06:00:00+00', 420),"
                        + " (TIMESTAMP WITH TIME ZONE '2024-01-02 23:00:00+00', TIMESTAMP WITH TIME ZONE '2024-01-03 07:00:00+00', 480)",
                "CREATE TABLE notes (id INTEGER, body TEXT)",
                "INSERT INTO notes VALUES (1, 'first'), (2, 'second')");

        catalog = new SchemaCatalog(pool, "public");
        resolver = new DomainResolver(catalog);
        resolver.resolveAll();
        domains = new DomainQueryService(resolver, pool);
        summaries = new SummaryService(domains, resolver, ZONE, CLOCK);
        GuidedQueryBuilder builder = new GuidedQueryBuilder(catalog, resolver, 100);
        queries = new ExplorerQueryService(new QueryValidator(), builder, pool, catalog, 100, 20);
        codec = new PaginationCodec();
        sessions = new GuidedSessionStore(30, CLOCK);
        guided = new GuidedQueryFlow(sessions, catalog, queries, codec);
        health = new HealthService(pool, resolver, ZONE, CLOCK);
        AuthorizationPolicy owner = userId -> Long.valueOf(OWNER).equals(userId);
        handler = new ExplorerCommandHandler(owner, catalog, resolver, domains, summaries, queries,
                guided, codec, health, pageSize);
    }

    @Override
    public void close() {
        sessions.shutdown();
        pool.close();
    }
}
