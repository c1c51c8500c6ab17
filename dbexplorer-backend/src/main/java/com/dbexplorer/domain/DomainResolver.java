package com.dbexplorer.domain;

import com.dbexplorer.error.CatalogUnavailableException;
import com.dbexplorer.error.DomainUnavailableException;
import com.dbexplorer.error.ExplorerException;
import com.dbexplorer.error.PoolTimeoutException;
import com.dbexplorer.error.QueryFailedException;
import com.dbexplorer.model.ColumnDescriptor;
import com.dbexplorer.model.TableDescriptor;
import com.dbexplorer.service.CatalogView;
import com.dbexplorer.service.SchemaCatalog;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Maps logical domains onto whatever tables the connected database actually has.
 *
 * <p>Resolutions live in an immutable snapshot replaced atomically. A request captures the
 * {@link ResolvedDomain} it started with and keeps it even if a refresh swaps the snapshot meanwhile.
 */
@Slf4j
@Service
public class DomainResolver {

    private final SchemaCatalog catalog;
    private final AtomicReference<Map<String, DomainResolution>> snapshot = new AtomicReference<>(Map.of());

    /**
     * Create a domain resolver.
     *
     * @param catalog schema catalog
     */
    public DomainResolver(SchemaCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Resolve a domain against a catalog. First match wins: candidate tables are tried in order,
     * and within a table each field takes its first candidate column that exists. A table is only
     * chosen when every required field resolves in it.
     *
     * @param spec domain definition
     * @param view catalog to consult
     * @return resolution; an unmatched domain is reported, never thrown
     * @throws CatalogUnavailableException when the catalog cannot be asked
     */
    public static DomainResolution resolve(DomainSpec spec, CatalogView view) {
        List<String> rejected = new ArrayList<>();
        for (String candidate : spec.getCandidateTables()) {
            Optional<TableDescriptor> found = view.find(candidate);
            if (found.isEmpty()) {
                continue;
            }
            TableDescriptor table = found.get();

            Map<String, String> mapping = new LinkedHashMap<>();
            List<String> missing = new ArrayList<>();
            for (LogicalField field : spec.getFields()) {
                Optional<String> column = field.getCandidates().stream()
                        .map(table::findColumn)
                        .flatMap(Optional::stream)
                        .map(ColumnDescriptor::getName)
                        .findFirst();
                if (column.isPresent()) {
                    mapping.put(field.getName(), column.get());
                } else if (field.isRequired()) {
                    missing.add(field.getName());
                }
            }

            if (missing.isEmpty()) {
                return DomainResolution.ready(new ResolvedDomain(spec.getId(), table, mapping));
            }
            rejected.add(table.getName() + " lacks " + String.join(", ", missing));
        }

        if (rejected.isEmpty()) {
            return DomainResolution.unavailable(spec.getId(),
                    "no table among " + String.join(", ", spec.getCandidateTables()));
        }
        return DomainResolution.unavailable(spec.getId(), String.join("; ", rejected));
    }

    @PostConstruct
    public void init() {
        resolveAll();
    }

    /**
     * Resolve every built-in domain and log one status line for each. Never fails on a database
     * outage: affected domains are marked unavailable and retried on next use.
     *
     * @return statuses in declaration order
     */
    public List<DomainStatus> resolveAll() {
        Map<String, DomainResolution> next = new LinkedHashMap<>();
        for (DomainSpec spec : DomainSpecs.ALL) {
            DomainResolution resolution = resolveSafely(spec);
            next.put(spec.getId(), resolution);
            logStatus(resolution);
        }
        snapshot.set(Collections.unmodifiableMap(next));
        return statuses();
    }

    /**
     * Drop cached table shapes and resolve everything again.
     *
     * @return statuses in declaration order
     */
    public List<DomainStatus> refresh() {
        catalog.invalidateAll();
        return resolveAll();
    }

    public DomainResolution current(String domainId) {
        DomainResolution resolution = snapshot.get().get(domainId);
        if (resolution != null) {
            return resolution;
        }
        return DomainResolution.transientlyUnavailable(domainId, "not resolved yet");
    }

    /**
     * Get the resolved domain, retrying resolution first if it last failed for lack of a database.
     *
     * @param domainId domain id
     * @return resolved domain
     * @throws IllegalArgumentException for an unknown domain id
     * @throws DomainUnavailableException when the domain cannot be served
     * @throws CatalogUnavailableException when the database cannot be reached
     * @throws PoolTimeoutException when no connection frees up in time
     */
    public ResolvedDomain require(String domainId) {
        DomainSpec spec = DomainSpecs.find(domainId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown domain: " + domainId));
        DomainResolution resolution = current(spec.getId());
        if (!resolution.isAvailable() && resolution.isTransientFailure()) {
            resolution = resolveOrThrow(spec);
        }
        if (!resolution.isAvailable()) {
            throw new DomainUnavailableException(spec.getId(), resolution.getReason());
        }
        return resolution.getDomain().get();
    }

    /**
     * Run work against a domain. When the database reports that the resolved table or a column has
     * gone, the domain is resolved again and the work retried once; a second mismatch marks the
     * domain unavailable until the next refresh.
     *
     * @param domainId domain id
     * @param work work to run
     * @param <T> result type
     * @return work result
     */
    public <T> T execute(String domainId, Function<ResolvedDomain, T> work) {
        ResolvedDomain domain = require(domainId);
        try {
            return work.apply(domain);
        } catch (QueryFailedException e) {
            if (!e.isSchemaMismatch()) {
                throw e;
            }
            log.warn("Schema mismatch on domain {} (table {}): {}; re-resolving",
                    domain.getDomainId(), domain.getTable().getName(), e.getMessage());
        }

        DomainSpec spec = DomainSpecs.find(domain.getDomainId()).orElseThrow();
        catalog.invalidate(domain.getTable().getName());
        DomainResolution again = resolveOrThrow(spec);
        if (!again.isAvailable()) {
            throw new DomainUnavailableException(spec.getId(), again.getReason());
        }

        try {
            return work.apply(again.getDomain().get());
        } catch (QueryFailedException e) {
            if (!e.isSchemaMismatch()) {
                throw e;
            }
            String reason = "schema changed under " + again.getDomain().get().getTable().getName();
            store(DomainResolution.unavailable(spec.getId(), reason));
            log.warn("Domain unavailable: {} ({})", spec.getId(), reason);
            throw new DomainUnavailableException(spec.getId(), reason);
        }
    }

    /**
     * Timestamp column of the available domain backed by the given table.
     *
     * @param tableName table name, any letter case
     * @return column name when some domain uses that table
     */
    public Optional<String> timestampColumnFor(String tableName) {
        return snapshot.get().values().stream()
                .map(DomainResolution::getDomain)
                .flatMap(Optional::stream)
                .filter(d -> d.getTable().getName().equalsIgnoreCase(tableName))
                .map(ResolvedDomain::timestampColumn)
                .findFirst();
    }

    public List<DomainStatus> statuses() {
        List<DomainStatus> out = new ArrayList<>();
        for (DomainSpec spec : DomainSpecs.ALL) {
            DomainResolution r = current(spec.getId());
            DomainStatus.DomainStatusBuilder status = DomainStatus.builder()
                    .domainId(spec.getId())
                    .label(spec.getLabel())
                    .available(r.isAvailable())
                    .reason(r.getReason());
            r.getDomain().ifPresent(d -> status.table(d.getTable().getName()).columns(d.getColumns()));
            out.add(status.build());
        }
        return out;
    }

    private DomainResolution resolveSafely(DomainSpec spec) {
        try {
            return resolve(spec, catalog);
        } catch (CatalogUnavailableException | PoolTimeoutException e) {
            return unreachable(spec, e);
        }
    }

    /**
     * Resolve and store the outcome. A database outage is stored as a transient failure and then
     * rethrown, so callers report it as such instead of as missing data.
     */
    private DomainResolution resolveOrThrow(DomainSpec spec) {
        DomainResolution resolution;
        try {
            resolution = resolve(spec, catalog);
        } catch (CatalogUnavailableException | PoolTimeoutException e) {
            DomainResolution failed = unreachable(spec, e);
            store(failed);
            logStatus(failed);
            throw e;
        }
        store(resolution);
        logStatus(resolution);
        return resolution;
    }

    private static DomainResolution unreachable(DomainSpec spec, ExplorerException e) {
        return DomainResolution.transientlyUnavailable(spec.getId(), "database unavailable: " + e.getMessage());
    }

    private void store(DomainResolution resolution) {
        snapshot.updateAndGet(current -> {
            Map<String, DomainResolution> next = new LinkedHashMap<>(current);
            next.put(resolution.getDomainId(), resolution);
            return Collections.unmodifiableMap(next);
        });
    }

    private static void logStatus(DomainResolution resolution) {
        if (resolution.isAvailable()) {
            ResolvedDomain d = resolution.getDomain().get();
            log.info("Domain ready: {} (table={}, columns={})", d.getDomainId(), d.getTable().getName(), d.getColumns());
        } else {
            log.warn("Domain unavailable: {} ({})", resolution.getDomainId(), resolution.getReason());
        }
    }
}
