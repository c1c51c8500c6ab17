package com.dbexplorer.domain;

import java.util.Optional;

/**
 * Outcome of resolving one domain: a {@link ResolvedDomain} or the reason there is none.
 *
 * <p>A {@code transientFailure} resolution was caused by the database being unreachable rather
 * than by the schema, and is retried on next use.
 */
public final class DomainResolution {
    private final String domainId;
    private final ResolvedDomain domain;
    private final String reason;
    private final boolean transientFailure;

    private DomainResolution(String domainId, ResolvedDomain domain, String reason, boolean transientFailure) {
        this.domainId = domainId;
        this.domain = domain;
        this.reason = reason;
        this.transientFailure = transientFailure;
    }

    public static DomainResolution ready(ResolvedDomain domain) {
        return new DomainResolution(domain.getDomainId(), domain, null, false);
    }

    public static DomainResolution unavailable(String domainId, String reason) {
        return new DomainResolution(domainId, null, reason, false);
    }

    public static DomainResolution transientlyUnavailable(String domainId, String reason) {
        return new DomainResolution(domainId, null, reason, true);
    }

    public String getDomainId() {
        return domainId;
    }

    public boolean isAvailable() {
        return domain != null;
    }

    public Optional<ResolvedDomain> getDomain() {
        return Optional.ofNullable(domain);
    }

    public String getReason() {
        return reason;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}
