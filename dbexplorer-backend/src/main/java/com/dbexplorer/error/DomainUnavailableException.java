package com.dbexplorer.error;

/**
 * No candidate table of a domain satisfies its required fields.
 */
public class DomainUnavailableException extends ExplorerException {
    private final String domainId;

    public DomainUnavailableException(String domainId, String reason) {
        super("Domain " + domainId + " is unavailable: " + reason);
        this.domainId = domainId;
    }

    public String getDomainId() {
        return domainId;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.DOMAIN_UNAVAILABLE;
    }
}
