package com.dbexplorer.bot;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Admits exactly one configured user id. With no id configured nobody is admitted.
 */
@Slf4j
@Component
public class SingleUserAuthorizationPolicy implements AuthorizationPolicy {

    private final Long allowedUserId;

    public SingleUserAuthorizationPolicy(@Value("${explorer.auth.allowed-user-id:}") String allowedUserId) {
        if (allowedUserId == null || allowedUserId.isBlank()) {
            log.warn("No allowed user configured; every interaction will be denied");
            this.allowedUserId = null;
        } else {
            try {
                this.allowedUserId = Long.parseLong(allowedUserId.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Allowed user id must be numeric: " + allowedUserId, e);
            }
        }
    }

    @Override
    public boolean isAllowed(Long userId) {
        return userId != null && userId.equals(allowedUserId);
    }
}
