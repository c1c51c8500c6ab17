package com.dbexplorer.bot;

/**
 * Decides whether a user may talk to the explorer at all.
 */
public interface AuthorizationPolicy {

    boolean isAllowed(Long userId);
}
