package com.dbexplorer.bot;

import jakarta.annotation.PreDestroy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * In-memory guided sessions, one per user, dropped after an idle period.
 */
@Service
public class GuidedSessionStore {
    private final Map<Long, GuidedSession> sessions = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "guided-session-cleanup");
        t.setDaemon(true);
        return t;
    });
    private final Duration idleTimeout;
    private final Clock clock;

    public GuidedSessionStore(@Value("${explorer.guided.idle-timeout-minutes:30}") long idleTimeoutMinutes, Clock clock) {
        this.idleTimeout = Duration.ofMinutes(idleTimeoutMinutes);
        this.clock = clock;
        // Run cleanup task every 5 minutes
        scheduler.scheduleAtFixedRate(this::cleanupExpiredSessions, 5, 5, TimeUnit.MINUTES);
    }

    /**
     * Start a fresh session, replacing any previous one of the same user.
     */
    public GuidedSession start(Long userId) {
        GuidedSession session = new GuidedSession(userId, clock.instant());
        sessions.put(userId, session);
        return session;
    }

    public Optional<GuidedSession> get(Long userId) {
        GuidedSession session = sessions.get(userId);
        if (session == null) {
            return Optional.empty();
        }
        if (isExpired(session)) {
            sessions.remove(userId);
            return Optional.empty();
        }
        session.setLastAccessedAt(clock.instant());
        return Optional.of(session);
    }

    public void remove(Long userId) {
        sessions.remove(userId);
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }

    private boolean isExpired(GuidedSession session) {
        Instant now = clock.instant();
        return session.getLastAccessedAt().plus(idleTimeout).isBefore(now);
    }

    void cleanupExpiredSessions() {
        sessions.entrySet().removeIf(entry -> isExpired(entry.getValue()));
    }
}
