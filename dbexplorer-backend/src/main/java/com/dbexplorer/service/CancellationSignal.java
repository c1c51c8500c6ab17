package com.dbexplorer.service;

import lombok.extern.slf4j.Slf4j;

import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;

/**
 * Cooperative cancellation handle for one interaction.
 *
 * <p>The worker running the interaction binds the signal to its thread; the pool registers each
 * statement it executes with the bound signal, so {@link #cancel()} from another thread reaches the
 * statement blocked on database I/O.
 */
@Slf4j
public class CancellationSignal {
    private static final ThreadLocal<CancellationSignal> CURRENT = new ThreadLocal<>();

    private volatile boolean cancelled;
    private Statement running;

    public static void bind(CancellationSignal signal) {
        CURRENT.set(signal);
    }

    public static void unbind() {
        CURRENT.remove();
    }

    public static Optional<CancellationSignal> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Mark the interaction cancelled and cancel the statement it is running, if any.
     */
    public void cancel() {
        Statement statement;
        synchronized (this) {
            cancelled = true;
            statement = running;
        }
        if (statement != null) {
            cancelStatement(statement);
        }
    }

    /**
     * Attach a statement about to execute. A signal cancelled earlier cancels it at once.
     *
     * @param statement statement owned by the calling worker
     */
    public void attach(Statement statement) {
        boolean alreadyCancelled;
        synchronized (this) {
            running = statement;
            alreadyCancelled = cancelled;
        }
        if (alreadyCancelled) {
            cancelStatement(statement);
        }
    }

    public synchronized void detach() {
        running = null;
    }

    private static void cancelStatement(Statement statement) {
        try {
            statement.cancel();
        } catch (SQLException e) {
            log.warn("Statement cancel failed: {}", e.getMessage());
        }
    }
}
