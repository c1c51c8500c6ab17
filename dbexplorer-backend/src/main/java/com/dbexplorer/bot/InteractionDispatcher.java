package com.dbexplorer.bot;

import com.dbexplorer.api.ChatMessageEnvelope;
import com.dbexplorer.api.ChatReply;
import com.dbexplorer.service.CancellationSignal;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs interactions on a bounded worker pool and keeps a handle on each running one so it can be
 * cancelled by id or by user.
 */
@Slf4j
@Component
public class InteractionDispatcher {
    private static final String MDC_TRACE_ID = "trace_id";

    private final ExplorerCommandHandler handler;
    private final ThreadPoolExecutor executor;
    private final long replyTimeoutSeconds;
    private final Map<String, Running> running = new ConcurrentHashMap<>();

    public InteractionDispatcher(ExplorerCommandHandler handler,
                                 @Value("${explorer.workers.threads:4}") int threads,
                                 @Value("${explorer.workers.queue-capacity:16}") int queueCapacity,
                                 @Value("${explorer.workers.reply-timeout-seconds:120}") long replyTimeoutSeconds) {
        if (threads < 1 || queueCapacity < 1) {
            throw new IllegalArgumentException("Worker threads and queue capacity must be positive");
        }
        this.handler = handler;
        this.replyTimeoutSeconds = replyTimeoutSeconds;
        AtomicInteger counter = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity), r -> {
                    Thread t = new Thread(r, "interaction-worker-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                }, new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Run one interaction on the worker pool and wait for its reply.
     *
     * @param envelope inbound interaction; an id is assigned when missing
     * @return reply carrying the interaction id
     */
    public ChatReply dispatchAndWait(ChatMessageEnvelope envelope) {
        if (envelope.getInteractionId() == null || envelope.getInteractionId().isBlank()) {
            envelope.setInteractionId(UUID.randomUUID().toString());
        }
        String id = envelope.getInteractionId();

        if (isCancelCommand(envelope) && handler.isAuthorized(envelope)) {
            int cancelled = cancelForUser(envelope.getUserId());
            if (cancelled > 0) {
                log.info("Cancelled {} running interaction(s) for user_id={}", cancelled, envelope.getUserId());
            }
            return handler.handle(envelope);
        }

        CancellationSignal signal = new CancellationSignal();
        Running entry = new Running(envelope.getUserId(), signal);
        if (running.putIfAbsent(id, entry) != null) {
            log.warn("Interaction {} is already running, rejecting duplicate", id);
            return ChatReply.builder()
                    .interactionId(id)
                    .text("An interaction with this id is already running.")
                    .errorCode("DUPLICATE_INTERACTION")
                    .build();
        }
        Future<ChatReply> future;
        try {
            future = executor.submit(() -> run(envelope, signal));
        } catch (RejectedExecutionException e) {
            running.remove(id, entry);
            log.warn("Worker pool saturated, rejecting interaction {}", id);
            return ChatReply.builder()
                    .interactionId(id)
                    .text("The bot is busy right now. Please try again in a moment.")
                    .errorCode("BUSY")
                    .build();
        }

        try {
            return future.get(replyTimeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Interaction {} exceeded {}s, cancelling", id, replyTimeoutSeconds);
            signal.cancel();
            future.cancel(true);
            return cancelledReply(id);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            signal.cancel();
            future.cancel(true);
            return cancelledReply(id);
        } catch (ExecutionException e) {
            log.error("Interaction {} failed", id, e.getCause());
            return ChatReply.builder()
                    .interactionId(id)
                    .text("Something went wrong. Please try again.")
                    .errorCode("INTERNAL_ERROR")
                    .build();
        } finally {
            running.remove(id, entry);
        }
    }

    /**
     * Cancel a running interaction. Its statement, if any, is cancelled and the connection returned.
     *
     * @param interactionId interaction id
     * @return true if the interaction was running
     */
    public boolean cancel(String interactionId) {
        Running r = running.get(interactionId);
        if (r == null) {
            return false;
        }
        r.signal.cancel();
        return true;
    }

    public int cancelForUser(Long userId) {
        if (userId == null) {
            return 0;
        }
        int count = 0;
        for (Running r : running.values()) {
            if (Objects.equals(r.userId, userId)) {
                r.signal.cancel();
                count++;
            }
        }
        return count;
    }

    public int getActiveCount() {
        return executor.getActiveCount();
    }

    int getQueuedCount() {
        return executor.getQueue().size();
    }

    @PreDestroy
    public void shutdown() {
        running.values().forEach(r -> r.signal.cancel());
        executor.shutdownNow();
    }

    private ChatReply run(ChatMessageEnvelope envelope, CancellationSignal signal) {
        CancellationSignal.bind(signal);
        MDC.put(MDC_TRACE_ID, envelope.getInteractionId());
        try {
            return handler.handle(envelope);
        } finally {
            MDC.remove(MDC_TRACE_ID);
            CancellationSignal.unbind();
        }
    }

    private static boolean isCancelCommand(ChatMessageEnvelope envelope) {
        String command = envelope.getCommand() == null ? "" : envelope.getCommand().trim().toLowerCase(Locale.ROOT);
        return command.equals("/cancel") || command.startsWith("/cancel ") || command.startsWith("/cancel@");
    }

    private static ChatReply cancelledReply(String id) {
        return ChatReply.builder()
                .interactionId(id)
                .text("The request was cancelled.")
                .errorCode("CANCELLED")
                .build();
    }

    private static final class Running {
        private final Long userId;
        private final CancellationSignal signal;

        private Running(Long userId, CancellationSignal signal) {
            this.userId = userId;
            this.signal = signal;
        }
    }
}
