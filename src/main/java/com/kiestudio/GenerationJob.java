package com.kiestudio;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One submitted generation, tracked from task creation to a terminal outcome. Model, parameters, role and price
 * are captured at submission and used for charging regardless of later changes.
 */
public class GenerationJob {
    public enum Outcome {
        SUCCEEDED,
        FAILED,
        TIMED_OUT,
        ERROR,
        /** Finished successfully after its session was cancelled or replaced; not charged, not delivered. */
        ORPHANED
    }

    public final long userId;
    public final long chatId;
    public final String taskId;
    final Session session;
    public final ModelSchema model;
    public final Map<String, Object> params;
    public final Role role;
    public final BigDecimal price;

    private final AtomicInteger attempts = new AtomicInteger();
    private final CompletableFuture<Outcome> completion = new CompletableFuture<>();
    volatile Integer progressMessageId;
    volatile ScheduledFuture<?> nextPoll;

    GenerationJob(long chatId, String taskId, Session session, Role role, BigDecimal price) {
        this.userId = session.userId;
        this.chatId = chatId;
        this.taskId = taskId;
        this.session = session;
        this.model = session.model;
        this.params = new LinkedHashMap<>(session.params);
        this.role = role;
        this.price = price;
    }

    public static String key(long userId, String taskId) {
        return userId + ":" + taskId;
    }

    public String key() {
        return key(userId, taskId);
    }

    int nextAttempt() {
        return attempts.incrementAndGet();
    }

    public int attempts() {
        return attempts.get();
    }

    public CompletableFuture<Outcome> completion() {
        return completion;
    }

    public boolean isDone() {
        return completion.isDone();
    }

    boolean complete(Outcome outcome) {
        return completion.complete(outcome);
    }

    void cancel() {
        ScheduledFuture<?> pending = nextPoll;
        if (pending != null) {
            pending.cancel(false);
        }
        completion.cancel(false);
    }
}
