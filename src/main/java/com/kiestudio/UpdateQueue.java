package com.kiestudio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Runs tasks on a shared executor while keeping submission order per key. Tasks for different users run
 * in parallel; tasks for the same user run one after another, each starting after the previous one ends.
 */
public class UpdateQueue {
    private static final Logger log = LoggerFactory.getLogger(UpdateQueue.class);

    private final Executor executor;
    private final Map<Long, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public UpdateQueue(Executor executor) {
        this.executor = executor;
    }

    public CompletableFuture<Void> submit(long key, Runnable task) {
        CompletableFuture<Void> next = tails.compute(key, (k, tail) -> tail == null
                ? CompletableFuture.runAsync(task, executor)
                // A failed predecessor must not stop the chain.
                : tail.handle((ignored, error) -> null).thenRunAsync(task, executor));
        next.whenComplete((ignored, error) -> {
            if (error != null) {
                log.error("Queued task for {} failed", key, error);
            }
            tails.remove(key, next);
        });
        return next;
    }

    int pendingKeys() {
        return tails.size();
    }
}
