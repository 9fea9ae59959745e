package com.kiestudio;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Holds at most one {@link Session} and one saved generation per user. Callers that read and then mutate a
 * session wrap the sequence in {@link #withLock}, which serializes all work for that user id.
 */
public class SessionStore {
    private final Map<Long, Session> sessions = new ConcurrentHashMap<>();
    private final Map<Long, Session.SavedGeneration> saved = new ConcurrentHashMap<>();
    private final Map<Long, UserLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(long userId, Supplier<T> work) {
        UserLock entry = locks.compute(userId, (id, existing) -> {
            UserLock l = existing == null ? new UserLock() : existing;
            l.holders++;
            return l;
        });
        entry.lock.lock();
        try {
            return work.get();
        } finally {
            entry.lock.unlock();
            // Dropped once nobody holds or waits for it.
            locks.computeIfPresent(userId, (id, l) -> --l.holders == 0 ? null : l);
        }
    }

    public void runLocked(long userId, Runnable work) {
        withLock(userId, () -> {
            work.run();
            return null;
        });
    }

    public Optional<Session> get(long userId) {
        return Optional.ofNullable(sessions.get(userId));
    }

    /** Replaces any existing session for the same user. */
    public void put(Session session) {
        sessions.put(session.userId, session);
    }

    public void clear(long userId) {
        sessions.remove(userId);
    }

    /** Clears only if {@code expected} is still the current session. */
    public boolean clearIfCurrent(long userId, Session expected) {
        return sessions.remove(userId, expected);
    }

    public Optional<Session.SavedGeneration> saved(long userId) {
        return Optional.ofNullable(saved.get(userId));
    }

    public void save(long userId, Session.SavedGeneration generation) {
        saved.put(userId, generation);
    }

    int lockCount() {
        return locks.size();
    }

    // holders is only touched inside ConcurrentHashMap.compute, which is atomic per key.
    private static final class UserLock {
        final ReentrantLock lock = new ReentrantLock(true);
        int holders;
    }
}
