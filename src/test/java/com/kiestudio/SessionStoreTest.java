package com.kiestudio;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Session store")
class SessionStoreTest {
    private final SessionStore store = new SessionStore();

    @Test
    void putReplacesPreviousSession() {
        Session first = new Session(1, Session.State.SELECTING_MODEL);
        Session second = new Session(1, Session.State.SELECTING_AMOUNT);

        store.put(first);
        store.put(second);

        assertThat(store.get(1)).containsSame(second);
    }

    @Test
    void clearIfCurrentIgnoresReplacedSession() {
        Session old = new Session(1, Session.State.CONFIRMING_GENERATION);
        Session fresh = new Session(1, Session.State.SELECTING_MODEL);
        store.put(old);
        store.put(fresh);

        assertThat(store.clearIfCurrent(1, old)).isFalse();
        assertThat(store.get(1)).containsSame(fresh);
        assertThat(store.clearIfCurrent(1, fresh)).isTrue();
        assertThat(store.get(1)).isEmpty();
    }

    @Test
    void savedGenerationReseedsWithoutValues() {
        ModelSchema model = ModelCatalog.loadDefault().find("z-image").orElseThrow();
        Session session = Session.forModel(5, model);
        session.params.put("prompt", "cat");
        store.save(5, new Session.SavedGeneration(model, session.required));

        Session reseeded = store.saved(5).orElseThrow().reseed(5);

        assertThat(reseeded.model).isSameAs(model);
        assertThat(reseeded.state).isEqualTo(Session.State.INPUTTING_PARAMS);
        assertThat(reseeded.required).containsExactly("prompt", "aspect_ratio");
        assertThat(reseeded.params).isEmpty();
    }

    @Test
    void locksAreReleasedWhenIdle() {
        for (long user = 0; user < 100; user++) {
            store.runLocked(user, () -> store.runLocked(7, () -> { }));
        }

        assertThat(store.lockCount()).isZero();
    }

    @Test
    void lockIsKeptWhileHeld() {
        store.runLocked(3, () -> assertThat(store.lockCount()).isEqualTo(1));

        assertThat(store.lockCount()).isZero();
    }

    @Test
    @DisplayName("work for one user is serialized")
    void lockSerializesWorkPerUser() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    store.runLocked(9, () -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        try {
                            Thread.sleep(5);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        inside.decrementAndGet();
                    });
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxInside.get()).isEqualTo(1);
        assertThat(store.lockCount()).isZero();
    }
}
