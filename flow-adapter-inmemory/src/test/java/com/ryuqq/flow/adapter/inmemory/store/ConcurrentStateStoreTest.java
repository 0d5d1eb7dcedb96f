package com.ryuqq.flow.adapter.inmemory.store;

import com.ryuqq.flow.core.error.StateCapacityExceededException;
import org.junit.jupiter.api.AfterEach;
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

/**
 * Concurrency, capacity and GC behavior of {@link ConcurrentStateStore}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ConcurrentStateStoreTest {

    private ConcurrentStateStore store;
    private ExecutorService pool;

    @AfterEach
    void tearDown() {
        if (store != null) {
            store.close();
        }
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    // ============================================================
    // 1. Concurrent writers
    // ============================================================

    @Test
    void concurrentWritersToOneNamespace_LoseNoUpdates() throws Exception {
        // given
        store = new ConcurrentStateStore(new StateStoreConfig(10, 10_000, 0));
        pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        // when: 8 threads x 250 distinct keys in one namespace
        for (int t = 0; t < 8; t++) {
            int thread = t;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < 250; i++) {
                    store.set("shared", "k-" + thread + "-" + i, i);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }

        // then
        assertThat(store.size("shared")).isEqualTo(2_000);
        assertThat(store.size()).isEqualTo(2_000);
    }

    @Test
    void concurrentNamespaceCreation_NeverExceedsCeiling() throws Exception {
        // given
        store = new ConcurrentStateStore(new StateStoreConfig(5, 100, 0));
        pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger rejected = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        // when: 20 writers race for 5 namespace slots
        for (int i = 0; i < 20; i++) {
            String namespace = "ns-" + i;
            futures.add(pool.submit(() -> {
                start.await();
                try {
                    store.set(namespace, "k", 1);
                } catch (StateCapacityExceededException e) {
                    rejected.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }

        // then
        assertThat(store.namespaceCount()).isEqualTo(5);
        assertThat(rejected.get()).isEqualTo(15);
        assertThat(store.getStats().namespaceCount()).isEqualTo(5);
    }

    @Test
    void statsWhileWriting_DoNotFail() throws Exception {
        // given
        store = new ConcurrentStateStore(new StateStoreConfig(1_000, 1_000, 0));
        pool = Executors.newFixedThreadPool(2);

        // when
        Future<?> writer = pool.submit(() -> {
            for (int i = 0; i < 500; i++) {
                store.set("ns-" + (i % 50), "k-" + i, "v" + i);
            }
        });
        Future<?> reader = pool.submit(() -> {
            for (int i = 0; i < 200; i++) {
                store.getStats();
                store.size();
            }
        });
        writer.get(10, TimeUnit.SECONDS);
        reader.get(10, TimeUnit.SECONDS);

        // then
        assertThat(store.size()).isEqualTo(500);
    }

    // ============================================================
    // 2. Garbage collection
    // ============================================================

    @Test
    void deleteLastKey_FreesNamespaceSlotWithoutGc() {
        // given
        store = new ConcurrentStateStore(new StateStoreConfig(1, 10, 0));
        store.set("a", "k", 1);

        // when
        assertThat(store.delete("a", "k")).isTrue();

        // then
        assertThat(store.namespaceCount()).isZero();
        store.set("b", "k", 1);
        assertThat(store.has("b", "k")).isTrue();
        assertThat(store.collectGarbage()).isZero();
    }

    @Test
    void collectGarbage_KeepsNonEmptyNamespaces() {
        store = new ConcurrentStateStore(new StateStoreConfig(10, 10, 0));
        store.set("a", "k", 1);
        store.get("never-created", "k");

        assertThat(store.collectGarbage()).isZero();
        assertThat(store.get("a", "k")).contains(1);
    }

    @Test
    void scheduledGc_RemovesIdleLocks() throws InterruptedException {
        // given: reads of unknown namespaces leave locks behind
        store = new ConcurrentStateStore(new StateStoreConfig(10, 10, 20));
        store.set("a", "k", 1);
        store.get("ghost-1", "k");
        store.has("ghost-2", "k");

        // when
        long deadline = System.currentTimeMillis() + 2_000;
        while (store.lockCount() > 1 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }

        // then
        assertThat(store.lockCount()).isEqualTo(1);
        assertThat(store.get("a", "k")).contains(1);
    }
}
