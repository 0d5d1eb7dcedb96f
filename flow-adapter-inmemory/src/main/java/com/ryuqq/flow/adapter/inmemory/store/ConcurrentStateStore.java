package com.ryuqq.flow.adapter.inmemory.store;

import com.ryuqq.flow.core.error.StateCapacityExceededException;
import com.ryuqq.flow.core.spi.StateStore;
import com.ryuqq.flow.core.spi.StateStoreStats;
import com.ryuqq.flow.core.spi.StateStoreStats.NamespaceStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe {@link StateStore} with per-namespace mutual exclusion.
 *
 * <p>Every operation acquires the namespace's fair {@link ReentrantLock} first, so concurrent
 * writers to one namespace are serialized in arrival order while different namespaces proceed
 * independently. Operations spanning all namespaces take the locks in sorted name order.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>namespaces:</strong> ConcurrentHashMap&lt;String, LinkedHashMap&lt;String, Object&gt;&gt; - inner maps are only touched under their namespace lock</li>
 *   <li><strong>locks:</strong> ConcurrentHashMap&lt;String, ReentrantLock&gt; - one lock per namespace name, dropped by GC when idle</li>
 * </ul>
 *
 * <p><strong>Capacity:</strong> creating a namespace beyond {@code maxNamespaces} or a key beyond
 * {@code maxKeysPerNamespace} throws {@link StateCapacityExceededException}. Nothing is evicted
 * and nothing is partially written.</p>
 *
 * <p><strong>Garbage Collection:</strong> {@link #delete} of the last key removes the namespace,
 * freeing its slot at once. Reads of unknown namespaces still leave locks behind; a periodic
 * sweep ({@code gcIntervalMs}) drops locks nobody holds along with any empty namespace.
 * {@link #collectGarbage()} runs the same sweep on demand.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * try (ConcurrentStateStore store = new ConcurrentStateStore(new StateStoreConfig())) {
 *     store.set("session-42", "cursor", 17);
 *     Optional&lt;Object&gt; cursor = store.get("session-42", "cursor");
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ConcurrentStateStore implements StateStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentStateStore.class);

    private final StateStoreConfig config;
    private final SizeEstimator sizeEstimator;
    private final ConcurrentHashMap<String, Map<String, Object>> namespaces = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * Guards the namespace-count check together with the insert of a new namespace.
     */
    private final Object namespaceCreation = new Object();

    private final ScheduledExecutorService gcScheduler;
    private final ScheduledFuture<?> gcTask;

    public ConcurrentStateStore() {
        this(new StateStoreConfig());
    }

    public ConcurrentStateStore(StateStoreConfig config) {
        this(config, new SizeEstimator());
    }

    /**
     * Creates the store and starts the GC sweep when {@code gcIntervalMs > 0}.
     *
     * @param config settings
     * @param sizeEstimator value size estimator used by {@link #getStats()}
     * @throws IllegalArgumentException if a dependency is null
     */
    public ConcurrentStateStore(StateStoreConfig config, SizeEstimator sizeEstimator) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (sizeEstimator == null) {
            throw new IllegalArgumentException("sizeEstimator cannot be null");
        }
        this.config = config;
        this.sizeEstimator = sizeEstimator;

        if (config.gcIntervalMs() > 0) {
            this.gcScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "state-store-gc");
                thread.setDaemon(true);
                return thread;
            });
            this.gcTask = gcScheduler.scheduleWithFixedDelay(
                this::runScheduledGc, config.gcIntervalMs(), config.gcIntervalMs(), TimeUnit.MILLISECONDS
            );
        } else {
            this.gcScheduler = null;
            this.gcTask = null;
        }
    }

    @Override
    public Optional<Object> get(String namespace, String key) {
        requireName(namespace, "namespace");
        requireName(key, "key");
        ReentrantLock lock = acquire(namespace);
        try {
            Map<String, Object> entries = namespaces.get(namespace);
            return entries == null ? Optional.empty() : Optional.ofNullable(entries.get(key));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(String namespace, String key, Object value) {
        requireName(namespace, "namespace");
        requireName(key, "key");
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        ReentrantLock lock = acquire(namespace);
        try {
            Map<String, Object> entries = namespaces.get(namespace);
            if (entries == null) {
                entries = createNamespace(namespace);
            }
            if (!entries.containsKey(key) && entries.size() >= config.maxKeysPerNamespace()) {
                throw StateCapacityExceededException.keys(namespace, config.maxKeysPerNamespace());
            }
            entries.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String namespace, String key) {
        requireName(namespace, "namespace");
        requireName(key, "key");
        ReentrantLock lock = acquire(namespace);
        try {
            Map<String, Object> entries = namespaces.get(namespace);
            if (entries == null || entries.remove(key) == null) {
                return false;
            }
            if (entries.isEmpty()) {
                namespaces.remove(namespace);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean has(String namespace, String key) {
        requireName(namespace, "namespace");
        requireName(key, "key");
        ReentrantLock lock = acquire(namespace);
        try {
            Map<String, Object> entries = namespaces.get(namespace);
            return entries != null && entries.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> keys(String namespace) {
        requireName(namespace, "namespace");
        ReentrantLock lock = acquire(namespace);
        try {
            Map<String, Object> entries = namespaces.get(namespace);
            return entries == null ? List.of() : List.copyOf(entries.keySet());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size(String namespace) {
        requireName(namespace, "namespace");
        ReentrantLock lock = acquire(namespace);
        try {
            Map<String, Object> entries = namespaces.get(namespace);
            return entries == null ? 0 : entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        List<String> names = sortedNamespaceNames();
        List<ReentrantLock> held = acquire(names);
        try {
            int total = 0;
            for (String namespace : names) {
                Map<String, Object> entries = namespaces.get(namespace);
                total += entries == null ? 0 : entries.size();
            }
            return total;
        } finally {
            releaseAll(held);
        }
    }

    /**
     * Removes the namespace with all its keys, freeing its slot immediately.
     */
    @Override
    public void clear(String namespace) {
        requireName(namespace, "namespace");
        ReentrantLock lock = acquire(namespace);
        try {
            namespaces.remove(namespace);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        List<String> names = sortedNamespaceNames();
        List<ReentrantLock> held = acquire(names);
        try {
            names.forEach(namespaces::remove);
        } finally {
            releaseAll(held);
        }
        log.info("State store cleared: {} namespaces removed", names.size());
    }

    @Override
    public StateStoreStats getStats() {
        List<String> names = sortedNamespaceNames();
        List<ReentrantLock> held = acquire(names);
        try {
            Map<String, NamespaceStats> perNamespace = new HashMap<>();
            int totalKeys = 0;
            long memoryUsage = 0;
            for (String namespace : names) {
                Map<String, Object> entries = namespaces.get(namespace);
                if (entries == null) {
                    continue;
                }
                long size = namespace.length() * 2L;
                for (Map.Entry<String, Object> entry : entries.entrySet()) {
                    size += entry.getKey().length() * 2L + sizeEstimator.estimate(entry.getValue());
                }
                perNamespace.put(namespace, new NamespaceStats(entries.size(), size));
                totalKeys += entries.size();
                memoryUsage += size;
            }
            return new StateStoreStats(perNamespace.size(), totalKeys, memoryUsage, perNamespace);
        } finally {
            releaseAll(held);
        }
    }

    /**
     * Removes empty namespaces and idle locks.
     *
     * @return number of namespaces removed
     */
    public int collectGarbage() {
        int removed = 0;
        for (String namespace : sortedNamespaceNames()) {
            ReentrantLock lock = acquire(namespace);
            try {
                Map<String, Object> entries = namespaces.get(namespace);
                if (entries != null && entries.isEmpty()) {
                    namespaces.remove(namespace);
                    locks.remove(namespace, lock);
                    removed++;
                }
            } finally {
                lock.unlock();
            }
        }

        // locks left behind by reads of namespaces that were never created
        for (Map.Entry<String, ReentrantLock> entry : new ArrayList<>(locks.entrySet())) {
            ReentrantLock lock = entry.getValue();
            if (!namespaces.containsKey(entry.getKey()) && lock.tryLock()) {
                try {
                    if (!namespaces.containsKey(entry.getKey())) {
                        locks.remove(entry.getKey(), lock);
                    }
                } finally {
                    lock.unlock();
                }
            }
        }

        if (removed > 0) {
            log.debug("State store GC removed {} empty namespaces", removed);
        }
        return removed;
    }

    /**
     * Number of namespaces currently held.
     */
    public int namespaceCount() {
        return namespaces.size();
    }

    /**
     * Number of namespace locks currently allocated.
     */
    public int lockCount() {
        return locks.size();
    }

    /**
     * Stops the GC sweep. Stored data stays readable.
     */
    @Override
    public void close() {
        if (gcTask != null) {
            gcTask.cancel(false);
            gcScheduler.shutdownNow();
        }
    }

    public StateStoreConfig getConfig() {
        return config;
    }

    private void runScheduledGc() {
        try {
            collectGarbage();
        } catch (RuntimeException e) {
            log.error("State store GC sweep failed", e);
        }
    }

    private Map<String, Object> createNamespace(String namespace) {
        synchronized (namespaceCreation) {
            if (namespaces.size() >= config.maxNamespaces()) {
                throw StateCapacityExceededException.namespaces(namespace, config.maxNamespaces());
            }
            Map<String, Object> entries = new LinkedHashMap<>();
            namespaces.put(namespace, entries);
            return entries;
        }
    }

    /**
     * Locks the namespace, retrying when GC swapped the lock out while this thread was queued.
     */
    private ReentrantLock acquire(String namespace) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(namespace, name -> new ReentrantLock(true));
            lock.lock();
            if (locks.get(namespace) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    private List<ReentrantLock> acquire(List<String> sortedNames) {
        List<ReentrantLock> held = new ArrayList<>(sortedNames.size());
        try {
            for (String namespace : sortedNames) {
                held.add(acquire(namespace));
            }
        } catch (RuntimeException e) {
            releaseAll(held);
            throw e;
        }
        return held;
    }

    private static void releaseAll(List<ReentrantLock> held) {
        for (int i = held.size() - 1; i >= 0; i--) {
            held.get(i).unlock();
        }
    }

    private List<String> sortedNamespaceNames() {
        List<String> names = new ArrayList<>(namespaces.keySet());
        names.sort(null);
        return names;
    }

    private static void requireName(String value, String field) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(field + " cannot be null or empty");
        }
    }
}
