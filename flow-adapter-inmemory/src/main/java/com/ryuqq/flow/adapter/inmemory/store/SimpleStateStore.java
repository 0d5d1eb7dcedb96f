package com.ryuqq.flow.adapter.inmemory.store;

import com.ryuqq.flow.core.error.StateCapacityExceededException;
import com.ryuqq.flow.core.spi.StateStore;
import com.ryuqq.flow.core.spi.StateStoreStats;
import com.ryuqq.flow.core.spi.StateStoreStats.NamespaceStats;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lock-free {@link StateStore} for single-threaded call sites.
 *
 * <p>Same contract and ceilings as {@link ConcurrentStateStore} without per-namespace locking
 * or a background sweep. Not safe for concurrent use.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SimpleStateStore implements StateStore {

    private final StateStoreConfig config;
    private final SizeEstimator sizeEstimator;
    private final Map<String, Map<String, Object>> namespaces = new LinkedHashMap<>();

    public SimpleStateStore() {
        this(new StateStoreConfig());
    }

    public SimpleStateStore(StateStoreConfig config) {
        this(config, new SizeEstimator());
    }

    public SimpleStateStore(StateStoreConfig config, SizeEstimator sizeEstimator) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (sizeEstimator == null) {
            throw new IllegalArgumentException("sizeEstimator cannot be null");
        }
        this.config = config;
        this.sizeEstimator = sizeEstimator;
    }

    @Override
    public Optional<Object> get(String namespace, String key) {
        Map<String, Object> entries = namespaces.get(namespace);
        return entries == null ? Optional.empty() : Optional.ofNullable(entries.get(key));
    }

    @Override
    public void set(String namespace, String key, Object value) {
        if (namespace == null || namespace.isEmpty() || key == null || key.isEmpty()) {
            throw new IllegalArgumentException("namespace and key cannot be null or empty");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        Map<String, Object> entries = namespaces.get(namespace);
        if (entries == null) {
            if (namespaces.size() >= config.maxNamespaces()) {
                throw StateCapacityExceededException.namespaces(namespace, config.maxNamespaces());
            }
            entries = new LinkedHashMap<>();
            namespaces.put(namespace, entries);
        }
        if (!entries.containsKey(key) && entries.size() >= config.maxKeysPerNamespace()) {
            throw StateCapacityExceededException.keys(namespace, config.maxKeysPerNamespace());
        }
        entries.put(key, value);
    }

    @Override
    public boolean delete(String namespace, String key) {
        Map<String, Object> entries = namespaces.get(namespace);
        if (entries == null || entries.remove(key) == null) {
            return false;
        }
        if (entries.isEmpty()) {
            namespaces.remove(namespace);
        }
        return true;
    }

    @Override
    public boolean has(String namespace, String key) {
        Map<String, Object> entries = namespaces.get(namespace);
        return entries != null && entries.containsKey(key);
    }

    @Override
    public List<String> keys(String namespace) {
        Map<String, Object> entries = namespaces.get(namespace);
        return entries == null ? List.of() : List.copyOf(entries.keySet());
    }

    @Override
    public int size(String namespace) {
        Map<String, Object> entries = namespaces.get(namespace);
        return entries == null ? 0 : entries.size();
    }

    @Override
    public int size() {
        return namespaces.values().stream().mapToInt(Map::size).sum();
    }

    @Override
    public void clear(String namespace) {
        namespaces.remove(namespace);
    }

    @Override
    public void clear() {
        namespaces.clear();
    }

    @Override
    public StateStoreStats getStats() {
        Map<String, NamespaceStats> perNamespace = new HashMap<>();
        int totalKeys = 0;
        long memoryUsage = 0;
        for (Map.Entry<String, Map<String, Object>> namespace : namespaces.entrySet()) {
            long size = namespace.getKey().length() * 2L;
            for (Map.Entry<String, Object> entry : namespace.getValue().entrySet()) {
                size += entry.getKey().length() * 2L + sizeEstimator.estimate(entry.getValue());
            }
            perNamespace.put(namespace.getKey(), new NamespaceStats(namespace.getValue().size(), size));
            totalKeys += namespace.getValue().size();
            memoryUsage += size;
        }
        return new StateStoreStats(perNamespace.size(), totalKeys, memoryUsage, perNamespace);
    }

    public int namespaceCount() {
        return namespaces.size();
    }
}
