package com.ryuqq.flow.adapter.inmemory.store;

/**
 * State store settings (immutable record).
 *
 * <p><strong>Settings:</strong></p>
 * <ul>
 *   <li>maxNamespaces: distinct namespace ceiling (default 1000)</li>
 *   <li>maxKeysPerNamespace: key ceiling per namespace (default 10000)</li>
 *   <li>gcIntervalMs: idle-lock and empty-namespace sweep period (default 300000ms = 5 min, 0 disables the sweep)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxNamespaces namespace ceiling (positive)
 * @param maxKeysPerNamespace keys per namespace ceiling (positive)
 * @param gcIntervalMs sweep period in millis (0 or positive)
 */
public record StateStoreConfig(
    int maxNamespaces,
    int maxKeysPerNamespace,
    long gcIntervalMs
) {

    /**
     * Default settings: maxNamespaces=1000, maxKeysPerNamespace=10000, gcIntervalMs=300000.
     */
    public StateStoreConfig() {
        this(1000, 10000, 300000);
    }

    public StateStoreConfig {
        if (maxNamespaces <= 0) {
            throw new IllegalArgumentException(
                "maxNamespaces must be positive (current: " + maxNamespaces + ")"
            );
        }
        if (maxKeysPerNamespace <= 0) {
            throw new IllegalArgumentException(
                "maxKeysPerNamespace must be positive (current: " + maxKeysPerNamespace + ")"
            );
        }
        if (gcIntervalMs < 0) {
            throw new IllegalArgumentException(
                "gcIntervalMs must not be negative (current: " + gcIntervalMs + ")"
            );
        }
    }

    public StateStoreConfig withMaxNamespaces(int maxNamespaces) {
        return new StateStoreConfig(maxNamespaces, maxKeysPerNamespace, gcIntervalMs);
    }

    public StateStoreConfig withMaxKeysPerNamespace(int maxKeysPerNamespace) {
        return new StateStoreConfig(maxNamespaces, maxKeysPerNamespace, gcIntervalMs);
    }

    public StateStoreConfig withGcIntervalMs(long gcIntervalMs) {
        return new StateStoreConfig(maxNamespaces, maxKeysPerNamespace, gcIntervalMs);
    }
}
