package com.ryuqq.flow.testkit.contract;

import com.ryuqq.flow.core.error.ErrorCodes;
import com.ryuqq.flow.core.error.StateCapacityExceededException;
import com.ryuqq.flow.core.spi.StateStore;
import com.ryuqq.flow.core.spi.StateStoreStats;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract contract test for {@link StateStore} implementations.
 *
 * <p>Every implementation must pass these scenarios unchanged. Subclasses only supply
 * the store under test through {@link #createStore(int, int)}.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Basic get/set/delete/has per (namespace, key)</li>
 *   <li>Key listing and size per namespace and across namespaces</li>
 *   <li>Namespace and key ceilings fail explicitly, without partial writes or eviction</li>
 *   <li>Overwriting an existing key is always allowed</li>
 *   <li>Statistics: counts and estimated memory</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyStoreContractTest extends AbstractStateStoreContractTest {
 *     {@literal @}Override
 *     protected StateStore createStore(int maxNamespaces, int maxKeysPerNamespace) {
 *         return new MyStore(maxNamespaces, maxKeysPerNamespace);
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractStateStoreContractTest {

    protected static final int MAX_NAMESPACES = 3;
    protected static final int MAX_KEYS_PER_NAMESPACE = 2;

    protected StateStore store;

    /**
     * Creates the store under test with the given ceilings and GC disabled.
     */
    protected abstract StateStore createStore(int maxNamespaces, int maxKeysPerNamespace);

    @BeforeEach
    void setUpStore() {
        store = createStore(MAX_NAMESPACES, MAX_KEYS_PER_NAMESPACE);
    }

    @AfterEach
    void tearDownStore() throws Exception {
        if (store instanceof AutoCloseable closeable) {
            closeable.close();
        }
    }

    @Test
    void testSetThenGet_ReturnsValue() {
        // Given/When
        store.set("session", "cursor", 17);

        // Then
        assertEquals(Optional.of(17), store.get("session", "cursor"));
        assertTrue(store.has("session", "cursor"));
    }

    @Test
    void testGet_MissingNamespaceOrKey_ReturnsEmpty() {
        store.set("session", "cursor", 17);

        assertEquals(Optional.empty(), store.get("session", "other"));
        assertEquals(Optional.empty(), store.get("unknown", "cursor"));
        assertFalse(store.has("unknown", "cursor"));
    }

    @Test
    void testSet_OverwritesExistingKey() {
        store.set("session", "cursor", 1);
        store.set("session", "cursor", 2);

        assertEquals(Optional.of(2), store.get("session", "cursor"));
        assertEquals(1, store.size("session"));
    }

    @Test
    void testDelete_ReturnsWhetherKeyExisted() {
        store.set("session", "cursor", 1);

        assertTrue(store.delete("session", "cursor"));
        assertFalse(store.delete("session", "cursor"));
        assertFalse(store.delete("unknown", "cursor"));
        assertFalse(store.has("session", "cursor"));
    }

    @Test
    void testKeys_InInsertionOrder() {
        store.set("session", "b", 1);
        store.set("session", "a", 2);

        assertEquals(List.of("b", "a"), store.keys("session"));
        assertEquals(List.of(), store.keys("unknown"));
    }

    @Test
    void testSize_PerNamespaceAndTotal() {
        store.set("one", "a", 1);
        store.set("one", "b", 2);
        store.set("two", "a", 3);

        assertEquals(2, store.size("one"));
        assertEquals(1, store.size("two"));
        assertEquals(0, store.size("unknown"));
        assertEquals(3, store.size());
    }

    @Test
    void testClearNamespace_LeavesOtherNamespaces() {
        store.set("one", "a", 1);
        store.set("two", "a", 2);

        store.clear("one");

        assertEquals(0, store.size("one"));
        assertEquals(Optional.of(2), store.get("two", "a"));
    }

    @Test
    void testClearAll_RemovesEverything() {
        store.set("one", "a", 1);
        store.set("two", "a", 2);

        store.clear();

        assertEquals(0, store.size());
        assertEquals(0, store.getStats().namespaceCount());
    }

    @Test
    void testClearNamespace_FreesNamespaceSlot() {
        // Given: all namespace slots in use
        store.set("one", "a", 1);
        store.set("two", "a", 1);
        store.set("three", "a", 1);

        // When
        store.clear("one");

        // Then: a new namespace fits again
        store.set("four", "a", 1);
        assertTrue(store.has("four", "a"));
    }

    @Test
    void testDeleteLastKey_FreesNamespaceSlot() {
        // Given: all namespace slots in use
        store.set("one", "a", 1);
        store.set("two", "a", 1);
        store.set("three", "a", 1);

        // When
        assertTrue(store.delete("one", "a"));

        // Then: the emptied namespace is gone and another one fits
        assertEquals(MAX_NAMESPACES - 1, store.getStats().namespaceCount());
        store.set("four", "a", 1);
        assertTrue(store.has("four", "a"));
        assertEquals(List.of(), store.keys("one"));
    }

    @Test
    void testNamespaceLimit_ThrowsWithoutPartialWrite() {
        // Given
        store.set("one", "a", 1);
        store.set("two", "a", 1);
        store.set("three", "a", 1);

        // When
        StateCapacityExceededException exception = assertThrows(StateCapacityExceededException.class,
                () -> store.set("four", "a", 1));

        // Then
        assertEquals(ErrorCodes.STATE_CAPACITY_EXCEEDED, exception.getCode());
        assertEquals("Maximum namespaces limit reached: " + MAX_NAMESPACES, exception.getMessage());
        assertFalse(store.has("four", "a"));
        assertEquals(MAX_NAMESPACES, store.getStats().namespaceCount());
        assertEquals(3, store.size());
    }

    @Test
    void testKeyLimit_ThrowsWithoutEviction() {
        // Given
        store.set("session", "a", 1);
        store.set("session", "b", 2);

        // When
        StateCapacityExceededException exception = assertThrows(StateCapacityExceededException.class,
                () -> store.set("session", "c", 3));

        // Then
        assertEquals("Maximum keys per namespace limit reached: " + MAX_KEYS_PER_NAMESPACE, exception.getMessage());
        assertEquals(List.of("a", "b"), store.keys("session"));
        assertFalse(store.has("session", "c"));
    }

    @Test
    void testKeyLimit_OverwriteAtCapacityAllowed() {
        store.set("session", "a", 1);
        store.set("session", "b", 2);

        store.set("session", "a", 10);

        assertEquals(Optional.of(10), store.get("session", "a"));
    }

    @Test
    void testSet_NullValueRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.set("session", "a", null));
        assertFalse(store.has("session", "a"));
    }

    @Test
    void testEmptyNamespaceOrKey_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> store.set("", "a", 1));
        assertThrows(IllegalArgumentException.class, () -> store.set("session", "", 1));
        assertThrows(IllegalArgumentException.class, () -> store.get("", "a"));
    }

    @Test
    void testStats_CountsAndEstimatedMemory() {
        // Given: "ns" (4) + "k" (2) + "abc" (6), "ns" + "n" (2) + 42 (8), "b" (2) + "f" (2) + true (4)
        store.set("ns", "k", "abc");
        store.set("ns", "n", 42);
        store.set("b", "f", true);

        // When
        StateStoreStats stats = store.getStats();

        // Then
        assertEquals(2, stats.namespaceCount());
        assertEquals(3, stats.totalKeys());
        Map<String, StateStoreStats.NamespaceStats> namespaces = stats.namespaces();
        assertEquals(2, namespaces.get("ns").keyCount());
        assertEquals(4 + 2 + 6 + 2 + 8, namespaces.get("ns").estimatedSize());
        assertEquals(2 + 2 + 4, namespaces.get("b").estimatedSize());
        assertEquals(22 + 8, stats.memoryUsage());
    }
}
