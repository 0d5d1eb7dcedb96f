/**
 * In-memory state store adapters.
 *
 * <p>Two implementations of {@link com.ryuqq.flow.core.spi.StateStore}:</p>
 * <ul>
 *   <li>{@link com.ryuqq.flow.adapter.inmemory.store.ConcurrentStateStore} - per-namespace fair locks, periodic GC</li>
 *   <li>{@link com.ryuqq.flow.adapter.inmemory.store.SimpleStateStore} - no locking, single-threaded call sites</li>
 * </ul>
 *
 * <p>Both enforce the same ceilings, so callers do not depend on which one they get.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.flow.adapter.inmemory.store;
