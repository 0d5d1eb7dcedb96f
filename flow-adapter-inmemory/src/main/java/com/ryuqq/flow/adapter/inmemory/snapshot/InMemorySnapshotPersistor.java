package com.ryuqq.flow.adapter.inmemory.snapshot;

import com.ryuqq.flow.core.spi.Snapshot;
import com.ryuqq.flow.core.spi.SnapshotPersistor;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link SnapshotPersistor}.
 *
 * <p>Snapshots are lost on process restart.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemorySnapshotPersistor implements SnapshotPersistor {

    private final ConcurrentHashMap<String, Snapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public void save(Snapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        snapshots.put(snapshot.snapshotId(), snapshot);
    }

    @Override
    public Optional<Snapshot> load(String snapshotId) {
        if (snapshotId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(snapshots.get(snapshotId));
    }

    @Override
    public boolean delete(String snapshotId) {
        return snapshotId != null && snapshots.remove(snapshotId) != null;
    }

    public int size() {
        return snapshots.size();
    }
}
