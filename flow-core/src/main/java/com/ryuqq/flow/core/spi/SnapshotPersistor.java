package com.ryuqq.flow.core.spi;

import java.util.Optional;

/**
 * 스냅샷 저장소 SPI.
 *
 * <p>pause/resume에서 사용하는 불투명한 키/블롭 저장소입니다.
 * 내구성 보장은 구현체에 달려 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SnapshotPersistor {

    /**
     * 스냅샷 저장 (같은 ID가 있으면 덮어씀).
     *
     * @param snapshot 스냅샷
     */
    void save(Snapshot snapshot);

    /**
     * 스냅샷 조회.
     *
     * @param snapshotId 스냅샷 ID
     * @return 스냅샷 (없으면 empty)
     */
    Optional<Snapshot> load(String snapshotId);

    /**
     * 스냅샷 삭제.
     *
     * @return 삭제되었으면 true
     */
    boolean delete(String snapshotId);
}
