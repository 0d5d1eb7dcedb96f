package com.ryuqq.flow.core.spi;

import java.util.Map;

/**
 * 에이전트 일시정지 스냅샷.
 *
 * @param snapshotId 스냅샷 ID
 * @param agentKey {@code tenantId:agentName}
 * @param executionId 스냅샷 시점의 실행 ID
 * @param state 에이전트 컨텍스트
 * @param createdAt 생성 시각 (epoch millis)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Snapshot(
    String snapshotId,
    String agentKey,
    String executionId,
    Map<String, Object> state,
    long createdAt
) {

    public Snapshot {
        if (snapshotId == null || snapshotId.isBlank()) {
            throw new IllegalArgumentException("snapshotId cannot be null or blank");
        }
        if (agentKey == null || agentKey.isBlank()) {
            throw new IllegalArgumentException("agentKey cannot be null or blank");
        }
        state = state == null ? Map.of() : Map.copyOf(state);
    }
}
