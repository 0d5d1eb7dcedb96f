package com.ryuqq.flow.application.lifecycle;

import com.ryuqq.flow.core.statemachine.AgentStatus;

/**
 * 생명주기 명령 결과.
 *
 * @param success 성공 여부
 * @param key 에이전트 키
 * @param operation 명령 종류
 * @param previousStatus 명령 전 상태
 * @param status 명령 후 상태
 * @param executionId 실행 ID (null 허용)
 * @param snapshotId 스냅샷 ID (null 허용)
 * @param reason 사유 또는 메시지 (null 허용)
 * @param timestamp 완료 시각 (epoch millis)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LifecycleResult(
    boolean success,
    AgentKey key,
    LifecycleOperation operation,
    AgentStatus previousStatus,
    AgentStatus status,
    String executionId,
    String snapshotId,
    String reason,
    long timestamp
) {

    public static final String ALREADY_STOPPED = "already stopped";
}
