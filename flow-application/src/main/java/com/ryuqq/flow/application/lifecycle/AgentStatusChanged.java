package com.ryuqq.flow.application.lifecycle;

import com.ryuqq.flow.core.statemachine.AgentStatus;

/**
 * 상태 변경 알림.
 *
 * @param key 에이전트 키
 * @param from 이전 상태
 * @param to 새 상태
 * @param reason 사유 (null 허용)
 * @param timestamp 변경 시각 (epoch millis)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AgentStatusChanged(
    AgentKey key,
    AgentStatus from,
    AgentStatus to,
    String reason,
    long timestamp
) {
}
