package com.ryuqq.flow.application.lifecycle;

import com.ryuqq.flow.core.statemachine.AgentStatus;

import java.util.Map;

/**
 * 생명주기 집계 통계.
 *
 * @param totalAgents 레지스트리 항목 수
 * @param agentsByStatus 상태별 항목 수
 * @param agentsByTenant 테넌트별 항목 수
 * @param totalTransitions 누적 상태 전이 수
 * @param totalErrors 누적 ERROR 전이 수
 * @param uptimeMs 관리자 생성 후 경과 시간
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LifecycleStats(
    int totalAgents,
    Map<AgentStatus, Integer> agentsByStatus,
    Map<String, Integer> agentsByTenant,
    long totalTransitions,
    long totalErrors,
    long uptimeMs
) {

    public LifecycleStats {
        agentsByStatus = agentsByStatus == null ? Map.of() : Map.copyOf(agentsByStatus);
        agentsByTenant = agentsByTenant == null ? Map.of() : Map.copyOf(agentsByTenant);
    }
}
