package com.ryuqq.flow.application.lifecycle;

/**
 * 레지스트리 키 {@code tenantId:agentName}.
 *
 * @param tenantId 테넌트 ID
 * @param agentName 에이전트 이름
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AgentKey(String tenantId, String agentName) {

    public AgentKey {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId cannot be null or blank");
        }
        if (agentName == null || agentName.isBlank()) {
            throw new IllegalArgumentException("agentName cannot be null or blank");
        }
    }

    @Override
    public String toString() {
        return tenantId + ":" + agentName;
    }
}
