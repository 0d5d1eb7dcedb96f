package com.ryuqq.flow.application.lifecycle;

/**
 * 에이전트 정지 명령.
 *
 * @param key 에이전트 키
 * @param reason 정지 사유 (null 허용)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StopAgentCommand(AgentKey key, String reason) {

    public StopAgentCommand {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }

    public static StopAgentCommand of(String tenantId, String agentName) {
        return new StopAgentCommand(new AgentKey(tenantId, agentName), null);
    }
}
