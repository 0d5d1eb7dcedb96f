package com.ryuqq.flow.application.lifecycle;

/**
 * 에이전트 일시정지 명령.
 *
 * @param key 에이전트 키
 * @param reason 사유 (null 허용)
 * @param saveSnapshot 스냅샷 저장 여부
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PauseAgentCommand(AgentKey key, String reason, boolean saveSnapshot) {

    public PauseAgentCommand {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }

    /**
     * 스냅샷을 저장하는 기본 명령.
     */
    public static PauseAgentCommand of(String tenantId, String agentName) {
        return new PauseAgentCommand(new AgentKey(tenantId, agentName), null, true);
    }
}
