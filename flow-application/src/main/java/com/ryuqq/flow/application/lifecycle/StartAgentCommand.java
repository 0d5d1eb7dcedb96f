package com.ryuqq.flow.application.lifecycle;

import java.util.Map;

/**
 * 에이전트 시작 명령.
 *
 * @param key 에이전트 키
 * @param context 초기 컨텍스트 (null이면 빈 맵)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StartAgentCommand(AgentKey key, Map<String, Object> context) {

    public StartAgentCommand {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public static StartAgentCommand of(String tenantId, String agentName) {
        return new StartAgentCommand(new AgentKey(tenantId, agentName), Map.of());
    }
}
