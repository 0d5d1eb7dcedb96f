package com.ryuqq.flow.core.error;

import java.util.Map;

/**
 * 레지스트리에 에이전트 항목이 없음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class AgentNotFoundException extends FlowException {

    public AgentNotFoundException(String agentKey) {
        super(ErrorCodes.AGENT_NOT_FOUND, "Agent " + agentKey + " not found", 404, Map.of("agent", agentKey), null);
    }
}
