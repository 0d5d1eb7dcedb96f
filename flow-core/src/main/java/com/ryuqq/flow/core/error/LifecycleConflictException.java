package com.ryuqq.flow.core.error;

import java.util.Map;

/**
 * 에이전트가 이미 활성 상태여서 요청을 수행할 수 없음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class LifecycleConflictException extends FlowException {

    public LifecycleConflictException(String agentKey, String currentStatus) {
        super(
            ErrorCodes.AGENT_CONFLICT,
            "Agent " + agentKey + " is already " + currentStatus,
            409,
            Map.of("agent", agentKey, "status", currentStatus),
            null
        );
    }
}
