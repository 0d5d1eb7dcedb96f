package com.ryuqq.flow.application.lifecycle;

import java.util.Map;

/**
 * 에이전트 재개 명령.
 *
 * @param key 에이전트 키
 * @param snapshotId 복원할 스냅샷 ID (null이면 일시정지 시 저장한 스냅샷)
 * @param context 병합할 추가 컨텍스트 (null이면 빈 맵)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ResumeAgentCommand(AgentKey key, String snapshotId, Map<String, Object> context) {

    public ResumeAgentCommand {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public static ResumeAgentCommand of(String tenantId, String agentName) {
        return new ResumeAgentCommand(new AgentKey(tenantId, agentName), null, Map.of());
    }
}
