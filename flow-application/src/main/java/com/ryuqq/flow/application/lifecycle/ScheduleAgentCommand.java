package com.ryuqq.flow.application.lifecycle;

import java.util.Map;

/**
 * 에이전트 예약 명령.
 *
 * @param key 에이전트 키
 * @param schedule 예약 설정
 * @param context 실행 시 전달할 컨텍스트 (null이면 빈 맵)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ScheduleAgentCommand(AgentKey key, ScheduleConfig schedule, Map<String, Object> context) {

    public ScheduleAgentCommand {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (schedule == null) {
            throw new IllegalArgumentException("schedule cannot be null");
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
