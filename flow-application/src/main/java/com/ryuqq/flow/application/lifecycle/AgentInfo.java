package com.ryuqq.flow.application.lifecycle;

import com.ryuqq.flow.core.statemachine.AgentStatus;

import java.util.Map;

/**
 * 레지스트리 항목의 읽기 전용 뷰.
 *
 * @param key 에이전트 키
 * @param status 현재 상태
 * @param executionId 실행 ID (null 허용)
 * @param snapshotId 마지막 스냅샷 ID (null 허용)
 * @param schedule 예약 설정 (null 허용)
 * @param nextRunAt 다음 예약 실행 시각 (null 허용)
 * @param startedAt 시작 시각 (null 허용)
 * @param pausedAt 일시정지 시각 (null 허용)
 * @param statusChangedAt 마지막 상태 변경 시각
 * @param lastError 마지막 에러 메시지 (null 허용)
 * @param context 에이전트 컨텍스트
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AgentInfo(
    AgentKey key,
    AgentStatus status,
    String executionId,
    String snapshotId,
    ScheduleConfig schedule,
    Long nextRunAt,
    Long startedAt,
    Long pausedAt,
    long statusChangedAt,
    String lastError,
    Map<String, Object> context
) {

    public AgentInfo {
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
