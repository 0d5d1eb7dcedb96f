package com.ryuqq.flow.application.dispatcher;

import java.util.Map;

/**
 * 디스패처 통계 스냅샷.
 *
 * @param handlersByType 정확한 타입별 활성 핸들러 수
 * @param wildcardHandlers 와일드카드 핸들러 수
 * @param patternHandlers 패턴 핸들러 수
 * @param historySize 현재 이력 항목 수
 * @param historyCapacity 이력 용량
 * @param processedEvents 누적 처리 이벤트 수 (재귀 포함)
 * @param failedEvents 누적 실패 이벤트 수
 * @param operationTimeoutMs 설정된 작업 타임아웃
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DispatcherStats(
    Map<String, Integer> handlersByType,
    int wildcardHandlers,
    int patternHandlers,
    int historySize,
    int historyCapacity,
    long processedEvents,
    long failedEvents,
    long operationTimeoutMs
) {

    public DispatcherStats {
        handlersByType = handlersByType == null ? Map.of() : Map.copyOf(handlersByType);
    }

    /**
     * 전체 핸들러 수.
     */
    public int totalHandlers() {
        return handlersByType.values().stream().mapToInt(Integer::intValue).sum()
            + wildcardHandlers + patternHandlers;
    }
}
