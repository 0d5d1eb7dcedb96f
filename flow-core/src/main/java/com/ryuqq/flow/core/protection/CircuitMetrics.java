package com.ryuqq.flow.core.protection;

/**
 * Circuit Breaker 메트릭 스냅샷.
 *
 * <p>카운터는 {@code reset()} 외에는 감소하지 않습니다.
 * {@code timeInCurrentStateMs}만 상태 전이 시 0부터 다시 측정됩니다.</p>
 *
 * @param name 회로 이름
 * @param state 현재 상태
 * @param totalCalls 전체 호출 수 (거부 포함)
 * @param successfulCalls 성공 수
 * @param failedCalls 실패 수 (타임아웃 포함)
 * @param rejectedCalls 거부 수
 * @param consecutiveFailures 현재 연속 실패 수
 * @param consecutiveSuccesses 현재 HALF_OPEN 연속 성공 수
 * @param successRate successfulCalls / totalCalls (호출 없으면 0)
 * @param failureRate failedCalls / totalCalls (호출 없으면 0)
 * @param timeInCurrentStateMs 현재 상태 유지 시간
 * @param lastFailureTime 마지막 실패 시각 (epoch millis, 없으면 null)
 * @param lastFailureMessage 마지막 실패 메시지 (없으면 null)
 * @param lastSuccessTime 마지막 성공 시각 (epoch millis, 없으면 null)
 * @param nextAttemptTime OPEN일 때 HALF_OPEN 시도 가능 시각 (그 외 null)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CircuitMetrics(
    String name,
    CircuitBreakerState state,
    long totalCalls,
    long successfulCalls,
    long failedCalls,
    long rejectedCalls,
    int consecutiveFailures,
    int consecutiveSuccesses,
    double successRate,
    double failureRate,
    long timeInCurrentStateMs,
    Long lastFailureTime,
    String lastFailureMessage,
    Long lastSuccessTime,
    Long nextAttemptTime
) {
}
