package com.ryuqq.flow.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 failureThreshold 도달)
 * OPEN (차단)
 *   │
 *   ▼ (recoveryTimeout 경과 후 다음 호출)
 * HALF_OPEN (반개방)
 *   │
 *   ├─► successThreshold 연속 성공 → CLOSED
 *   └─► 실패 1회 → OPEN
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>성공 시 연속 실패 카운터를 초기화합니다.</p>
     */
    CLOSED,

    /**
     * 차단 상태 (요청 즉시 거부, 작업 미실행).
     */
    OPEN,

    /**
     * 반개방 상태 (복구 여부 확인).
     */
    HALF_OPEN
}
