package com.ryuqq.flow.core.protection;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>failureThreshold: OPEN 전이 연속 실패 수 (기본 3)</li>
 *   <li>recoveryTimeoutMs: OPEN 유지 시간 (기본 180000ms = 3분)</li>
 *   <li>successThreshold: HALF_OPEN에서 CLOSED 복귀 연속 성공 수 (기본 2)</li>
 *   <li>operationTimeoutMs: 작업 타임아웃 (기본 180000ms = 3분)</li>
 * </ul>
 *
 * @param name 회로 이름 (null 또는 blank 불가)
 * @param failureThreshold 연속 실패 임계값 (양수)
 * @param recoveryTimeoutMs 복구 대기 시간 (양수)
 * @param successThreshold 연속 성공 임계값 (양수)
 * @param operationTimeoutMs 작업 타임아웃 (양수)
 * @param listener 콜백 (null이면 {@link CircuitBreakerListener#NONE})
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CircuitBreakerConfig(
    String name,
    int failureThreshold,
    long recoveryTimeoutMs,
    int successThreshold,
    long operationTimeoutMs,
    CircuitBreakerListener listener
) {

    /**
     * 기본값으로 생성.
     *
     * @param name 회로 이름
     */
    public CircuitBreakerConfig(String name) {
        this(name, 3, 180000, 2, 180000, CircuitBreakerListener.NONE);
    }

    public CircuitBreakerConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")"
            );
        }
        if (recoveryTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "recoveryTimeoutMs must be positive (current: " + recoveryTimeoutMs + ")"
            );
        }
        if (successThreshold <= 0) {
            throw new IllegalArgumentException(
                "successThreshold must be positive (current: " + successThreshold + ")"
            );
        }
        if (operationTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "operationTimeoutMs must be positive (current: " + operationTimeoutMs + ")"
            );
        }
        if (listener == null) {
            listener = CircuitBreakerListener.NONE;
        }
    }

    public CircuitBreakerConfig withName(String name) {
        return new CircuitBreakerConfig(name, failureThreshold, recoveryTimeoutMs, successThreshold, operationTimeoutMs, listener);
    }

    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(name, failureThreshold, recoveryTimeoutMs, successThreshold, operationTimeoutMs, listener);
    }

    public CircuitBreakerConfig withRecoveryTimeoutMs(long recoveryTimeoutMs) {
        return new CircuitBreakerConfig(name, failureThreshold, recoveryTimeoutMs, successThreshold, operationTimeoutMs, listener);
    }

    public CircuitBreakerConfig withSuccessThreshold(int successThreshold) {
        return new CircuitBreakerConfig(name, failureThreshold, recoveryTimeoutMs, successThreshold, operationTimeoutMs, listener);
    }

    public CircuitBreakerConfig withOperationTimeoutMs(long operationTimeoutMs) {
        return new CircuitBreakerConfig(name, failureThreshold, recoveryTimeoutMs, successThreshold, operationTimeoutMs, listener);
    }

    public CircuitBreakerConfig withListener(CircuitBreakerListener listener) {
        return new CircuitBreakerConfig(name, failureThreshold, recoveryTimeoutMs, successThreshold, operationTimeoutMs, listener);
    }
}
