package com.ryuqq.flow.core.protection;

/**
 * Circuit Breaker 이벤트 콜백.
 *
 * <p>외부 메트릭 수집용입니다. 콜백 실패는 회로 동작에 영향을 주지 않으며
 * 로깅 후 무시됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CircuitBreakerListener {

    CircuitBreakerListener NONE = new CircuitBreakerListener() {
    };

    default void onStateChange(String name, CircuitBreakerState from, CircuitBreakerState to) {
    }

    default void onSuccess(String name, long durationMs) {
    }

    default void onFailure(String name, Throwable error) {
    }
}
