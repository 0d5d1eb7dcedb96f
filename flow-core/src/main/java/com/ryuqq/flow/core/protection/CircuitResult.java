package com.ryuqq.flow.core.protection;

/**
 * Circuit Breaker 실행 결과.
 *
 * <ul>
 *   <li>성공: executed=true, rejected=false, error=null</li>
 *   <li>실패/타임아웃: executed=true, rejected=false, error!=null</li>
 *   <li>거부: executed=false, rejected=true</li>
 * </ul>
 *
 * @param executed 작업 실행 여부
 * @param rejected OPEN 상태로 거부되었는지 여부
 * @param result 작업 결과 (성공 시, null 허용)
 * @param error 실패 원인 (실패 시)
 * @param state 실행 직후 회로 상태
 * @param durationMs 실행 소요 시간 (거부 시 0)
 * @param <T> 결과 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CircuitResult<T>(
    boolean executed,
    boolean rejected,
    T result,
    Throwable error,
    CircuitBreakerState state,
    long durationMs
) {

    public CircuitResult {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
    }

    public static <T> CircuitResult<T> success(T result, CircuitBreakerState state, long durationMs) {
        return new CircuitResult<>(true, false, result, null, state, durationMs);
    }

    public static <T> CircuitResult<T> failure(Throwable error, CircuitBreakerState state, long durationMs) {
        return new CircuitResult<>(true, false, null, error, state, durationMs);
    }

    public static <T> CircuitResult<T> rejected(CircuitBreakerState state) {
        return new CircuitResult<>(false, true, null, null, state, 0);
    }

    public boolean isSuccess() {
        return executed && error == null;
    }

    public boolean isFailure() {
        return executed && error != null;
    }
}
