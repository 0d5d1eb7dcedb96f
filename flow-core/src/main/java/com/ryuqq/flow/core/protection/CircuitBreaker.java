package com.ryuqq.flow.core.protection;

import com.ryuqq.flow.core.handler.AbortSignal;

import java.util.concurrent.Callable;

/**
 * Circuit Breaker SPI.
 *
 * <p>작업의 연속 실패를 추적하고, 임계값 도달 시 빠르게 거부(Fail-Fast)하여
 * 장애가 호출자 체인 전체로 전파되는 것을 방지합니다.</p>
 *
 * <p><strong>Circuit Breaker 패턴:</strong></p>
 * <ul>
 *   <li>CLOSED: 정상 동작, 연속 실패 추적</li>
 *   <li>OPEN: 작업을 실행하지 않고 즉시 거부</li>
 *   <li>HALF_OPEN: 복구 대기 후 호출을 통과시켜 복구 여부 확인</li>
 * </ul>
 *
 * <p><strong>예외 정책:</strong> {@code execute}는 예외를 던지지 않습니다.
 * 실패와 거부는 모두 {@link CircuitResult}로 표현됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitResult<Response> result = breaker.execute(() -> client.call(request));
 *
 * if (result.rejected()) {
 *     // OPEN 상태, 작업은 실행되지 않음
 *     return fallback();
 * }
 * if (result.isFailure()) {
 *     throw result.error();
 * }
 * return result.result();
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 작업 실행.
     *
     * @param operation 보호할 작업
     * @param <T> 결과 타입
     * @return 실행 결과 (예외를 던지지 않음)
     */
    default <T> CircuitResult<T> execute(Callable<T> operation) {
        return execute(operation, AbortSignal.none());
    }

    /**
     * 중단 신호와 함께 작업 실행.
     *
     * <p>작업 타임아웃 대기 중 신호가 중단되면 대기를 즉시 종료하고
     * 중단 에러를 결과에 담습니다.</p>
     *
     * @param operation 보호할 작업
     * @param signal 중단 신호
     * @param <T> 결과 타입
     * @return 실행 결과 (예외를 던지지 않음)
     */
    <T> CircuitResult<T> execute(Callable<T> operation, AbortSignal signal);

    /**
     * 현재 상태 조회.
     *
     * <p>OPEN에서 HALF_OPEN으로의 전이는 다음 실행 시도 시점에만 평가되므로,
     * 복구 대기 시간이 지났더라도 호출 전에는 OPEN으로 보일 수 있습니다.</p>
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 누적 메트릭 스냅샷.
     */
    CircuitMetrics getMetrics();

    /**
     * 강제로 OPEN 전환.
     */
    void forceOpen();

    /**
     * 강제로 CLOSED 전환 (카운터 초기화).
     */
    void forceClose();

    /**
     * CLOSED 상태로 리셋하고 누적 메트릭까지 초기화.
     *
     * <p>수동 복구 또는 테스트 목적으로 사용됩니다.</p>
     */
    void reset();

    /**
     * @return 회로 이름
     */
    String getName();
}
