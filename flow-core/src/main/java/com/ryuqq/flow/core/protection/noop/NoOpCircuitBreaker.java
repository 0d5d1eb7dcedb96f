package com.ryuqq.flow.core.protection.noop;

import com.ryuqq.flow.core.handler.AbortSignal;
import com.ryuqq.flow.core.protection.CircuitBreaker;
import com.ryuqq.flow.core.protection.CircuitBreakerState;
import com.ryuqq.flow.core.protection.CircuitMetrics;
import com.ryuqq.flow.core.protection.CircuitResult;

import java.util.concurrent.Callable;

/**
 * NoOp Circuit Breaker 구현.
 *
 * <p>항상 CLOSED 상태를 유지하며 작업을 직접 실행합니다.
 * 상태 추적 및 통계 기록을 하지 않습니다.</p>
 *
 * <p><strong>사용 시나리오:</strong></p>
 * <ul>
 *   <li>개발/테스트 환경에서 보호 없이 빠른 실행</li>
 *   <li>Circuit Breaker 미들웨어를 끄고 싶지만 배선은 유지하고 싶을 때</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    private final String name;

    public NoOpCircuitBreaker() {
        this("noop");
    }

    public NoOpCircuitBreaker(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
    }

    /**
     * 작업을 직접 실행하고 결과를 감쌈.
     *
     * @return 성공 또는 실패 결과 (거부 없음)
     */
    @Override
    public <T> CircuitResult<T> execute(Callable<T> operation, AbortSignal signal) {
        long start = System.currentTimeMillis();
        try {
            T result = operation.call();
            return CircuitResult.success(result, CircuitBreakerState.CLOSED, System.currentTimeMillis() - start);
        } catch (Exception e) {
            return CircuitResult.failure(e, CircuitBreakerState.CLOSED, System.currentTimeMillis() - start);
        }
    }

    /**
     * 항상 CLOSED 반환.
     */
    @Override
    public CircuitBreakerState getState() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public CircuitMetrics getMetrics() {
        return new CircuitMetrics(name, CircuitBreakerState.CLOSED, 0, 0, 0, 0, 0, 0, 0.0, 0.0, 0, null, null, null, null);
    }

    @Override
    public void forceOpen() {
        // NoOp
    }

    @Override
    public void forceClose() {
        // NoOp
    }

    @Override
    public void reset() {
        // NoOp
    }

    @Override
    public String getName() {
        return name;
    }
}
