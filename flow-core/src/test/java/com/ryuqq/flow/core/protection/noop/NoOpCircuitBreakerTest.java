package com.ryuqq.flow.core.protection.noop;

import com.ryuqq.flow.core.protection.CircuitBreaker;
import com.ryuqq.flow.core.protection.CircuitBreakerState;
import com.ryuqq.flow.core.protection.CircuitResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NoOpCircuitBreaker 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("NoOpCircuitBreaker 테스트")
class NoOpCircuitBreakerTest {

    @Test
    @DisplayName("execute()는 작업을 바로 실행하고 결과를 돌려준다")
    void execute_바로_실행() {
        // given
        CircuitBreaker breaker = new NoOpCircuitBreaker();

        // when
        CircuitResult<String> result = breaker.execute(() -> "ok");

        // then
        assertTrue(result.isSuccess());
        assertEquals("ok", result.result());
        assertEquals(CircuitBreakerState.CLOSED, result.state());
    }

    @Test
    @DisplayName("실패는 결과에 담기고 예외로 던지지 않는다")
    void execute_실패_결과_반환() {
        CircuitBreaker breaker = new NoOpCircuitBreaker();

        CircuitResult<String> result = breaker.execute(() -> {
            throw new IOException("down");
        });

        assertTrue(result.isFailure());
        assertInstanceOf(IOException.class, result.error());
    }

    @Test
    @DisplayName("forceOpen() 이후에도 항상 CLOSED")
    void forceOpen_무시() {
        CircuitBreaker breaker = new NoOpCircuitBreaker("payments");

        breaker.forceOpen();

        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
        assertEquals("payments", breaker.getMetrics().name());
        assertEquals(0, breaker.getMetrics().totalCalls());
    }
}
