package com.ryuqq.flow.adapter.protection.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BackoffCalculator 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class BackoffCalculatorTest {

    @Test
    @DisplayName("jitter 없이 지수 증가")
    void calculate_지수_증가() {
        // Given
        BackoffCalculator calculator = new BackoffCalculator(100, 2.0, 30000, false, () -> 0.5);

        // When & Then
        assertEquals(100, calculator.calculate(0));
        assertEquals(200, calculator.calculate(1));
        assertEquals(400, calculator.calculate(2));
        assertEquals(800, calculator.calculate(3));
    }

    @Test
    @DisplayName("상한 적용, 큰 attempt에서도 overflow 없음")
    void calculate_상한_적용() {
        BackoffCalculator calculator = new BackoffCalculator(100, 2.0, 1000, false, () -> 0.5);

        assertEquals(1000, calculator.calculate(4));
        assertEquals(1000, calculator.calculate(500));
    }

    @Test
    @DisplayName("full jitter는 [0, 상한 지연) 구간")
    void calculate_full_jitter() {
        BackoffCalculator half = new BackoffCalculator(100, 2.0, 30000, true, () -> 0.5);
        BackoffCalculator zero = new BackoffCalculator(100, 2.0, 30000, true, () -> 0.0);

        assertEquals(200, half.calculate(2));
        assertEquals(0, zero.calculate(2));
    }

    @Test
    void calculate_음수_attempt_예외() {
        BackoffCalculator calculator = new BackoffCalculator(new RetryConfig());

        assertThrows(IllegalArgumentException.class, () -> calculator.calculate(-1));
    }

    @Test
    void constructor_잘못된_파라미터_예외() {
        assertThrows(IllegalArgumentException.class,
            () -> new BackoffCalculator(-1, 2.0, 100, false, () -> 0.5));
        assertThrows(IllegalArgumentException.class,
            () -> new BackoffCalculator(100, 0.5, 1000, false, () -> 0.5));
        assertThrows(IllegalArgumentException.class,
            () -> new BackoffCalculator(100, 2.0, 50, false, () -> 0.5));
        assertThrows(IllegalArgumentException.class,
            () -> new BackoffCalculator(100, 2.0, 1000, false, null));
    }

    @Test
    void retryConfig_검증() {
        RetryConfig defaults = new RetryConfig();

        assertEquals(3, defaults.maxRetries());
        assertTrue(defaults.retryableStatusCodes().contains(503));
        assertThrows(IllegalArgumentException.class, () -> defaults.withMaxRetries(-1));
        assertThrows(IllegalArgumentException.class, () -> defaults.withMaxTotalMs(0));
        assertThrows(IllegalArgumentException.class, () -> defaults.withBackoffFactor(0.9));
        assertThrows(IllegalArgumentException.class, () -> defaults.withMaxDelayMs(10));
    }
}
