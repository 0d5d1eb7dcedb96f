package com.ryuqq.flow.adapter.protection.circuit;

import com.ryuqq.flow.core.error.AbortedException;
import com.ryuqq.flow.core.error.OperationTimeoutException;
import com.ryuqq.flow.core.handler.AbortSignal;
import com.ryuqq.flow.core.protection.CircuitBreakerConfig;
import com.ryuqq.flow.core.protection.CircuitBreakerListener;
import com.ryuqq.flow.core.protection.CircuitBreakerState;
import com.ryuqq.flow.core.protection.CircuitMetrics;
import com.ryuqq.flow.core.protection.CircuitResult;
import com.ryuqq.flow.testkit.fixture.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * DefaultCircuitBreaker 유닛 테스트.
 *
 * <ul>
 *   <li>연속 실패 failureThreshold회 → OPEN, OPEN에서는 실행하지 않고 거부</li>
 *   <li>recoveryTimeout 경과 후 다음 호출에서 HALF_OPEN</li>
 *   <li>HALF_OPEN 연속 성공 successThreshold회 → CLOSED, 실패 1회 → OPEN</li>
 *   <li>operationTimeout 초과는 실패 1회</li>
 *   <li>수동 제어와 리스너 예외 격리</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DefaultCircuitBreakerTest {

    private static final long RECOVERY_MS = 180_000;

    @Mock
    private CircuitBreakerListener listener;

    private MutableClock clock;
    private ExecutorService executor;
    private DefaultCircuitBreaker breaker;
    private AtomicInteger invocations;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_000_000);
        executor = Executors.newCachedThreadPool();
        invocations = new AtomicInteger();
        breaker = new DefaultCircuitBreaker(
            new CircuitBreakerConfig("payments").withListener(listener), executor, clock
        );
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    // ============================================================
    // 1. CLOSED → OPEN
    // ============================================================

    @Test
    void 연속_실패_3회면_OPEN_전이() {
        // given/when
        failTimes(3);

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        verify(listener).onStateChange("payments", CircuitBreakerState.CLOSED, CircuitBreakerState.OPEN);
    }

    @Test
    void OPEN_상태에서는_작업을_실행하지_않고_거부() {
        // given
        failTimes(3);

        // when
        CircuitResult<String> result = breaker.execute(this::succeed);

        // then
        assertThat(result.rejected()).isTrue();
        assertThat(result.executed()).isFalse();
        assertThat(result.state()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(invocations.get()).isEqualTo(3);
        assertThat(breaker.getMetrics().rejectedCalls()).isEqualTo(1);
    }

    @Test
    void Error도_예외로_던지지_않고_실패로_기록() {
        // given
        AssertionError boom = new AssertionError("boom");

        // when
        CircuitResult<String> result = breaker.execute(() -> {
            throw boom;
        });
        breaker.execute(() -> {
            throw new StackOverflowError();
        });
        breaker.execute(() -> {
            throw boom;
        });

        // then
        assertThat(result.isFailure()).isTrue();
        assertThat(result.error()).isSameAs(boom);
        assertThat(breaker.getMetrics().failedCalls()).isEqualTo(3);
        assertThat(breaker.getMetrics().lastFailureMessage()).isEqualTo("boom");
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        verify(listener, times(2)).onFailure("payments", boom);
    }

    @Test
    void CLOSED에서_성공하면_연속_실패_카운터_초기화() {
        // given
        failTimes(2);
        breaker.execute(this::succeed);

        // when
        failTimes(2);

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.getMetrics().consecutiveFailures()).isEqualTo(2);
    }

    // ============================================================
    // 2. OPEN → HALF_OPEN → CLOSED / OPEN
    // ============================================================

    @Test
    void recoveryTimeout_전에는_계속_거부() {
        failTimes(3);
        clock.advance(RECOVERY_MS - 1);

        CircuitResult<String> result = breaker.execute(this::succeed);

        assertThat(result.rejected()).isTrue();
    }

    @Test
    void recoveryTimeout_경과_후_다음_호출은_HALF_OPEN에서_실행() {
        // given
        failTimes(3);
        clock.advance(RECOVERY_MS);

        // when
        CircuitResult<String> result = breaker.execute(this::succeed);

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.state()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        verify(listener).onStateChange("payments", CircuitBreakerState.OPEN, CircuitBreakerState.HALF_OPEN);
    }

    @Test
    void HALF_OPEN에서_연속_성공_2회면_CLOSED() {
        // given
        failTimes(3);
        clock.advance(RECOVERY_MS);

        // when
        breaker.execute(this::succeed);
        CircuitResult<String> second = breaker.execute(this::succeed);

        // then
        assertThat(second.state()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void HALF_OPEN에서_실패하면_즉시_OPEN() {
        // given
        failTimes(3);
        clock.advance(RECOVERY_MS);
        breaker.execute(this::succeed);

        // when
        CircuitResult<String> result = breaker.execute(this::fail);

        // then
        assertThat(result.isFailure()).isTrue();
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(breaker.getMetrics().nextAttemptTime()).isEqualTo(clock.millis() + RECOVERY_MS);
    }

    // ============================================================
    // 3. 타임아웃과 중단
    // ============================================================

    @Test
    void operationTimeout_초과는_실패로_기록() {
        // given
        DefaultCircuitBreaker fast = new DefaultCircuitBreaker(
            new CircuitBreakerConfig("slow").withOperationTimeoutMs(50), executor, clock
        );

        // when
        CircuitResult<String> result = fast.execute(() -> {
            Thread.sleep(5_000);
            return "late";
        });

        // then
        assertThat(result.isFailure()).isTrue();
        assertThat(result.error()).isInstanceOf(OperationTimeoutException.class);
        assertThat(fast.getMetrics().failedCalls()).isEqualTo(1);
        assertThat(fast.getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void 이미_중단된_신호면_실행하지_않고_실패() {
        AbortSignal signal = AbortSignal.none();
        signal.abort("shutdown");

        CircuitResult<String> result = breaker.execute(this::succeed, signal);

        assertThat(result.isFailure()).isTrue();
        assertThat(result.error()).isInstanceOf(AbortedException.class);
        assertThat(invocations.get()).isZero();
    }

    // ============================================================
    // 4. 수동 제어, 메트릭, 리스너
    // ============================================================

    @Test
    void forceOpen_forceClose_reset() {
        breaker.forceOpen();
        assertThat(breaker.execute(this::succeed).rejected()).isTrue();

        breaker.forceClose();
        assertThat(breaker.execute(this::succeed).isSuccess()).isTrue();

        breaker.reset();
        CircuitMetrics metrics = breaker.getMetrics();
        assertThat(metrics.totalCalls()).isZero();
        assertThat(metrics.rejectedCalls()).isZero();
        assertThat(metrics.state()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void 메트릭은_성공률과_마지막_실패를_보고() {
        // given
        breaker.execute(this::succeed);
        clock.advance(10);
        breaker.execute(this::fail);

        // when
        CircuitMetrics metrics = breaker.getMetrics();

        // then
        assertThat(metrics.totalCalls()).isEqualTo(2);
        assertThat(metrics.successfulCalls()).isEqualTo(1);
        assertThat(metrics.failedCalls()).isEqualTo(1);
        assertThat(metrics.successRate()).isEqualTo(0.5);
        assertThat(metrics.failureRate()).isEqualTo(0.5);
        assertThat(metrics.lastFailureMessage()).isEqualTo("downstream unavailable");
        assertThat(metrics.lastFailureTime()).isEqualTo(clock.millis());
        assertThat(metrics.nextAttemptTime()).isNull();
    }

    @Test
    void 리스너_예외는_결과에_영향을_주지_않음() {
        // given
        doThrow(new IllegalStateException("listener down")).when(listener).onSuccess(any(), anyLong());
        doThrow(new IllegalStateException("listener down")).when(listener)
            .onStateChange(any(), any(), any());

        // when
        CircuitResult<String> success = breaker.execute(this::succeed);
        failTimes(3);

        // then
        assertThat(success.isSuccess()).isTrue();
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        verify(listener, times(3)).onFailure(eq("payments"), any(IOException.class));
    }

    private String succeed() {
        invocations.incrementAndGet();
        return "ok";
    }

    private String fail() throws IOException {
        invocations.incrementAndGet();
        throw new IOException("downstream unavailable");
    }

    private void failTimes(int times) {
        for (int i = 0; i < times; i++) {
            breaker.execute(this::fail);
        }
    }
}
