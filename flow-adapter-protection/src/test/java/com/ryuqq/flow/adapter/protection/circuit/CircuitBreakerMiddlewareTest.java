package com.ryuqq.flow.adapter.protection.circuit;

import com.ryuqq.flow.core.error.CircuitOpenException;
import com.ryuqq.flow.core.error.ErrorCodes;
import com.ryuqq.flow.core.handler.AbortSignal;
import com.ryuqq.flow.core.handler.HandlerResult;
import com.ryuqq.flow.core.handler.PipelineHandler;
import com.ryuqq.flow.core.model.Event;
import com.ryuqq.flow.core.protection.CircuitBreakerConfig;
import com.ryuqq.flow.core.protection.CircuitBreakerState;
import com.ryuqq.flow.testkit.fixture.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CircuitBreakerMiddleware 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CircuitBreakerMiddlewareTest {

    private CircuitBreakerRegistry registry;
    private AtomicInteger calls;

    @BeforeEach
    void setUp() {
        registry = new CircuitBreakerRegistry(
            new CircuitBreakerConfig("default").withFailureThreshold(2), new MutableClock(0)
        );
        calls = new AtomicInteger();
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void 실패는_원래_예외로_다시_던짐() {
        PipelineHandler handler = new CircuitBreakerMiddleware(registry).apply(failing());

        assertThatThrownBy(() -> handler.handle(Event.of("payment", 1), AbortSignal.none()))
            .isInstanceOf(IOException.class)
            .hasMessage("gateway down");
    }

    @Test
    void 열린_회로는_CircuitOpenException과_onRejected_호출() throws Exception {
        // given
        List<String> rejected = new ArrayList<>();
        PipelineHandler handler = new CircuitBreakerMiddleware(registry)
            .withOnRejected((event, circuit) -> rejected.add(circuit))
            .apply(failing());
        Event event = Event.of("payment", 1);
        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> handler.handle(event, AbortSignal.none())).isInstanceOf(IOException.class);
        }

        // when/then
        assertThatThrownBy(() -> handler.handle(event, AbortSignal.none()))
            .isInstanceOf(CircuitOpenException.class)
            .satisfies(e -> assertThat(((CircuitOpenException) e).getCode()).isEqualTo(ErrorCodes.CIRCUIT_OPEN));
        assertThat(rejected).containsExactly("payment");
        assertThat(calls.get()).isEqualTo(2);
        assertThat(registry.find("payment")).hasValueSatisfying(
            circuit -> assertThat(circuit.getState()).isEqualTo(CircuitBreakerState.OPEN));
    }

    @Test
    void 키_생성기로_회로를_분리() throws Exception {
        PipelineHandler handler = new CircuitBreakerMiddleware(registry)
            .withKeyGenerator(event -> "tenant-" + event.data())
            .apply((event, signal) -> HandlerResult.none());

        handler.handle(Event.of("payment", "a"), AbortSignal.none());
        handler.handle(Event.of("payment", "b"), AbortSignal.none());

        assertThat(registry.getAllMetrics().keySet()).containsExactly("tenant-a", "tenant-b");
    }

    @Test
    void 보호_대상이_아니면_회로를_거치지_않음() throws Exception {
        PipelineHandler handler = new CircuitBreakerMiddleware(registry)
            .withShouldProtect(event -> !event.type().startsWith("internal."))
            .apply((event, signal) -> HandlerResult.none());

        handler.handle(Event.of("internal.tick", null), AbortSignal.none());

        assertThat(registry.size()).isZero();
    }

    @Test
    void onRejected_예외는_무시하고_CircuitOpenException_유지() {
        PipelineHandler handler = new CircuitBreakerMiddleware(registry)
            .withOnRejected((event, circuit) -> {
                throw new IllegalStateException("callback down");
            })
            .apply(failing());
        registry.getOrCreate("payment").forceOpen();

        assertThatThrownBy(() -> handler.handle(Event.of("payment", 1), AbortSignal.none()))
            .isInstanceOf(CircuitOpenException.class);
    }

    @Test
    void resetAll은_모든_회로를_닫음() {
        registry.getOrCreate("a").forceOpen();
        registry.getOrCreate("b").forceOpen();

        registry.resetAll();

        assertThat(registry.getAllMetrics().values())
            .allSatisfy(metrics -> assertThat(metrics.state()).isEqualTo(CircuitBreakerState.CLOSED));
    }

    private PipelineHandler failing() {
        return (event, signal) -> {
            calls.incrementAndGet();
            throw new IOException("gateway down");
        };
    }
}
