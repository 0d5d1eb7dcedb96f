package com.ryuqq.flow.adapter.runner;

import com.ryuqq.flow.adapter.inmemory.store.ConcurrentStateStore;
import com.ryuqq.flow.adapter.inmemory.store.StateStoreConfig;
import com.ryuqq.flow.adapter.protection.circuit.CircuitBreakerMiddleware;
import com.ryuqq.flow.adapter.protection.circuit.CircuitBreakerRegistry;
import com.ryuqq.flow.adapter.protection.retry.BackoffCalculator;
import com.ryuqq.flow.adapter.protection.retry.RetryConfig;
import com.ryuqq.flow.adapter.protection.retry.RetryMiddleware;
import com.ryuqq.flow.adapter.protection.timeout.TimeoutMiddleware;
import com.ryuqq.flow.adapter.runner.event.EventProcessor;
import com.ryuqq.flow.adapter.runner.event.EventProcessorConfig;
import com.ryuqq.flow.core.context.RuntimeContext;
import com.ryuqq.flow.core.error.CircuitOpenException;
import com.ryuqq.flow.core.error.ErrorCodes;
import com.ryuqq.flow.core.error.FlowException;
import com.ryuqq.flow.core.handler.EventHandler;
import com.ryuqq.flow.core.handler.HandlerResult;
import com.ryuqq.flow.core.handler.Middleware;
import com.ryuqq.flow.core.model.Event;
import com.ryuqq.flow.core.protection.CircuitBreakerConfig;
import com.ryuqq.flow.core.protection.CircuitBreakerState;
import com.ryuqq.flow.core.protection.CircuitMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * EventProcessor와 보호 미들웨어, 상태 저장소를 함께 사용하는 통합 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ResilientEventPipelineTest {

    private final CircuitBreakerRegistry circuits = new CircuitBreakerRegistry(
        new CircuitBreakerConfig("default"), Clock.systemUTC()
    );
    private final TimeoutMiddleware timeout = new TimeoutMiddleware(100);
    private final RetryMiddleware retry = new RetryMiddleware(
        new RetryConfig(), new BackoffCalculator(1, 2.0, 10, false, () -> 1.0), Clock.systemUTC()
    );
    private EventProcessor processor;

    @AfterEach
    void tearDown() {
        if (processor != null) {
            processor.close();
        }
        timeout.close();
        circuits.close();
    }

    // ============================================================
    // 1. 회로 차단기 안쪽의 재시도
    // ============================================================

    @Test
    void 일시적_실패는_재시도로_흡수되고_회로에는_성공_한_번으로_기록() {
        // given
        processor = processor(List.of(new CircuitBreakerMiddleware(circuits), retry));
        AtomicInteger calls = new AtomicInteger();
        processor.registerHandler("llm.call", event -> {
            if (calls.incrementAndGet() <= 2) {
                throw new FlowException(ErrorCodes.ECONNRESET, "connection reset");
            }
            return HandlerResult.none();
        });

        // when
        processor.processEvent(Event.of("llm.call", null));

        // then
        assertThat(calls.get()).isEqualTo(3);
        CircuitMetrics metrics = circuits.getAllMetrics().get("llm.call");
        assertThat(metrics.successfulCalls()).isEqualTo(1);
        assertThat(metrics.failedCalls()).isZero();
    }

    @Test
    void 연속_실패로_회로가_열리면_핸들러를_호출하지_않고_거부() {
        // given
        processor = processor(List.of(new CircuitBreakerMiddleware(circuits), retry));
        AtomicInteger calls = new AtomicInteger();
        processor.registerHandler("llm.call", event -> {
            calls.incrementAndGet();
            throw new FlowException("BAD_PROMPT", "rejected by provider", 400);
        });
        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> processor.processEvent(Event.of("llm.call", null)))
                .isInstanceOf(FlowException.class)
                .hasMessage("rejected by provider");
        }

        // when/then
        assertThatThrownBy(() -> processor.processEvent(Event.of("llm.call", null)))
            .isInstanceOf(CircuitOpenException.class);
        assertThat(calls.get()).isEqualTo(3);
        assertThat(circuits.getOrCreate("llm.call").getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(processor.getStats().failedEvents()).isEqualTo(4);
    }

    // ============================================================
    // 2. 재시도 안쪽의 타임아웃
    // ============================================================

    @Test
    void 시간_초과된_시도는_재시도되고_다음_시도가_성공() {
        // given
        processor = processor(List.<Middleware>of(retry, timeout));
        AtomicInteger calls = new AtomicInteger();
        processor.registerHandler("crawl", event -> {
            if (calls.incrementAndGet() == 1) {
                Thread.sleep(5_000);
            }
            return HandlerResult.none();
        });

        // when
        processor.processEvent(Event.of("crawl", null));

        // then
        assertThat(calls.get()).isEqualTo(2);
        assertThat(processor.getStats().failedEvents()).isZero();
    }

    // ============================================================
    // 3. 배치 핸들러와 상태 저장소
    // ============================================================

    @Test
    void 배치로_실행된_핸들러가_같은_네임스페이스에_동시에_기록() {
        // given
        processor = processor(List.of());
        try (ConcurrentStateStore store = new ConcurrentStateStore(new StateStoreConfig(10, 500, 0))) {
            for (int i = 0; i < 250; i++) {
                String key = "handler-" + i;
                processor.registerHandler("index.page", EventHandler.consuming(
                    event -> store.set("index", key, event.data())
                ));
            }

            // when
            processor.processEvent(Event.of("index.page", "page-1"));

            // then
            assertThat(store.size("index")).isEqualTo(250);
            assertThat(store.get("index", "handler-249")).contains("page-1");
        }
    }

    private EventProcessor processor(List<Middleware> middlewares) {
        EventProcessorConfig config = new EventProcessorConfig()
            .withCleanupIntervalMs(0)
            .withMiddlewares(middlewares);
        return new EventProcessor(config, RuntimeContext.defaults().withObservability(new Slf4jObservabilitySink()));
    }
}
