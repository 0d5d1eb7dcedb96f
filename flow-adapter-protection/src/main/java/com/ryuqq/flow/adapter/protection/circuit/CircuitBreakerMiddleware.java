package com.ryuqq.flow.adapter.protection.circuit;

import com.ryuqq.flow.core.error.CircuitOpenException;
import com.ryuqq.flow.core.handler.HandlerResult;
import com.ryuqq.flow.core.handler.PipelineHandler;
import com.ryuqq.flow.core.handler.PipelineMiddleware;
import com.ryuqq.flow.core.model.Event;
import com.ryuqq.flow.core.protection.CircuitBreaker;
import com.ryuqq.flow.core.protection.CircuitResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Circuit Breaker pipeline 미들웨어.
 *
 * <p>이벤트마다 키(기본: 이벤트 타입)로 회로를 선택하고 다음 핸들러를 회로 안에서 실행합니다.</p>
 * <ul>
 *   <li>거부: {@code onRejected} 콜백 후 {@link CircuitOpenException}</li>
 *   <li>실패: 원본 예외를 그대로 다시 던짐</li>
 *   <li>{@code shouldProtect}가 false인 이벤트는 회로를 거치지 않음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CircuitBreakerMiddleware implements PipelineMiddleware {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerMiddleware.class);

    private final CircuitBreakerRegistry registry;
    private final Function<Event, String> keyGenerator;
    private final Predicate<Event> shouldProtect;
    private final BiConsumer<Event, String> onRejected;

    public CircuitBreakerMiddleware(CircuitBreakerRegistry registry) {
        this(registry, Event::type, event -> true, (event, circuit) -> { });
    }

    private CircuitBreakerMiddleware(
        CircuitBreakerRegistry registry,
        Function<Event, String> keyGenerator,
        Predicate<Event> shouldProtect,
        BiConsumer<Event, String> onRejected
    ) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (keyGenerator == null) {
            throw new IllegalArgumentException("keyGenerator cannot be null");
        }
        if (shouldProtect == null) {
            throw new IllegalArgumentException("shouldProtect cannot be null");
        }
        if (onRejected == null) {
            throw new IllegalArgumentException("onRejected cannot be null");
        }
        this.registry = registry;
        this.keyGenerator = keyGenerator;
        this.shouldProtect = shouldProtect;
        this.onRejected = onRejected;
    }

    /**
     * 회로 키 생성기를 바꾼 새 인스턴스.
     */
    public CircuitBreakerMiddleware withKeyGenerator(Function<Event, String> keyGenerator) {
        return new CircuitBreakerMiddleware(registry, keyGenerator, shouldProtect, onRejected);
    }

    /**
     * 보호 대상 판단 조건을 바꾼 새 인스턴스.
     */
    public CircuitBreakerMiddleware withShouldProtect(Predicate<Event> shouldProtect) {
        return new CircuitBreakerMiddleware(registry, keyGenerator, shouldProtect, onRejected);
    }

    /**
     * 거부 콜백을 바꾼 새 인스턴스. 콜백은 (이벤트, 회로 이름)을 받습니다.
     */
    public CircuitBreakerMiddleware withOnRejected(BiConsumer<Event, String> onRejected) {
        return new CircuitBreakerMiddleware(registry, keyGenerator, shouldProtect, onRejected);
    }

    @Override
    public PipelineHandler apply(PipelineHandler next) {
        return (event, signal) -> {
            if (!shouldProtect.test(event)) {
                return next.handle(event, signal);
            }
            CircuitBreaker circuit = registry.getOrCreate(keyGenerator.apply(event));
            CircuitResult<HandlerResult> result = circuit.execute(() -> next.handle(event, signal), signal);

            if (result.rejected()) {
                log.warn("Event {} ({}) rejected by open circuit {}", event.id(), event.type(), circuit.getName());
                notifyRejected(event, circuit.getName());
                throw new CircuitOpenException(circuit.getName());
            }
            if (result.isFailure()) {
                Throwable error = result.error();
                if (error instanceof Exception exception) {
                    throw exception;
                }
                throw (Error) error;
            }
            return result.result();
        };
    }

    @Override
    public String name() {
        return "circuitBreaker";
    }

    private void notifyRejected(Event event, String circuitName) {
        try {
            onRejected.accept(event, circuitName);
        } catch (RuntimeException e) {
            log.warn("onRejected callback failed for circuit {}: {}", circuitName, e.getMessage(), e);
        }
    }
}
