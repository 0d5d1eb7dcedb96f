package com.ryuqq.flow.core.handler;

import com.ryuqq.flow.core.model.Event;

import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * {@link PipelineMiddleware} 조합 유틸리티.
 *
 * <p><strong>제공 기능:</strong></p>
 * <ul>
 *   <li>{@link #when}: 조건을 만족하는 이벤트에만 미들웨어 적용</li>
 *   <li>{@link #compose}: 여러 미들웨어를 하나로 묶음 (첫 번째가 가장 바깥)</li>
 *   <li>{@link #forEventTypes}: 이벤트 타입 조건</li>
 * </ul>
 *
 * <pre>
 * PipelineMiddleware critical = Middlewares.when(
 *     Middlewares.forEventTypes("payment.requested"),
 *     Middlewares.compose(circuitBreaker, retry, timeout)
 * );
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Middlewares {

    private Middlewares() {
    }

    /**
     * 조건부 미들웨어.
     *
     * <p>조건이 false인 이벤트는 감싸지 않은 다음 핸들러로 바로 전달됩니다.</p>
     *
     * @param condition 이벤트 조건
     * @param middleware 조건이 참일 때 적용할 미들웨어
     * @return 조건부 미들웨어
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static PipelineMiddleware when(Predicate<Event> condition, PipelineMiddleware middleware) {
        if (condition == null) {
            throw new IllegalArgumentException("condition cannot be null");
        }
        if (middleware == null) {
            throw new IllegalArgumentException("middleware cannot be null");
        }
        return new PipelineMiddleware() {
            @Override
            public PipelineHandler apply(PipelineHandler next) {
                PipelineHandler wrapped = middleware.apply(next);
                return (event, signal) -> condition.test(event)
                    ? wrapped.handle(event, signal)
                    : next.handle(event, signal);
            }

            @Override
            public String name() {
                return "when(" + middleware.name() + ")";
            }
        };
    }

    /**
     * 미들웨어 합성. 목록의 첫 번째가 가장 바깥을 감쌉니다.
     *
     * @param middlewares 합성할 미들웨어 (비어 있으면 그대로 통과)
     * @return 합성된 미들웨어
     */
    public static PipelineMiddleware compose(PipelineMiddleware... middlewares) {
        if (middlewares == null) {
            throw new IllegalArgumentException("middlewares cannot be null");
        }
        List<PipelineMiddleware> chain = List.of(middlewares);
        return new PipelineMiddleware() {
            @Override
            public PipelineHandler apply(PipelineHandler next) {
                PipelineHandler handler = next;
                for (int i = chain.size() - 1; i >= 0; i--) {
                    handler = chain.get(i).apply(handler);
                }
                return handler;
            }

            @Override
            public String name() {
                return "compose" + chain.stream().map(Middleware::name).toList();
            }
        };
    }

    /**
     * 지정한 타입 중 하나와 정확히 일치하는 이벤트.
     */
    public static Predicate<Event> forEventTypes(String... types) {
        Set<String> accepted = Set.of(types);
        return event -> accepted.contains(event.type());
    }
}
