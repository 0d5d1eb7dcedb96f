package com.ryuqq.flow.core.handler;

import com.ryuqq.flow.core.model.Event;

/**
 * 이벤트 핸들러.
 *
 * <p>후속 이벤트를 만들려면 {@link HandlerResult#reEmit(Event)}을 반환합니다.
 * 반환된 이벤트는 같은 깊이/체인 추적 아래에서 즉시 재귀 디스패치됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventHandler {

    /**
     * 이벤트 처리.
     *
     * @param event 처리할 이벤트
     * @return 처리 결과 (null 반환 시 {@link HandlerResult#none()}으로 간주)
     * @throws Exception 처리 실패
     */
    HandlerResult handle(Event event) throws Exception;

    /**
     * 반환값이 없는 핸들러를 감쌈.
     *
     * @param consumer 이벤트 소비자
     * @return 항상 {@link HandlerResult#none()}을 반환하는 핸들러
     */
    static EventHandler consuming(EventConsumer consumer) {
        return event -> {
            consumer.accept(event);
            return HandlerResult.none();
        };
    }

    /**
     * checked 예외를 허용하는 이벤트 소비자.
     */
    @FunctionalInterface
    interface EventConsumer {
        void accept(Event event) throws Exception;
    }
}
