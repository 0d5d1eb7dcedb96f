package com.ryuqq.flow.core.handler;

import com.ryuqq.flow.core.model.Event;

/**
 * 파이프라인 단계에서 보는 핸들러 시그니처.
 *
 * <p>{@link EventHandler}에 중단 신호를 더한 형태로, 호출마다 적용되는
 * {@link PipelineMiddleware}가 이 타입을 감쌉니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface PipelineHandler {

    HandlerResult handle(Event event, AbortSignal signal) throws Exception;

    /**
     * 중단 신호를 무시하는 어댑터.
     *
     * @param handler 원본 핸들러
     * @return 파이프라인 핸들러
     */
    static PipelineHandler of(EventHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        return (event, signal) -> handler.handle(event);
    }
}
