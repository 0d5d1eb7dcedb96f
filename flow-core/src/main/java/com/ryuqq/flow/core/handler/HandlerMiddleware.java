package com.ryuqq.flow.core.handler;

/**
 * 등록 시점에 원본 핸들러를 감싸는 미들웨어.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public non-sealed interface HandlerMiddleware extends Middleware {

    EventHandler apply(EventHandler handler);
}
