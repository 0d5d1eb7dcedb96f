package com.ryuqq.flow.core.handler;

/**
 * 호출마다 적용되는 미들웨어 (재시도, Circuit Breaker, 타임아웃 등).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public non-sealed interface PipelineMiddleware extends Middleware {

    PipelineHandler apply(PipelineHandler next);
}
