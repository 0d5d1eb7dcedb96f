package com.ryuqq.flow.core.handler;

/**
 * 미들웨어 공통 타입.
 *
 * <p>두 종류로만 구성됩니다.</p>
 * <ul>
 *   <li>{@link HandlerMiddleware}: 등록 시점에 한 번 적용되어 저장되는 핸들러에 포함</li>
 *   <li>{@link PipelineMiddleware}: 호출마다 적용, 중단 신호 등 호출 단위 컨텍스트 사용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Middleware permits HandlerMiddleware, PipelineMiddleware {

    /**
     * 로깅용 이름.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
