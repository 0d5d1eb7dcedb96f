/**
 * 핸들러와 미들웨어 계약.
 *
 * <h2>미들웨어 합성</h2>
 * <pre>
 * 등록:  EventHandler ──HandlerMiddleware*──▶ 저장된 EventHandler
 * 호출:  PipelineHandler.of(저장된 핸들러) ──PipelineMiddleware*──▶ 실행
 * </pre>
 *
 * <p>목록의 첫 번째 미들웨어가 가장 바깥쪽에 위치합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.flow.core.handler;
