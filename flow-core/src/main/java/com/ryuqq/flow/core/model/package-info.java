/**
 * 이벤트 모델 패키지.
 *
 * <p>{@link com.ryuqq.flow.core.model.Event}, {@link com.ryuqq.flow.core.model.EventMetadata},
 * {@link com.ryuqq.flow.core.model.CostContext}를 포함합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.flow.core.model;
