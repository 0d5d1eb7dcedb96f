/**
 * 이벤트 디스패치 구현.
 *
 * <p>{@link com.ryuqq.flow.adapter.runner.event.EventProcessor}만 공개되며
 * 레지스트리, 체인 추적, 이력 버퍼는 패키지 내부 구현입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.flow.adapter.runner.event;
