/**
 * 런타임 예외 계층.
 *
 * <p>모든 도메인 예외는 unchecked {@link com.ryuqq.flow.core.error.FlowException}을 상속하며
 * 에러 코드와 진단 컨텍스트를 가집니다. 잘못된 상태 전이만은
 * {@link java.lang.IllegalStateException} 계열로 표현합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.flow.core.error;
