/**
 * Protection SPI 패키지.
 *
 * <p>Circuit Breaker 계약과 상태, 결과, 메트릭, 설정 타입을 정의합니다.
 * 실제 구현은 {@code flow-adapter-protection} 모듈에 있으며,
 * {@code noop} 하위 패키지는 보호 없이 직접 실행하는 기본 구현을 제공합니다.</p>
 *
 * <h2>미들웨어 체인 순서 (권장)</h2>
 * <pre>
 * 1. Retry            → 재시도 가능한 실패를 감싸 다시 시도
 * 2. CircuitBreaker   → OPEN 상태 시 즉시 거부
 * 3. ConcurrencyLimit → 키 단위 동시 실행 수 제한
 * 4. Timeout          → 개별 시도의 상한선
 * 5. Handler          → 실제 작업 실행
 * </pre>
 *
 * <p>Retry를 Circuit Breaker 바깥에 두면 거부({@code CIRCUIT_OPEN}, 503)도
 * 재시도 분류 대상이 되므로 허용 목록 설정에 주의해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @see com.ryuqq.flow.core.protection.CircuitBreaker
 * @see com.ryuqq.flow.core.protection.noop
 */
package com.ryuqq.flow.core.protection;
