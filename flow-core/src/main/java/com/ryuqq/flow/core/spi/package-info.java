/**
 * 외부 협력자 SPI 패키지.
 *
 * <ul>
 *   <li>{@link com.ryuqq.flow.core.spi.StateStore}: 네임스페이스 키/값 저장소</li>
 *   <li>{@link com.ryuqq.flow.core.spi.SnapshotPersistor}: pause/resume 스냅샷 저장소</li>
 *   <li>{@link com.ryuqq.flow.core.spi.ObservabilitySink}: 로그/트레이스 수집기</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.flow.core.spi;
