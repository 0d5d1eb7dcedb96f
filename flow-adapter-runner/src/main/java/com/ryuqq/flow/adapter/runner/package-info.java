/**
 * Runner Adapter Layer - 디스패처와 생명주기 관리자 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.flow.adapter.runner.event.EventProcessor} - 이벤트 fan-out 디스패처</li>
 *   <li>{@link com.ryuqq.flow.adapter.runner.lifecycle.AgentLifecycleManager} - 에이전트 상태 머신</li>
 *   <li>{@link com.ryuqq.flow.adapter.runner.TaskScheduler} - 예약/주기 작업 실행기</li>
 *   <li>{@link com.ryuqq.flow.adapter.runner.Slf4jObservabilitySink} - SLF4J/MDC 관측성 수집기</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (EventProcessor, AgentLifecycleManager)
 *   ↓ implements
 * application (EventDispatcher, AgentLifecycle)
 *   ↓ depends on
 * core (Event, HandlerResult, Middleware, AgentStatus, SPI)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.flow.adapter.runner;
