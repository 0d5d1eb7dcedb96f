/**
 * Circuit Breaker 구현과 미들웨어.
 *
 * <pre>{@code
 * CircuitBreakerRegistry registry = new CircuitBreakerRegistry();
 * EventProcessorConfig config = new EventProcessorConfig()
 *     .withMiddlewares(List.of(new CircuitBreakerMiddleware(registry)));
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.flow.adapter.protection.circuit;
