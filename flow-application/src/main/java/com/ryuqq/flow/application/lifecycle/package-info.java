/**
 * Agent lifecycle use case.
 *
 * <p>Commands, results and read views for
 * {@link com.ryuqq.flow.application.lifecycle.AgentLifecycle}. The state machine itself
 * ({@link com.ryuqq.flow.core.statemachine.StatusTransition}) lives in core; the registry
 * and timers live in {@code flow-adapter-runner}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.flow.application.lifecycle;
