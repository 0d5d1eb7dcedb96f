/**
 * Agent lifecycle state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.flow.core.statemachine.AgentStatus} - Agent lifecycle statuses (enum)</li>
 *   <li>{@link com.ryuqq.flow.core.statemachine.StatusTransition} - Allowed-transition table and validation</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * AgentStatus status = AgentStatus.STOPPED;
 * status = StatusTransition.transition(status, AgentStatus.STARTING);
 * status = StatusTransition.transition(status, AgentStatus.RUNNING);
 *
 * // This will throw InvalidStatusTransitionException
 * StatusTransition.validate(status, AgentStatus.RESUMING);
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.flow.core.statemachine;
