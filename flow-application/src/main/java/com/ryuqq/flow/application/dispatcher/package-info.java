/**
 * Event dispatch use case.
 *
 * <p>Defines the {@link com.ryuqq.flow.application.dispatcher.EventDispatcher} contract.
 * The runtime implementation lives in {@code flow-adapter-runner}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.flow.application.dispatcher;
