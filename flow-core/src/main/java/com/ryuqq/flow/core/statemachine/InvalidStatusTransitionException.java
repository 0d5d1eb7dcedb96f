package com.ryuqq.flow.core.statemachine;

/**
 * 허용되지 않은 상태 전이 시도.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InvalidStatusTransitionException extends IllegalStateException {

    private final AgentStatus from;
    private final AgentStatus to;

    public InvalidStatusTransitionException(AgentStatus from, AgentStatus to) {
        super(String.format("Invalid status transition: %s → %s", from, to));
        this.from = from;
        this.to = to;
    }

    public AgentStatus getFrom() {
        return from;
    }

    public AgentStatus getTo() {
        return to;
    }
}
