package com.ryuqq.flow.core.error;

/**
 * 중단 신호에 의해 대기가 취소됨.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class AbortedException extends FlowException {

    public AbortedException(String reason) {
        super(ErrorCodes.ABORTED, reason == null ? "Operation aborted" : "Operation aborted: " + reason);
    }
}
