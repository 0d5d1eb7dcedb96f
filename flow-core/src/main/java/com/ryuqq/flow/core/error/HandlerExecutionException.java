package com.ryuqq.flow.core.error;

import java.util.Map;

/**
 * 핸들러가 던진 checked 예외를 감쌈.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class HandlerExecutionException extends FlowException {

    public HandlerExecutionException(String handlerId, String eventType, Throwable cause) {
        super(
            ErrorCodes.HANDLER_FAILED,
            "Handler " + handlerId + " failed for event type " + eventType + ": " + cause.getMessage(),
            null,
            Map.of("handlerId", handlerId, "eventType", eventType),
            cause
        );
    }
}
