package com.ryuqq.flow.core.error;

import java.util.Map;

/**
 * 재시도 한도 소진.
 *
 * <p>마지막 원인 예외를 {@link #getCause()}로 감쌉니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RetryExceededException extends FlowException {

    private final int attempts;
    private final String eventType;

    public RetryExceededException(int attempts, String eventType, Throwable lastError) {
        super(
            ErrorCodes.RETRY_EXCEEDED,
            "Retry exceeded after " + attempts + " attempts (type: " + eventType + ")",
            null,
            Map.of("attempts", attempts, "eventType", eventType),
            lastError
        );
        this.attempts = attempts;
        this.eventType = eventType;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getEventType() {
        return eventType;
    }
}
