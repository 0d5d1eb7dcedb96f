package com.ryuqq.flow.core.error;

import java.util.Map;

/**
 * 작업이 허용 시간 안에 끝나지 않음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class OperationTimeoutException extends FlowException {

    private final long timeoutMs;

    public OperationTimeoutException(String operation, long timeoutMs) {
        super(
            ErrorCodes.TIMEOUT_EXCEEDED,
            "Operation timed out after " + timeoutMs + "ms (operation: " + operation + ")",
            408,
            Map.of("operation", operation, "timeoutMs", timeoutMs),
            null
        );
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
