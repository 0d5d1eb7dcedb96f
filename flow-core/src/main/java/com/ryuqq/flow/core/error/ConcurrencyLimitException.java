package com.ryuqq.flow.core.error;

import java.util.Map;

/**
 * 동시 실행 한도로 인해 실행되지 못함.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ConcurrencyLimitException extends FlowException {

    private ConcurrencyLimitException(String code, String message, String key, int limit) {
        super(code, message, 429, Map.of("key", key, "limit", limit), null);
    }

    public static ConcurrencyLimitException dropped(String key, int limit) {
        return new ConcurrencyLimitException(
            ErrorCodes.CONCURRENCY_DROP,
            "Concurrency limit reached, call dropped (key: " + key + ", limit: " + limit + ")",
            key, limit
        );
    }

    public static ConcurrencyLimitException timedOut(String key, int limit, long waitedMs) {
        return new ConcurrencyLimitException(
            ErrorCodes.CONCURRENCY_TIMEOUT,
            "Timed out after " + waitedMs + "ms waiting for a slot (key: " + key + ", limit: " + limit + ")",
            key, limit
        );
    }
}
