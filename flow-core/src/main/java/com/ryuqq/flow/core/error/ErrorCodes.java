package com.ryuqq.flow.core.error;

/**
 * 런타임 에러 코드 상수.
 *
 * <p>재시도 분류 허용 목록({@code retryableErrorCodes})과 매칭되는 값이므로
 * 문자열 값을 변경하면 호환성이 깨집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ErrorCodes {

    public static final String MAX_DEPTH_EXCEEDED = "MAX_DEPTH_EXCEEDED";
    public static final String MAX_CHAIN_LENGTH_EXCEEDED = "MAX_CHAIN_LENGTH_EXCEEDED";
    public static final String EVENT_LOOP_DETECTED = "EVENT_LOOP_DETECTED";
    public static final String HANDLER_FAILED = "HANDLER_FAILED";

    public static final String RETRY_EXCEEDED = "RETRY_EXCEEDED";
    public static final String ABORTED = "ABORTED";
    public static final String TIMEOUT_EXCEEDED = "TIMEOUT_EXCEEDED";
    public static final String CIRCUIT_OPEN = "CIRCUIT_OPEN";
    public static final String CONCURRENCY_DROP = "CONCURRENCY_DROP";
    public static final String CONCURRENCY_TIMEOUT = "CONCURRENCY_TIMEOUT";

    public static final String STATE_CAPACITY_EXCEEDED = "STATE_CAPACITY_EXCEEDED";

    public static final String AGENT_CONFLICT = "AGENT_CONFLICT";
    public static final String AGENT_NOT_FOUND = "AGENT_NOT_FOUND";

    // 네트워크 계열 (외부 호출 어댑터가 사용)
    public static final String ECONNRESET = "ECONNRESET";
    public static final String ETIMEDOUT = "ETIMEDOUT";
    public static final String ECONNREFUSED = "ECONNREFUSED";
    public static final String NETWORK_ERROR = "NETWORK_ERROR";

    // Utility class - prevent instantiation
    private ErrorCodes() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
