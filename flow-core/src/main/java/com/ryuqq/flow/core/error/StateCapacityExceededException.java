package com.ryuqq.flow.core.error;

import java.util.Map;

/**
 * State Store 용량 한도 위반.
 *
 * <p>작업은 중단되며 부분 쓰기는 발생하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StateCapacityExceededException extends FlowException {

    private final int limit;

    private StateCapacityExceededException(String message, String namespace, int limit) {
        super(
            ErrorCodes.STATE_CAPACITY_EXCEEDED,
            message,
            null,
            Map.of("namespace", namespace, "limit", limit),
            null
        );
        this.limit = limit;
    }

    public static StateCapacityExceededException namespaces(String namespace, int limit) {
        return new StateCapacityExceededException(
            "Maximum namespaces limit reached: " + limit, namespace, limit
        );
    }

    public static StateCapacityExceededException keys(String namespace, int limit) {
        return new StateCapacityExceededException(
            "Maximum keys per namespace limit reached: " + limit, namespace, limit
        );
    }

    public int getLimit() {
        return limit;
    }
}
