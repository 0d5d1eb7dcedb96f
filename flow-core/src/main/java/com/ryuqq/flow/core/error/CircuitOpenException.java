package com.ryuqq.flow.core.error;

import java.util.Map;

/**
 * 회로가 열려 호출이 거부됨.
 *
 * <p>Circuit Breaker 자체는 예외를 던지지 않으며, 미들웨어가 거부 결과를
 * 호출자에게 전달할 때만 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CircuitOpenException extends FlowException {

    private final String circuitName;

    public CircuitOpenException(String circuitName) {
        super(
            ErrorCodes.CIRCUIT_OPEN,
            "Circuit is OPEN, call rejected (circuit: " + circuitName + ")",
            503,
            Map.of("circuit", circuitName),
            null
        );
        this.circuitName = circuitName;
    }

    public String getCircuitName() {
        return circuitName;
    }
}
