package com.ryuqq.flow.core.error;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 이벤트 체인 한도 위반.
 *
 * <p>재귀 깊이 초과, 체인 길이 초과, 루프 감지 세 가지 경우에 발생하며
 * 해당 이벤트의 처리 분기를 중단시킵니다. 내부적으로 재시도하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class EventChainException extends FlowException {

    private final String eventType;
    private final int depth;
    private final List<String> chain;

    public EventChainException(String code, String message, String eventType, int depth, List<String> chain) {
        super(code, message, null, context(eventType, depth, chain), null);
        this.eventType = eventType;
        this.depth = depth;
        this.chain = List.copyOf(chain);
    }

    public static EventChainException maxDepth(String eventType, int depth, int maxDepth, List<String> chain) {
        return new EventChainException(
            ErrorCodes.MAX_DEPTH_EXCEEDED,
            "Maximum event depth exceeded: " + depth + " >= " + maxDepth + " (type: " + eventType + ")",
            eventType, depth, chain
        );
    }

    public static EventChainException maxChainLength(String eventType, int depth, int maxLength, List<String> chain) {
        return new EventChainException(
            ErrorCodes.MAX_CHAIN_LENGTH_EXCEEDED,
            "Maximum event chain length exceeded: " + chain.size() + " >= " + maxLength + " (type: " + eventType + ")",
            eventType, depth, chain
        );
    }

    public static EventChainException loop(String eventType, int depth, List<String> chain) {
        return new EventChainException(
            ErrorCodes.EVENT_LOOP_DETECTED,
            "Event loop detected: " + String.join(" -> ", chain) + " -> " + eventType,
            eventType, depth, chain
        );
    }

    public String getEventType() {
        return eventType;
    }

    public int getDepth() {
        return depth;
    }

    /**
     * 예외 발생 시점의 체인 (대상 이벤트 타입은 포함하지 않음).
     */
    public List<String> getChain() {
        return chain;
    }

    private static Map<String, Object> context(String eventType, int depth, List<String> chain) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("eventType", eventType);
        context.put("depth", depth);
        context.put("chain", List.copyOf(chain));
        return context;
    }
}
