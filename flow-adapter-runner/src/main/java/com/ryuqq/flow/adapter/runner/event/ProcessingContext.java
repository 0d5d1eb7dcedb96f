package com.ryuqq.flow.adapter.runner.event;

import com.ryuqq.flow.core.error.EventChainException;
import com.ryuqq.flow.core.handler.AbortSignal;

/**
 * 최상위 이벤트 하나의 처리 컨텍스트.
 *
 * <p>재귀 깊이와 체인은 미들웨어 진입 전에 {@link #enter}로 갱신되고,
 * 처리 종료 시 {@link #exit()}로 반드시 되돌려집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class ProcessingContext {

    private final EventChainTracker chain;
    private final AbortSignal signal;
    private final String correlationId;
    private final long startedAt;
    private int depth;

    private ProcessingContext(EventChainTracker chain, int depth, AbortSignal signal,
                              String correlationId, long startedAt) {
        this.chain = chain;
        this.depth = depth;
        this.signal = signal;
        this.correlationId = correlationId;
        this.startedAt = startedAt;
    }

    static ProcessingContext root(int maxChainLength, AbortSignal signal, String correlationId, long startedAt) {
        return new ProcessingContext(new EventChainTracker(maxChainLength), 0, signal, correlationId, startedAt);
    }

    /**
     * 한도 확인 후 깊이 증가와 체인 추가.
     *
     * <p>검사는 추가 전에 수행되므로 예외 시 상태가 변하지 않습니다.</p>
     *
     * @throws EventChainException 깊이/길이 초과 또는 같은 타입이 이미 체인에 있는 경우
     */
    void enter(String type, int maxDepth, int maxChainLength) {
        if (depth >= maxDepth) {
            throw EventChainException.maxDepth(type, depth, maxDepth, chain.snapshot());
        }
        if (chain.size() >= maxChainLength) {
            throw EventChainException.maxChainLength(type, depth, maxChainLength, chain.snapshot());
        }
        if (chain.contains(type)) {
            throw EventChainException.loop(type, depth, chain.snapshot());
        }
        depth++;
        chain.push(type);
    }

    void exit() {
        chain.pop();
        depth--;
    }

    /**
     * 배치 분기용 독립 사본.
     */
    ProcessingContext fork() {
        return new ProcessingContext(chain.copy(), depth, signal, correlationId, startedAt);
    }

    int depth() {
        return depth;
    }

    int chainLength() {
        return chain.size();
    }

    AbortSignal signal() {
        return signal;
    }

    String correlationId() {
        return correlationId;
    }

    long startedAt() {
        return startedAt;
    }
}
