package com.ryuqq.flow.adapter.protection.concurrency;

import com.ryuqq.flow.core.model.Event;

import java.util.function.Function;

/**
 * 키 단위 동시 실행 제한 설정.
 *
 * @param maxConcurrent 키당 최대 동시 실행 수 (양수)
 * @param queueTimeoutMs 슬롯 대기 시간 (0이면 대기 없이 즉시 거부)
 * @param keyGenerator 이벤트에서 키 추출 (null이면 이벤트 타입)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ConcurrencyLimitConfig(
    int maxConcurrent,
    long queueTimeoutMs,
    Function<Event, String> keyGenerator
) {

    /**
     * 기본값: maxConcurrent=10, queueTimeoutMs=0, 키는 이벤트 타입.
     */
    public ConcurrencyLimitConfig() {
        this(10, 0, Event::type);
    }

    public ConcurrencyLimitConfig {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be positive (current: " + maxConcurrent + ")");
        }
        if (queueTimeoutMs < 0) {
            throw new IllegalArgumentException("queueTimeoutMs cannot be negative (current: " + queueTimeoutMs + ")");
        }
        if (keyGenerator == null) {
            keyGenerator = Event::type;
        }
    }

    public ConcurrencyLimitConfig withMaxConcurrent(int maxConcurrent) {
        return new ConcurrencyLimitConfig(maxConcurrent, queueTimeoutMs, keyGenerator);
    }

    public ConcurrencyLimitConfig withQueueTimeoutMs(long queueTimeoutMs) {
        return new ConcurrencyLimitConfig(maxConcurrent, queueTimeoutMs, keyGenerator);
    }

    public ConcurrencyLimitConfig withKeyGenerator(Function<Event, String> keyGenerator) {
        return new ConcurrencyLimitConfig(maxConcurrent, queueTimeoutMs, keyGenerator);
    }
}
