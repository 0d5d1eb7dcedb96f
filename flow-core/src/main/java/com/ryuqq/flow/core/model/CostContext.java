package com.ryuqq.flow.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 이벤트에 동반되는 비용 추적 컨텍스트.
 *
 * <p>이벤트 자체는 불변이지만 이 객체의 카운터는 처리 도중 증가합니다.
 * 다운스트림 소비자는 재시도 오버헤드를 다시 계산하지 않고 여기서 읽습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CostContext {

    private final AtomicInteger retries = new AtomicInteger();
    private final AtomicLong tokens = new AtomicLong();

    /**
     * 재시도 카운터 증가.
     *
     * @return 증가 후 값
     */
    public int incrementRetries() {
        return retries.incrementAndGet();
    }

    public int getRetries() {
        return retries.get();
    }

    /**
     * 사용 토큰 누적.
     *
     * @param count 추가할 토큰 수 (음수 불가)
     * @return 누적 후 값
     * @throws IllegalArgumentException count가 음수인 경우
     */
    public long addTokens(long count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative (current: " + count + ")");
        }
        return tokens.addAndGet(count);
    }

    public long getTokens() {
        return tokens.get();
    }

    @Override
    public String toString() {
        return "CostContext{retries=" + retries.get() + ", tokens=" + tokens.get() + "}";
    }
}
