package com.ryuqq.flow.core.spi.noop;

import com.ryuqq.flow.core.spi.ObservabilitySink;

import java.util.Map;
import java.util.function.Supplier;

/**
 * NoOp 관측성 수집기.
 *
 * <p>로그를 버리고 스팬 없이 본문만 실행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoOpObservabilitySink implements ObservabilitySink {

    public static final NoOpObservabilitySink INSTANCE = new NoOpObservabilitySink();

    private NoOpObservabilitySink() {
    }

    @Override
    public void log(Level level, String message, Map<String, Object> context) {
        // NoOp
    }

    @Override
    public <T> T trace(String name, Map<String, Object> attributes, Supplier<T> body) {
        return body.get();
    }
}
