package com.ryuqq.flow.adapter.runner;

import com.ryuqq.flow.core.spi.ObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;
import java.util.function.Supplier;

/**
 * SLF4J 기반 관측성 수집기.
 *
 * <p>스팬 동안 MDC에 {@code spanName}과 (있으면) {@code correlationId}를 넣고
 * 종료 시 이전 값으로 복원합니다. 본문의 반환값과 예외는 그대로 전달합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Slf4jObservabilitySink implements ObservabilitySink {

    private static final Logger log = LoggerFactory.getLogger(Slf4jObservabilitySink.class);

    static final String MDC_SPAN = "spanName";
    static final String MDC_CORRELATION = "correlationId";

    @Override
    public void log(Level level, String message, Map<String, Object> context) {
        Map<String, Object> safeContext = context == null ? Map.of() : context;
        switch (level) {
            case DEBUG -> log.debug("{} {}", message, safeContext);
            case INFO -> log.info("{} {}", message, safeContext);
            case WARN -> log.warn("{} {}", message, safeContext);
            case ERROR -> log.error("{} {}", message, safeContext);
        }
    }

    @Override
    public <T> T trace(String name, Map<String, Object> attributes, Supplier<T> body) {
        String previousSpan = MDC.get(MDC_SPAN);
        String previousCorrelation = MDC.get(MDC_CORRELATION);
        Object correlationId = attributes == null ? null : attributes.get(MDC_CORRELATION);

        MDC.put(MDC_SPAN, name);
        if (correlationId != null) {
            MDC.put(MDC_CORRELATION, correlationId.toString());
        }
        long startedAt = System.nanoTime();
        boolean failed = true;
        try {
            T result = body.get();
            failed = false;
            return result;
        } finally {
            long elapsedMicros = (System.nanoTime() - startedAt) / 1000;
            log.debug("span {} finished in {}us (failed={}) {}", name, elapsedMicros, failed,
                attributes == null ? Map.of() : attributes);
            restore(MDC_SPAN, previousSpan);
            restore(MDC_CORRELATION, previousCorrelation);
        }
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }
}
