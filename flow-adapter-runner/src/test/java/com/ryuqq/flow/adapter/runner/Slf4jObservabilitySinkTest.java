package com.ryuqq.flow.adapter.runner;

import com.ryuqq.flow.core.spi.ObservabilitySink.Level;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Slf4jObservabilitySink 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class Slf4jObservabilitySinkTest {

    private final Slf4jObservabilitySink sink = new Slf4jObservabilitySink();

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void 스팬_동안_MDC_설정_후_복원() {
        // given
        MDC.put(Slf4jObservabilitySink.MDC_SPAN, "outer");

        // when
        String seen = sink.trace("event.process", Map.of("correlationId", "corr-1"),
            () -> MDC.get(Slf4jObservabilitySink.MDC_SPAN) + "/" + MDC.get(Slf4jObservabilitySink.MDC_CORRELATION));

        // then
        assertThat(seen).isEqualTo("event.process/corr-1");
        assertThat(MDC.get(Slf4jObservabilitySink.MDC_SPAN)).isEqualTo("outer");
        assertThat(MDC.get(Slf4jObservabilitySink.MDC_CORRELATION)).isNull();
    }

    @Test
    void 본문_예외는_그대로_전파되고_MDC는_복원() {
        IllegalStateException boom = new IllegalStateException("boom");

        assertThatThrownBy(() -> sink.trace("event.process", null, () -> {
            throw boom;
        })).isSameAs(boom);

        assertThat(MDC.get(Slf4jObservabilitySink.MDC_SPAN)).isNull();
    }

    @Test
    void 모든_레벨_로그_기록() {
        assertThatCode(() -> {
            for (Level level : Level.values()) {
                sink.log(level, "agent started", Map.of("agent", "acme:crawler"));
            }
            sink.log(Level.INFO, "no context", null);
        }).doesNotThrowAnyException();
    }
}
