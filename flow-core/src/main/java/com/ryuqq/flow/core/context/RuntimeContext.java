package com.ryuqq.flow.core.context;

import com.ryuqq.flow.core.spi.ObservabilitySink;
import com.ryuqq.flow.core.spi.noop.NoOpObservabilitySink;

import java.time.Clock;
import java.util.UUID;

/**
 * 프로세스 시작 시 한 번 생성되어 모든 컴포넌트 생성자로 전달되는 런타임 컨텍스트.
 *
 * <p>전역 싱글톤 대신 이 객체를 명시적으로 주입합니다.</p>
 *
 * @param tenantId 기본 테넌트 ID
 * @param executionId 런타임 인스턴스 ID
 * @param observability 관측성 수집기
 * @param clock 시계 (테스트에서 교체 가능)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RuntimeContext(
    String tenantId,
    String executionId,
    ObservabilitySink observability,
    Clock clock
) {

    public static final String DEFAULT_TENANT = "default";

    public RuntimeContext {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId cannot be null or blank");
        }
        if (executionId == null || executionId.isBlank()) {
            throw new IllegalArgumentException("executionId cannot be null or blank");
        }
        if (observability == null) {
            throw new IllegalArgumentException("observability cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
    }

    /**
     * 기본 테넌트, 시스템 시계, NoOp 관측성으로 생성.
     */
    public static RuntimeContext defaults() {
        return new RuntimeContext(DEFAULT_TENANT, UUID.randomUUID().toString(),
            NoOpObservabilitySink.INSTANCE, Clock.systemUTC());
    }

    public RuntimeContext withObservability(ObservabilitySink observability) {
        return new RuntimeContext(tenantId, executionId, observability, clock);
    }

    public RuntimeContext withClock(Clock clock) {
        return new RuntimeContext(tenantId, executionId, observability, clock);
    }

    public RuntimeContext withTenantId(String tenantId) {
        return new RuntimeContext(tenantId, executionId, observability, clock);
    }

    /**
     * 현재 시각 (epoch millis).
     */
    public long now() {
        return clock.millis();
    }
}
