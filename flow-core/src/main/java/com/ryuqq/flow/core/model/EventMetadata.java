package com.ryuqq.flow.core.model;

import java.util.Map;

/**
 * 이벤트 메타데이터.
 *
 * <p>모든 필드는 선택 사항입니다. {@code cost}는 가변 카운터를 담고 있어
 * 미들웨어(예: 재시도)가 오버헤드를 기록할 수 있습니다.</p>
 *
 * @param correlationId 상관관계 ID (null 허용)
 * @param traceId 트레이스 ID (null 허용)
 * @param tenantId 테넌트 ID (null 허용)
 * @param cost 비용 추적 컨텍스트 (null 허용)
 * @param attributes 추가 속성 (null이면 빈 맵)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record EventMetadata(
    String correlationId,
    String traceId,
    String tenantId,
    CostContext cost,
    Map<String, Object> attributes
) {

    private static final EventMetadata EMPTY = new EventMetadata(null, null, null, null, Map.of());

    public EventMetadata {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static EventMetadata empty() {
        return EMPTY;
    }

    public static EventMetadata withCorrelation(String correlationId) {
        return new EventMetadata(correlationId, null, null, null, Map.of());
    }

    public EventMetadata withCorrelationId(String correlationId) {
        return new EventMetadata(correlationId, traceId, tenantId, cost, attributes);
    }

    public EventMetadata withTenantId(String tenantId) {
        return new EventMetadata(correlationId, traceId, tenantId, cost, attributes);
    }

    public EventMetadata withCost(CostContext cost) {
        return new EventMetadata(correlationId, traceId, tenantId, cost, attributes);
    }
}
