package com.ryuqq.flow.core.model;

import java.util.UUID;

/**
 * 런타임을 흐르는 이벤트.
 *
 * <p>이벤트는 디스패치 이후 불변입니다. 핸들러가 후속 이벤트를 만들 경우
 * 새 {@code Event}를 생성하여 {@code HandlerResult.reEmit(...)}로 반환합니다.</p>
 *
 * <p><strong>와이어 형태:</strong></p>
 * <pre>
 * {id: string, type: string, data: any, ts: epoch-ms, metadata?: {correlationId?, traceId?, ...}}
 * </pre>
 *
 * @param id 이벤트 식별자 (null 또는 blank 불가)
 * @param type 이벤트 타입 (null 또는 blank 불가)
 * @param data 페이로드 (null 허용, 런타임은 해석하지 않음)
 * @param timestamp 생성 시각 (epoch millis)
 * @param metadata 메타데이터 (null이면 {@link EventMetadata#empty()})
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Event(
    String id,
    String type,
    Object data,
    long timestamp,
    EventMetadata metadata
) {

    public Event {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (metadata == null) {
            metadata = EventMetadata.empty();
        }
    }

    /**
     * 새 ID와 현재 시각으로 이벤트 생성.
     *
     * @param type 이벤트 타입
     * @param data 페이로드
     * @return 새 Event
     */
    public static Event of(String type, Object data) {
        return of(type, data, EventMetadata.empty());
    }

    /**
     * 새 ID와 현재 시각, 지정 메타데이터로 이벤트 생성.
     *
     * @param type 이벤트 타입
     * @param data 페이로드
     * @param metadata 메타데이터
     * @return 새 Event
     */
    public static Event of(String type, Object data, EventMetadata metadata) {
        return new Event(UUID.randomUUID().toString(), type, data, System.currentTimeMillis(), metadata);
    }

    /**
     * 상관관계 ID 조회 (없으면 null).
     *
     * @return correlationId 또는 null
     */
    public String correlationId() {
        return metadata.correlationId();
    }
}
