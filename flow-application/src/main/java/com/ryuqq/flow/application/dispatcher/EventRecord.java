package com.ryuqq.flow.application.dispatcher;

/**
 * 이벤트 이력 항목 (디버깅/조회 전용).
 *
 * @param eventId 이벤트 ID
 * @param type 이벤트 타입
 * @param timestamp 이벤트 시각 (epoch millis)
 * @param correlationId 상관관계 ID (null 허용)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record EventRecord(String eventId, String type, long timestamp, String correlationId) {
}
