package com.ryuqq.flow.adapter.runner.event;

import com.ryuqq.flow.core.handler.EventHandler;

import java.util.regex.Pattern;

/**
 * 등록된 핸들러 항목.
 *
 * <p>handler는 등록 시점에 handler 미들웨어가 이미 적용된 상태입니다.
 * {@code lastUsedAt}이 0이면 한 번도 호출되지 않은 핸들러입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class RegisteredHandler {

    enum Kind {
        EXACT, WILDCARD, PATTERN
    }

    private final String id;
    private final Kind kind;
    private final String eventType;
    private final Pattern pattern;
    private final EventHandler handler;
    private final long registeredAt;
    private volatile boolean active = true;
    private volatile long lastUsedAt;

    private RegisteredHandler(String id, Kind kind, String eventType, Pattern pattern,
                              EventHandler handler, long registeredAt) {
        this.id = id;
        this.kind = kind;
        this.eventType = eventType;
        this.pattern = pattern;
        this.handler = handler;
        this.registeredAt = registeredAt;
    }

    static RegisteredHandler exact(String id, String eventType, EventHandler handler, long now) {
        return new RegisteredHandler(id, Kind.EXACT, eventType, null, handler, now);
    }

    static RegisteredHandler wildcard(String id, EventHandler handler, long now) {
        return new RegisteredHandler(id, Kind.WILDCARD, null, null, handler, now);
    }

    static RegisteredHandler pattern(String id, Pattern pattern, EventHandler handler, long now) {
        return new RegisteredHandler(id, Kind.PATTERN, null, pattern, handler, now);
    }

    boolean matches(String type) {
        return switch (kind) {
            case EXACT -> eventType.equals(type);
            case WILDCARD -> true;
            case PATTERN -> pattern.matcher(type).find();
        };
    }

    void markUsed(long now) {
        lastUsedAt = now;
    }

    void deactivate() {
        active = false;
    }

    /**
     * 정리 대상 여부.
     *
     * <p>비활성 핸들러, 또는 사용된 적이 있고 마지막 사용 후 threshold가 지난 핸들러.</p>
     */
    boolean isStale(long now, long thresholdMs) {
        if (!active) {
            return true;
        }
        long used = lastUsedAt;
        return used > 0 && now - used > thresholdMs;
    }

    String id() {
        return id;
    }

    Kind kind() {
        return kind;
    }

    String eventType() {
        return eventType;
    }

    EventHandler handler() {
        return handler;
    }

    boolean isActive() {
        return active;
    }

    long lastUsedAt() {
        return lastUsedAt;
    }

    long registeredAt() {
        return registeredAt;
    }
}
