package com.ryuqq.flow.adapter.runner.event;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 핸들러 인덱스.
 *
 * <p><strong>자료구조:</strong></p>
 * <ul>
 *   <li>exact: 이벤트 타입별 등록 순서 목록</li>
 *   <li>wildcard: 모든 타입에 매칭</li>
 *   <li>pattern: 정규식 부분 매칭 ({@code find}, 전체 매칭은 {@code ^...$})</li>
 *   <li>byId: unregister 조회용</li>
 * </ul>
 *
 * <p>목록은 {@link CopyOnWriteArrayList}라서 디스패치 중 등록/해제가 일어나도
 * 진행 중인 순회에는 영향이 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class HandlerRegistry {

    private final Map<String, List<RegisteredHandler>> exact = new ConcurrentHashMap<>();
    private final List<RegisteredHandler> wildcard = new CopyOnWriteArrayList<>();
    private final List<RegisteredHandler> patterns = new CopyOnWriteArrayList<>();
    private final Map<String, RegisteredHandler> byId = new ConcurrentHashMap<>();

    void add(RegisteredHandler handler) {
        switch (handler.kind()) {
            case EXACT -> exact.compute(handler.eventType(), (type, handlers) -> {
                List<RegisteredHandler> list = handlers == null ? new CopyOnWriteArrayList<>() : handlers;
                list.add(handler);
                return list;
            });
            case WILDCARD -> wildcard.add(handler);
            case PATTERN -> patterns.add(handler);
        }
        byId.put(handler.id(), handler);
    }

    /**
     * 매칭되는 활성 핸들러 (exact, wildcard, pattern 순).
     */
    List<RegisteredHandler> resolve(String type) {
        List<RegisteredHandler> resolved = new ArrayList<>();
        List<RegisteredHandler> forType = exact.get(type);
        if (forType != null) {
            forType.stream().filter(RegisteredHandler::isActive).forEach(resolved::add);
        }
        wildcard.stream().filter(RegisteredHandler::isActive).forEach(resolved::add);
        patterns.stream().filter(h -> h.isActive() && h.matches(type)).forEach(resolved::add);
        return resolved;
    }

    /**
     * 비활성 표시. 실제 제거는 정리 작업에서 수행됩니다.
     */
    boolean deactivate(String handlerId) {
        RegisteredHandler handler = byId.get(handlerId);
        if (handler == null || !handler.isActive()) {
            return false;
        }
        handler.deactivate();
        return true;
    }

    /**
     * 비활성 또는 오래된 핸들러를 모든 인덱스에서 제거.
     *
     * @return 제거된 핸들러 수
     */
    int removeStale(long now, long thresholdMs) {
        List<RegisteredHandler> stale = byId.values().stream()
            .filter(h -> h.isStale(now, thresholdMs))
            .toList();
        for (RegisteredHandler handler : stale) {
            remove(handler);
        }
        return stale.size();
    }

    void clear() {
        exact.clear();
        wildcard.clear();
        patterns.clear();
        byId.clear();
    }

    Map<String, Integer> countsByType() {
        Map<String, Integer> counts = new TreeMap<>();
        exact.forEach((type, handlers) -> {
            if (!handlers.isEmpty()) {
                counts.put(type, handlers.size());
            }
        });
        return counts;
    }

    int wildcardCount() {
        return wildcard.size();
    }

    int patternCount() {
        return patterns.size();
    }

    int size() {
        return byId.size();
    }

    private void remove(RegisteredHandler handler) {
        switch (handler.kind()) {
            case EXACT -> exact.computeIfPresent(handler.eventType(), (type, handlers) -> {
                handlers.remove(handler);
                return handlers.isEmpty() ? null : handlers;
            });
            case WILDCARD -> wildcard.remove(handler);
            case PATTERN -> patterns.remove(handler);
        }
        byId.remove(handler.id(), handler);
    }
}
