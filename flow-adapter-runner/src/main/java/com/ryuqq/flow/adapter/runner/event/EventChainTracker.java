package com.ryuqq.flow.adapter.runner.event;

import java.util.ArrayList;
import java.util.List;

/**
 * 현재 재귀 디스패치 체인의 이벤트 타입을 담는 고정 용량 링 버퍼.
 *
 * <p>단일 처리 분기에서만 사용되며 스레드 안전하지 않습니다.
 * 배치 분기는 {@link #copy()}로 독립된 사본을 받습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class EventChainTracker {

    private final String[] ring;
    private int head;
    private int size;

    EventChainTracker(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        this.ring = new String[capacity];
    }

    /**
     * 타입 추가. 가득 차 있으면 가장 오래된 항목을 덮어씁니다.
     */
    void push(String type) {
        int tail = (head + size) % ring.length;
        ring[tail] = type;
        if (size < ring.length) {
            size++;
        } else {
            head = (head + 1) % ring.length;
        }
    }

    /**
     * 가장 최근 타입 제거.
     */
    void pop() {
        if (size == 0) {
            return;
        }
        int tail = (head + size - 1) % ring.length;
        ring[tail] = null;
        size--;
    }

    boolean contains(String type) {
        for (int i = 0; i < size; i++) {
            if (ring[(head + i) % ring.length].equals(type)) {
                return true;
            }
        }
        return false;
    }

    int size() {
        return size;
    }

    int capacity() {
        return ring.length;
    }

    /**
     * 오래된 순서의 체인 사본.
     */
    List<String> snapshot() {
        List<String> chain = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            chain.add(ring[(head + i) % ring.length]);
        }
        return chain;
    }

    EventChainTracker copy() {
        EventChainTracker copy = new EventChainTracker(ring.length);
        for (String type : snapshot()) {
            copy.push(type);
        }
        return copy;
    }
}
