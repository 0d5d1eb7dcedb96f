package com.ryuqq.flow.adapter.runner.event;

import com.ryuqq.flow.application.dispatcher.EventRecord;
import com.ryuqq.flow.core.model.Event;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 최근 이벤트 이력 (고정 용량 순환 버퍼).
 *
 * <p>조회/디버깅 전용이며 디스패치에 영향을 주지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class EventHistoryBuffer {

    private final EventRecord[] buffer;
    private int next;
    private int size;

    EventHistoryBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        this.buffer = new EventRecord[capacity];
    }

    synchronized void record(Event event) {
        buffer[next] = new EventRecord(event.id(), event.type(), event.timestamp(), event.correlationId());
        next = (next + 1) % buffer.length;
        if (size < buffer.length) {
            size++;
        }
    }

    /**
     * 최신순 조회.
     *
     * @param limit 최대 개수 (0 이하이면 빈 목록)
     */
    synchronized List<EventRecord> recent(int limit) {
        int count = Math.min(Math.max(limit, 0), size);
        List<EventRecord> records = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            records.add(buffer[(next - i + buffer.length) % buffer.length]);
        }
        return records;
    }

    synchronized int size() {
        return size;
    }

    int capacity() {
        return buffer.length;
    }

    synchronized void clear() {
        Arrays.fill(buffer, null);
        next = 0;
        size = 0;
    }
}
