package com.ryuqq.flow.adapter.runner.lifecycle;

import com.ryuqq.flow.adapter.runner.CancellableTask;
import com.ryuqq.flow.application.lifecycle.AgentInfo;
import com.ryuqq.flow.application.lifecycle.AgentKey;
import com.ryuqq.flow.application.lifecycle.ScheduleConfig;
import com.ryuqq.flow.core.statemachine.AgentStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 에이전트 하나의 가변 상태.
 *
 * <p>모든 필드는 {@link AgentLifecycleManager}의 모니터 안에서만 읽고 씁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class AgentRegistryEntry {

    private final AgentKey key;
    private final Map<String, Object> context = new LinkedHashMap<>();
    private AgentStatus status = AgentStatus.STOPPED;
    private String executionId;
    private String snapshotId;
    private ScheduleConfig schedule;
    private CancellableTask timer;
    private Long nextRunAt;
    private Long startedAt;
    private Long pausedAt;
    private long statusChangedAt;
    private String lastError;

    AgentRegistryEntry(AgentKey key, long now) {
        this.key = key;
        this.statusChangedAt = now;
    }

    AgentKey key() {
        return key;
    }

    AgentStatus status() {
        return status;
    }

    void status(AgentStatus status, long now) {
        this.status = status;
        this.statusChangedAt = now;
    }

    String executionId() {
        return executionId;
    }

    void executionId(String executionId) {
        this.executionId = executionId;
    }

    String snapshotId() {
        return snapshotId;
    }

    void snapshotId(String snapshotId) {
        this.snapshotId = snapshotId;
    }

    ScheduleConfig schedule() {
        return schedule;
    }

    void schedule(ScheduleConfig schedule) {
        this.schedule = schedule;
    }

    Long nextRunAt() {
        return nextRunAt;
    }

    void nextRunAt(Long nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    void startedAt(Long startedAt) {
        this.startedAt = startedAt;
    }

    void pausedAt(Long pausedAt) {
        this.pausedAt = pausedAt;
    }

    void lastError(String lastError) {
        this.lastError = lastError;
    }

    Map<String, Object> context() {
        return context;
    }

    void replaceContext(Map<String, Object> values) {
        context.clear();
        context.putAll(values);
    }

    /**
     * 예약 타이머 교체. 기존 타이머는 취소됩니다.
     */
    void timer(CancellableTask timer) {
        cancelTimer();
        this.timer = timer;
    }

    void cancelTimer() {
        if (timer != null) {
            timer.cancel();
            timer = null;
        }
        nextRunAt = null;
    }

    AgentInfo toInfo() {
        return new AgentInfo(key, status, executionId, snapshotId, schedule, nextRunAt,
            startedAt, pausedAt, statusChangedAt, lastError, context);
    }
}
