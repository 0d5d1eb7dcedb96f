package com.ryuqq.flow.adapter.runner.lifecycle;

import com.ryuqq.flow.adapter.runner.TaskScheduler;
import com.ryuqq.flow.application.lifecycle.AgentInfo;
import com.ryuqq.flow.application.lifecycle.AgentKey;
import com.ryuqq.flow.application.lifecycle.AgentLifecycle;
import com.ryuqq.flow.application.lifecycle.AgentStatusChanged;
import com.ryuqq.flow.application.lifecycle.AgentStatusListener;
import com.ryuqq.flow.application.lifecycle.LifecycleOperation;
import com.ryuqq.flow.application.lifecycle.LifecycleResult;
import com.ryuqq.flow.application.lifecycle.LifecycleStats;
import com.ryuqq.flow.application.lifecycle.PauseAgentCommand;
import com.ryuqq.flow.application.lifecycle.ResumeAgentCommand;
import com.ryuqq.flow.application.lifecycle.ScheduleAgentCommand;
import com.ryuqq.flow.application.lifecycle.ScheduleConfig;
import com.ryuqq.flow.application.lifecycle.StartAgentCommand;
import com.ryuqq.flow.application.lifecycle.StopAgentCommand;
import com.ryuqq.flow.core.context.RuntimeContext;
import com.ryuqq.flow.core.error.AgentNotFoundException;
import com.ryuqq.flow.core.error.LifecycleConflictException;
import com.ryuqq.flow.core.spi.Snapshot;
import com.ryuqq.flow.core.spi.SnapshotPersistor;
import com.ryuqq.flow.core.statemachine.AgentStatus;
import com.ryuqq.flow.core.statemachine.StatusTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 인메모리 에이전트 생명주기 관리자.
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>start/stop/pause/resume/schedule 명령을 {@link StatusTransition} 규칙에 따라 수행</li>
 *   <li>pause 시 {@link SnapshotPersistor}로 컨텍스트 저장, resume 시 복원 후 병합</li>
 *   <li>예약 실행을 {@link TaskScheduler} 타이머로 관리 (repeat이면 재예약)</li>
 *   <li>전이마다 {@link AgentStatusListener} 통지</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 레지스트리 변경은 이 인스턴스의 모니터 안에서 수행되고,
 * 리스너 통지는 모니터 밖에서 수행됩니다. 리스너 예외는 로깅만 하며 전이를 되돌리지 않습니다.</p>
 *
 * <p><strong>오류 처리:</strong> 전이 중간 상태(STARTING, PAUSING, RESUMING, STOPPING)에서
 * 실패하면 에이전트는 ERROR로 전이되고 원래 예외가 다시 던져집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AgentLifecycleManager implements AgentLifecycle {

    private static final Logger log = LoggerFactory.getLogger(AgentLifecycleManager.class);

    /**
     * cron 표현식은 해석하지 않고 항상 이 간격 뒤로 예약합니다.
     */
    static final long CRON_PLACEHOLDER_DELAY_MS = 60_000;

    private final RuntimeContext context;
    private final SnapshotPersistor snapshots;
    private final TaskScheduler scheduler;
    private final boolean ownsScheduler;
    private final long createdAt;

    private final Map<AgentKey, AgentRegistryEntry> entries = new ConcurrentHashMap<>();
    private final List<AgentStatusListener> listeners = new CopyOnWriteArrayList<>();

    private long totalTransitions;
    private long totalErrors;

    /**
     * 생성자 (전용 스케줄러 생성, dispose 시 함께 종료).
     *
     * @param context 런타임 컨텍스트
     * @param snapshots 스냅샷 저장소
     */
    public AgentLifecycleManager(RuntimeContext context, SnapshotPersistor snapshots) {
        this(context, snapshots, new TaskScheduler("agent-lifecycle", 1), true);
    }

    /**
     * 생성자 (외부 스케줄러 주입, 종료는 호출자 책임).
     *
     * @param context 런타임 컨텍스트
     * @param snapshots 스냅샷 저장소
     * @param scheduler 예약 실행기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public AgentLifecycleManager(RuntimeContext context, SnapshotPersistor snapshots, TaskScheduler scheduler) {
        this(context, snapshots, scheduler, false);
    }

    private AgentLifecycleManager(RuntimeContext context, SnapshotPersistor snapshots,
                                  TaskScheduler scheduler, boolean ownsScheduler) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (snapshots == null) {
            throw new IllegalArgumentException("snapshots cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.context = context;
        this.snapshots = snapshots;
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
        this.createdAt = context.now();
    }

    // ===== 명령 =====

    @Override
    public LifecycleResult start(StartAgentCommand command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        List<AgentStatusChanged> changes = new ArrayList<>();
        try {
            synchronized (this) {
                return doStart(command.key(), command.context(), false, changes);
            }
        } finally {
            notifyListeners(changes);
        }
    }

    @Override
    public LifecycleResult stop(StopAgentCommand command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        AgentKey key = command.key();
        List<AgentStatusChanged> changes = new ArrayList<>();
        try {
            synchronized (this) {
                AgentRegistryEntry entry = entries.get(key);
                if (entry == null || entry.status() == AgentStatus.STOPPED) {
                    log.debug("Agent {} is already stopped", key);
                    return result(key, LifecycleOperation.STOP, AgentStatus.STOPPED, AgentStatus.STOPPED,
                        null, null, LifecycleResult.ALREADY_STOPPED);
                }

                AgentStatus previous = entry.status();
                String reason = command.reason();
                transition(entry, AgentStatus.STOPPING, reason, changes);
                String executionId = entry.executionId();
                try {
                    entry.cancelTimer();
                    entry.executionId(null);
                    transition(entry, AgentStatus.STOPPED, reason, changes);
                } catch (RuntimeException e) {
                    fail(entry, e, changes);
                    throw e;
                }
                entries.remove(key, entry);
                log.info("Agent {} stopped (execution {}, reason: {})", key, executionId, reason);
                return result(key, LifecycleOperation.STOP, previous, AgentStatus.STOPPED,
                    null, entry.snapshotId(), reason);
            }
        } finally {
            notifyListeners(changes);
        }
    }

    @Override
    public LifecycleResult pause(PauseAgentCommand command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        AgentKey key = command.key();
        List<AgentStatusChanged> changes = new ArrayList<>();
        try {
            synchronized (this) {
                AgentRegistryEntry entry = requireEntry(key);
                AgentStatus previous = entry.status();
                transition(entry, AgentStatus.PAUSING, command.reason(), changes);
                try {
                    if (command.saveSnapshot()) {
                        long now = context.now();
                        String snapshotId = "snapshot-" + entry.executionId() + "-" + now;
                        snapshots.save(new Snapshot(snapshotId, key.toString(), entry.executionId(),
                            entry.context(), now));
                        entry.snapshotId(snapshotId);
                        log.debug("Snapshot {} saved for agent {}", snapshotId, key);
                    }
                    entry.pausedAt(context.now());
                    transition(entry, AgentStatus.PAUSED, command.reason(), changes);
                } catch (RuntimeException e) {
                    fail(entry, e, changes);
                    throw e;
                }
                log.info("Agent {} paused (snapshot: {})", key, entry.snapshotId());
                return result(key, LifecycleOperation.PAUSE, previous, AgentStatus.PAUSED,
                    entry.executionId(), entry.snapshotId(), command.reason());
            }
        } finally {
            notifyListeners(changes);
        }
    }

    @Override
    public LifecycleResult resume(ResumeAgentCommand command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        AgentKey key = command.key();
        List<AgentStatusChanged> changes = new ArrayList<>();
        try {
            synchronized (this) {
                AgentRegistryEntry entry = requireEntry(key);
                AgentStatus previous = entry.status();
                transition(entry, AgentStatus.RESUMING, null, changes);
                String snapshotId = command.snapshotId() != null ? command.snapshotId() : entry.snapshotId();
                try {
                    if (snapshotId != null) {
                        Optional<Snapshot> snapshot = snapshots.load(snapshotId);
                        if (snapshot.isPresent()) {
                            entry.context().putAll(snapshot.get().state());
                            log.debug("Agent {} restored from snapshot {}", key, snapshotId);
                        } else {
                            log.warn("Snapshot {} not found for agent {}, resuming with current context",
                                snapshotId, key);
                        }
                    }
                    entry.context().putAll(command.context());
                    entry.snapshotId(snapshotId);
                    entry.pausedAt(null);
                    transition(entry, AgentStatus.RUNNING, null, changes);
                } catch (RuntimeException e) {
                    fail(entry, e, changes);
                    throw e;
                }
                log.info("Agent {} resumed (execution {})", key, entry.executionId());
                return result(key, LifecycleOperation.RESUME, previous, AgentStatus.RUNNING,
                    entry.executionId(), snapshotId, null);
            }
        } finally {
            notifyListeners(changes);
        }
    }

    @Override
    public LifecycleResult schedule(ScheduleAgentCommand command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        AgentKey key = command.key();
        List<AgentStatusChanged> changes = new ArrayList<>();
        try {
            synchronized (this) {
                AgentRegistryEntry entry = entries.get(key);
                boolean created = entry == null;
                if (created) {
                    entry = new AgentRegistryEntry(key, context.now());
                }
                AgentStatus previous = entry.status();
                StatusTransition.validate(previous, AgentStatus.SCHEDULED);

                ScheduleConfig schedule = command.schedule();
                entry.schedule(schedule);
                entry.replaceContext(command.context());
                entry.lastError(null);
                if (created) {
                    entries.put(key, entry);
                }
                transition(entry, AgentStatus.SCHEDULED, null, changes);
                arm(entry, firstRunAt(schedule));

                log.info("Agent {} scheduled (next run at {}, repeat: {})", key, entry.nextRunAt(), schedule.repeat());
                return result(key, LifecycleOperation.SCHEDULE, previous, AgentStatus.SCHEDULED,
                    null, entry.snapshotId(), null);
            }
        } finally {
            notifyListeners(changes);
        }
    }

    // ===== 조회 =====

    @Override
    public Optional<AgentInfo> getAgentStatus(String agentName, String tenantId) {
        AgentKey key = new AgentKey(tenantId, agentName);
        synchronized (this) {
            AgentRegistryEntry entry = entries.get(key);
            return entry == null ? Optional.empty() : Optional.of(entry.toInfo());
        }
    }

    @Override
    public synchronized List<AgentInfo> listAgentsByTenant(String tenantId) {
        return entries.values().stream()
            .filter(entry -> entry.key().tenantId().equals(tenantId))
            .map(AgentRegistryEntry::toInfo)
            .sorted(Comparator.comparing(info -> info.key().agentName()))
            .toList();
    }

    @Override
    public synchronized List<AgentInfo> listAgentsByStatus(AgentStatus status) {
        return entries.values().stream()
            .filter(entry -> entry.status() == status)
            .map(AgentRegistryEntry::toInfo)
            .sorted(Comparator.comparing(info -> info.key().toString()))
            .toList();
    }

    @Override
    public synchronized LifecycleStats getStats() {
        Map<AgentStatus, Integer> byStatus = new EnumMap<>(AgentStatus.class);
        Map<String, Integer> byTenant = new TreeMap<>();
        for (AgentRegistryEntry entry : entries.values()) {
            byStatus.merge(entry.status(), 1, Integer::sum);
            byTenant.merge(entry.key().tenantId(), 1, Integer::sum);
        }
        return new LifecycleStats(entries.size(), byStatus, byTenant, totalTransitions, totalErrors,
            context.now() - createdAt);
    }

    @Override
    public Runnable addStatusListener(AgentStatusListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * 실행 중/일시정지/예약 상태의 에이전트를 최선 노력으로 정지한 뒤 레지스트리를 비웁니다.
     */
    @Override
    public void dispose() {
        List<AgentKey> active;
        synchronized (this) {
            active = entries.values().stream()
                .filter(entry -> entry.status() == AgentStatus.RUNNING
                    || entry.status() == AgentStatus.PAUSED
                    || entry.status() == AgentStatus.SCHEDULED)
                .map(AgentRegistryEntry::key)
                .toList();
        }
        for (AgentKey key : active) {
            try {
                stop(new StopAgentCommand(key, "disposed"));
            } catch (RuntimeException e) {
                log.warn("Failed to stop agent {} during dispose: {}", key, e.getMessage(), e);
            }
        }
        synchronized (this) {
            entries.values().forEach(AgentRegistryEntry::cancelTimer);
            entries.clear();
        }
        listeners.clear();
        if (ownsScheduler) {
            scheduler.close();
        }
        log.info("Agent lifecycle disposed ({} agents stopped)", active.size());
    }

    // ===== 내부 =====

    /**
     * 모니터를 잡은 상태에서 호출.
     */
    private LifecycleResult doStart(AgentKey key, Map<String, Object> startContext, boolean fromTimer,
                                    List<AgentStatusChanged> changes) {
        AgentRegistryEntry entry = entries.get(key);
        if (entry != null && entry.status().blocksStart()) {
            throw new LifecycleConflictException(key.toString(), entry.status().value());
        }
        AgentStatus previous = entry == null ? AgentStatus.STOPPED : entry.status();
        if (entry != null && !StatusTransition.isAllowed(entry.status(), AgentStatus.STARTING)) {
            // PAUSED, STOPPING 등은 새 항목으로 덮어씀
            ScheduleConfig carried = fromTimer ? entry.schedule() : null;
            entry.cancelTimer();
            entry = new AgentRegistryEntry(key, context.now());
            entry.schedule(carried);
            entries.put(key, entry);
            log.debug("Agent {} was {}, replaced with a fresh entry", key, previous);
        }
        if (entry == null) {
            entry = new AgentRegistryEntry(key, context.now());
            entries.put(key, entry);
        }
        if (!fromTimer) {
            entry.cancelTimer();
            entry.schedule(null);
        }

        transition(entry, AgentStatus.STARTING, null, changes);
        try {
            long now = context.now();
            entry.replaceContext(startContext);
            entry.executionId("lifecycle-" + key.agentName() + "-" + now);
            entry.startedAt(now);
            entry.pausedAt(null);
            entry.snapshotId(null);
            entry.lastError(null);
            transition(entry, AgentStatus.RUNNING, null, changes);
        } catch (RuntimeException e) {
            fail(entry, e, changes);
            throw e;
        }
        log.info("Agent {} started (execution {})", key, entry.executionId());
        return result(key, LifecycleOperation.START, previous, AgentStatus.RUNNING, entry.executionId(), null, null);
    }

    private void fire(AgentKey key) {
        List<AgentStatusChanged> changes = new ArrayList<>();
        try {
            synchronized (this) {
                AgentRegistryEntry entry = entries.get(key);
                if (entry == null || entry.schedule() == null) {
                    log.debug("Scheduled start of {} skipped, agent no longer scheduled", key);
                    return;
                }
                ScheduleConfig schedule = entry.schedule();
                try {
                    doStart(key, Map.copyOf(entry.context()), true, changes);
                } catch (LifecycleConflictException e) {
                    log.warn("Scheduled start of {} skipped: {}", key, e.getMessage());
                } catch (RuntimeException e) {
                    log.error("Scheduled start of {} failed: {}", key, e.getMessage(), e);
                }
                AgentRegistryEntry current = entries.get(key);
                if (current == null) {
                    return;
                }
                if (schedule.repeat()) {
                    current.schedule(schedule);
                    arm(current, nextRunAt(schedule));
                } else {
                    current.cancelTimer();
                }
            }
        } finally {
            notifyListeners(changes);
        }
    }

    private void arm(AgentRegistryEntry entry, long runAt) {
        AgentKey key = entry.key();
        long delay = Math.max(0, runAt - context.now());
        entry.timer(scheduler.schedule("agent-schedule-" + key, () -> fire(key), delay));
        entry.nextRunAt(runAt);
    }

    private long firstRunAt(ScheduleConfig schedule) {
        if (schedule.isCron()) {
            log.warn("Cron expression '{}' is not evaluated, running in {}ms",
                schedule.cronExpression(), CRON_PLACEHOLDER_DELAY_MS);
            return context.now() + CRON_PLACEHOLDER_DELAY_MS;
        }
        return schedule.executeAt();
    }

    private long nextRunAt(ScheduleConfig schedule) {
        if (schedule.isCron()) {
            return context.now() + CRON_PLACEHOLDER_DELAY_MS;
        }
        return context.now() + schedule.repeatIntervalMs();
    }

    private AgentRegistryEntry requireEntry(AgentKey key) {
        AgentRegistryEntry entry = entries.get(key);
        if (entry == null) {
            throw new AgentNotFoundException(key.toString());
        }
        return entry;
    }

    private void transition(AgentRegistryEntry entry, AgentStatus next, String reason,
                            List<AgentStatusChanged> changes) {
        AgentStatus previous = entry.status();
        StatusTransition.validate(previous, next);
        long now = context.now();
        entry.status(next, now);
        totalTransitions++;
        changes.add(new AgentStatusChanged(entry.key(), previous, next, reason, now));
        log.debug("Agent {} status changed: {} → {}", entry.key(), previous, next);
    }

    private void fail(AgentRegistryEntry entry, RuntimeException error, List<AgentStatusChanged> changes) {
        totalErrors++;
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        entry.lastError(message);
        log.error("Agent {} failed while {}: {}", entry.key(), entry.status(), message, error);
        if (StatusTransition.isAllowed(entry.status(), AgentStatus.ERROR)) {
            transition(entry, AgentStatus.ERROR, message, changes);
        }
    }

    private void notifyListeners(List<AgentStatusChanged> changes) {
        for (AgentStatusChanged change : changes) {
            for (AgentStatusListener listener : listeners) {
                try {
                    listener.onStatusChanged(change);
                } catch (RuntimeException e) {
                    log.warn("Agent status listener failed for {}: {}", change.key(), e.getMessage(), e);
                }
            }
        }
    }

    private LifecycleResult result(AgentKey key, LifecycleOperation operation, AgentStatus previous,
                                   AgentStatus status, String executionId, String snapshotId, String reason) {
        return new LifecycleResult(true, key, operation, previous, status, executionId, snapshotId, reason,
            context.now());
    }
}
