package com.ryuqq.flow.adapter.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 예약/주기 작업 실행기.
 *
 * <p>{@link ScheduledExecutorService}를 감싸 {@link CancellableTask} 핸들을 반환합니다.
 * 작업에서 발생한 예외는 로깅 후 무시되므로 주기 작업이 조용히 중단되지 않습니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>단발 작업 예약 (에이전트 schedule 타이머)</li>
 *   <li>주기 작업 예약 (핸들러 정리, GC)</li>
 *   <li>소유 컴포넌트 종료 시 스레드 정리</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    private final ScheduledExecutorService executor;

    /**
     * 생성자.
     *
     * @param threadNamePrefix 스레드 이름 접두사
     * @param poolSize 스레드 수 (양수)
     */
    public TaskScheduler(String threadNamePrefix, int poolSize) {
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be positive (current: " + poolSize + ")");
        }
        AtomicInteger sequence = new AtomicInteger();
        this.executor = Executors.newScheduledThreadPool(poolSize, runnable -> {
            Thread thread = new Thread(runnable, threadNamePrefix + "-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 단발 작업 예약.
     *
     * @param name 로깅용 이름
     * @param task 작업
     * @param delayMs 지연 (0 이하이면 즉시)
     * @return 취소 핸들
     */
    public CancellableTask schedule(String name, Runnable task, long delayMs) {
        return new CancellableTask(name,
            executor.schedule(guard(name, task), Math.max(0, delayMs), TimeUnit.MILLISECONDS));
    }

    /**
     * 고정 지연 주기 작업 예약.
     *
     * @param name 로깅용 이름
     * @param task 작업
     * @param periodMs 주기 (양수)
     * @return 취소 핸들
     */
    public CancellableTask scheduleWithFixedDelay(String name, Runnable task, long periodMs) {
        if (periodMs <= 0) {
            throw new IllegalArgumentException("periodMs must be positive (current: " + periodMs + ")");
        }
        return new CancellableTask(name,
            executor.scheduleWithFixedDelay(guard(name, task), periodMs, periodMs, TimeUnit.MILLISECONDS));
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static Runnable guard(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Scheduled task {} failed", name, e);
            }
        };
    }
}
