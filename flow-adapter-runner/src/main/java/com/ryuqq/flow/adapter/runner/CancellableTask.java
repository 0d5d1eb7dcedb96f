package com.ryuqq.flow.adapter.runner;

import java.util.concurrent.ScheduledFuture;

/**
 * 예약 작업 핸들.
 *
 * <p>작업을 만든 컴포넌트가 소유하며, 종료 시 {@link #cancel()}로 결정적으로 정리합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CancellableTask {

    private final String name;
    private final ScheduledFuture<?> future;

    CancellableTask(String name, ScheduledFuture<?> future) {
        this.name = name;
        this.future = future;
    }

    /**
     * 작업 취소. 실행 중인 작업은 인터럽트하지 않습니다.
     *
     * @return 이번 호출로 취소되었으면 true
     */
    public boolean cancel() {
        return future.cancel(false);
    }

    public boolean isCancelled() {
        return future.isCancelled();
    }

    public boolean isDone() {
        return future.isDone();
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "CancellableTask{" + name + (isCancelled() ? ", cancelled" : isDone() ? ", done" : "") + "}";
    }
}
