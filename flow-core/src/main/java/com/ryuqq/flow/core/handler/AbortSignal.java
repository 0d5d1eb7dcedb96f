package com.ryuqq.flow.core.handler;

import com.ryuqq.flow.core.error.AbortedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 협력적 취소 신호.
 *
 * <p>재시도 대기, 타임아웃 경합, 동시성 슬롯 대기 등 모든 대기 지점은
 * {@link #await(long)}을 통해 이 신호를 관찰하며, 중단 시 즉시
 * {@link AbortedException}을 던집니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * AbortSignal signal = new AbortSignal();
 * processor.processEvent(event, signal);
 *
 * // 다른 스레드에서
 * signal.abort("shutdown");
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AbortSignal {

    private static final Logger log = LoggerFactory.getLogger(AbortSignal.class);

    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private volatile String reason;

    /**
     * 중단되지 않는 새 신호.
     */
    public static AbortSignal none() {
        return new AbortSignal();
    }

    /**
     * 신호를 중단 상태로 전환.
     *
     * <p>이미 중단된 경우 무시합니다. 등록된 리스너는 호출 스레드에서 실행되며,
     * 리스너 실패는 로깅 후 무시됩니다.</p>
     *
     * @param reason 중단 사유
     */
    public void abort(String reason) {
        synchronized (this) {
            if (isAborted()) {
                return;
            }
            this.reason = reason == null ? "aborted" : reason;
            latch.countDown();
        }
        for (Runnable listener : listeners) {
            runListener(listener);
        }
    }

    public boolean isAborted() {
        return latch.getCount() == 0;
    }

    /**
     * @return 중단 사유, 중단되지 않았으면 null
     */
    public String reason() {
        return reason;
    }

    /**
     * 이미 중단된 경우 즉시 예외.
     *
     * @throws AbortedException 중단된 경우
     */
    public void throwIfAborted() {
        if (isAborted()) {
            throw new AbortedException(reason);
        }
    }

    /**
     * 지정 시간 동안 대기하되 중단되면 즉시 반환하지 않고 예외를 던짐.
     *
     * @param millis 대기 시간 (0 이하이면 중단 여부만 확인)
     * @throws AbortedException 대기 전 또는 대기 중 중단된 경우, 스레드가 인터럽트된 경우
     */
    public void await(long millis) {
        throwIfAborted();
        if (millis <= 0) {
            return;
        }
        try {
            if (latch.await(millis, TimeUnit.MILLISECONDS)) {
                throw new AbortedException(reason);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AbortedException("interrupted");
        }
    }

    /**
     * 중단 시 실행할 리스너 등록.
     *
     * <p>이미 중단된 경우 즉시 실행합니다.</p>
     *
     * @param listener 리스너
     * @return 등록 해제용 핸들
     */
    public Runnable onAbort(Runnable listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
        if (isAborted() && listeners.remove(listener)) {
            runListener(listener);
        }
        return () -> listeners.remove(listener);
    }

    private void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("Abort listener failed: {}", e.getMessage(), e);
        }
    }
}
