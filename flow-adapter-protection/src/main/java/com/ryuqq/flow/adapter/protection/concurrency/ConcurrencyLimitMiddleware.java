package com.ryuqq.flow.adapter.protection.concurrency;

import com.ryuqq.flow.core.error.AbortedException;
import com.ryuqq.flow.core.error.ConcurrencyLimitException;
import com.ryuqq.flow.core.handler.AbortSignal;
import com.ryuqq.flow.core.handler.PipelineHandler;
import com.ryuqq.flow.core.handler.PipelineMiddleware;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * 키 단위 Bulkhead pipeline 미들웨어.
 *
 * <p>키마다 공정(fair) {@link Semaphore}를 두고 슬롯을 얻은 호출만 실행합니다.</p>
 * <ul>
 *   <li>queueTimeoutMs=0: 슬롯이 없으면 즉시 {@code CONCURRENCY_DROP}</li>
 *   <li>queueTimeoutMs&gt;0: 도착 순서대로 대기, 시간 초과 시 {@code CONCURRENCY_TIMEOUT}</li>
 *   <li>핸들러 종료 시 (성공/실패 무관) 슬롯 반환</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ConcurrencyLimitMiddleware implements PipelineMiddleware {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyLimitMiddleware.class);

    private final ConcurrencyLimitConfig config;
    private final ConcurrentHashMap<String, Semaphore> permits = new ConcurrentHashMap<>();

    public ConcurrencyLimitMiddleware(ConcurrencyLimitConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    @Override
    public PipelineHandler apply(PipelineHandler next) {
        return (event, signal) -> {
            AbortSignal effectiveSignal = signal == null ? AbortSignal.none() : signal;
            String key = config.keyGenerator().apply(event);
            Semaphore semaphore = permits.computeIfAbsent(key, k -> new Semaphore(config.maxConcurrent(), true));

            acquire(semaphore, key, effectiveSignal);
            try {
                return next.handle(event, effectiveSignal);
            } finally {
                semaphore.release();
            }
        };
    }

    /**
     * 키별 현재 실행 중인 호출 수 (키 이름순).
     */
    public Map<String, Integer> getActiveCounts() {
        Map<String, Integer> counts = new TreeMap<>();
        permits.forEach((key, semaphore) -> counts.put(key, config.maxConcurrent() - semaphore.availablePermits()));
        return counts;
    }

    public int getActiveCount(String key) {
        Semaphore semaphore = permits.get(key);
        return semaphore == null ? 0 : config.maxConcurrent() - semaphore.availablePermits();
    }

    @Override
    public String name() {
        return "concurrencyLimit";
    }

    private void acquire(Semaphore semaphore, String key, AbortSignal signal) {
        signal.throwIfAborted();
        if (config.queueTimeoutMs() == 0) {
            if (!semaphore.tryAcquire()) {
                log.warn("Concurrency limit {} reached for {}, dropping call", config.maxConcurrent(), key);
                throw ConcurrencyLimitException.dropped(key, config.maxConcurrent());
            }
            return;
        }
        try {
            if (!semaphore.tryAcquire(config.queueTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Timed out waiting {}ms for a slot on {}", config.queueTimeoutMs(), key);
                throw ConcurrencyLimitException.timedOut(key, config.maxConcurrent(), config.queueTimeoutMs());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AbortedException("interrupted");
        }
    }
}
