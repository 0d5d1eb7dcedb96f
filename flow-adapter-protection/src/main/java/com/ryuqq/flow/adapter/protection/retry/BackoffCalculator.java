package com.ryuqq.flow.adapter.protection.retry;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff (full jitter) 계산기.
 *
 * <p>재시도 간격을 지수적으로 늘리고, jitter가 켜져 있으면 [0, delay] 구간에서
 * 균등 추출하여 동시에 실패한 호출자들이 같은 시각에 몰리지 않게 합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay(n) = min(initialDelay * factor^n, maxDelay)
 * jitter   = delay(n) * random[0, 1)
 * </pre>
 *
 * <p><strong>예시 (initialDelay=100ms, factor=2, maxDelay=30000ms, jitter 없음):</strong></p>
 * <ul>
 *   <li>n=0: 100ms</li>
 *   <li>n=1: 200ms</li>
 *   <li>n=2: 400ms</li>
 *   <li>n=9: 51200ms → 30000ms (maxDelay로 제한)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long initialDelayMs;
    private final double backoffFactor;
    private final long maxDelayMs;
    private final boolean jitter;
    private final DoubleSupplier random;

    /**
     * 설정에서 생성.
     *
     * @param config 재시도 설정
     */
    public BackoffCalculator(RetryConfig config) {
        this(config.initialDelayMs(), config.backoffFactor(), config.maxDelayMs(), config.jitter(),
            () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param initialDelayMs 첫 지연 (0 이상)
     * @param backoffFactor 지수 배수 (1.0 이상)
     * @param maxDelayMs 최대 지연 (initialDelayMs 이상)
     * @param jitter full jitter 적용 여부
     * @param random [0, 1) 난수 공급자
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long initialDelayMs, double backoffFactor, long maxDelayMs,
                             boolean jitter, DoubleSupplier random) {
        if (initialDelayMs < 0) {
            throw new IllegalArgumentException(
                "initialDelayMs must not be negative (current: " + initialDelayMs + ")"
            );
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException(
                "backoffFactor must be >= 1.0 (current: " + backoffFactor + ")"
            );
        }
        if (maxDelayMs < initialDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= initialDelayMs (initial: " + initialDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.initialDelayMs = initialDelayMs;
        this.backoffFactor = backoffFactor;
        this.maxDelayMs = maxDelayMs;
        this.jitter = jitter;
        this.random = random;
    }

    /**
     * n번째 재시도 전 대기 시간 계산.
     *
     * @param attempt 재시도 순번 (0부터 시작)
     * @return 대기 시간 (밀리초)
     * @throws IllegalArgumentException attempt가 음수인 경우
     */
    public long calculate(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException(
                "attempt must not be negative (current: " + attempt + ")"
            );
        }

        // double 연산 후 상한 적용 (큰 n에서 overflow 방지)
        double exponential = initialDelayMs * Math.pow(backoffFactor, attempt);
        long capped = (long) Math.min(exponential, (double) maxDelayMs);

        if (!jitter) {
            return capped;
        }
        return (long) (capped * random.getAsDouble());
    }

    public long getInitialDelayMs() {
        return initialDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public boolean isJitter() {
        return jitter;
    }
}
