package com.ryuqq.flow.adapter.protection.retry;

import com.ryuqq.flow.core.error.ErrorCodes;

import java.util.Set;
import java.util.function.Predicate;

/**
 * 재시도 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxRetries: 최대 재시도 횟수 (기본 3, 첫 시도 제외)</li>
 *   <li>maxTotalMs: 첫 시도부터의 전체 시간 예산 (기본 60000ms)</li>
 *   <li>initialDelayMs: 첫 재시도 지연 (기본 100ms)</li>
 *   <li>backoffFactor: 지수 배수 (기본 2.0)</li>
 *   <li>maxDelayMs: 지연 상한 (기본 30000ms)</li>
 *   <li>jitter: full jitter 적용 여부 (기본 true)</li>
 *   <li>retryableErrorCodes: 재시도할 에러 코드 (기본 네트워크 계열 + TIMEOUT_EXCEEDED)</li>
 *   <li>retryableStatusCodes: 재시도할 상태 코드 (기본 408, 429, 500, 502, 503, 504)</li>
 *   <li>retryPredicate: 사용자 정의 판단 (null 허용, true면 다른 규칙과 무관하게 재시도)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RetryConfig(
    int maxRetries,
    long maxTotalMs,
    long initialDelayMs,
    double backoffFactor,
    long maxDelayMs,
    boolean jitter,
    Set<String> retryableErrorCodes,
    Set<Integer> retryableStatusCodes,
    Predicate<Throwable> retryPredicate
) {

    public static final Set<String> DEFAULT_ERROR_CODES = Set.of(
        ErrorCodes.ECONNRESET,
        ErrorCodes.ETIMEDOUT,
        ErrorCodes.ECONNREFUSED,
        ErrorCodes.NETWORK_ERROR,
        ErrorCodes.TIMEOUT_EXCEEDED
    );

    public static final Set<Integer> DEFAULT_STATUS_CODES = Set.of(408, 429, 500, 502, 503, 504);

    /**
     * 기본 설정 생성자.
     */
    public RetryConfig() {
        this(3, 60000, 100, 2.0, 30000, true, DEFAULT_ERROR_CODES, DEFAULT_STATUS_CODES, null);
    }

    public RetryConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative (current: " + maxRetries + ")");
        }
        if (maxTotalMs <= 0) {
            throw new IllegalArgumentException("maxTotalMs must be positive (current: " + maxTotalMs + ")");
        }
        if (initialDelayMs < 0) {
            throw new IllegalArgumentException("initialDelayMs must not be negative (current: " + initialDelayMs + ")");
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be >= 1.0 (current: " + backoffFactor + ")");
        }
        if (maxDelayMs < initialDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= initialDelayMs (initial: " + initialDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        retryableErrorCodes = retryableErrorCodes == null ? Set.of() : Set.copyOf(retryableErrorCodes);
        retryableStatusCodes = retryableStatusCodes == null ? Set.of() : Set.copyOf(retryableStatusCodes);
    }

    public RetryConfig withMaxRetries(int maxRetries) {
        return new RetryConfig(maxRetries, maxTotalMs, initialDelayMs, backoffFactor, maxDelayMs, jitter,
            retryableErrorCodes, retryableStatusCodes, retryPredicate);
    }

    public RetryConfig withMaxTotalMs(long maxTotalMs) {
        return new RetryConfig(maxRetries, maxTotalMs, initialDelayMs, backoffFactor, maxDelayMs, jitter,
            retryableErrorCodes, retryableStatusCodes, retryPredicate);
    }

    public RetryConfig withInitialDelayMs(long initialDelayMs) {
        return new RetryConfig(maxRetries, maxTotalMs, initialDelayMs, backoffFactor, maxDelayMs, jitter,
            retryableErrorCodes, retryableStatusCodes, retryPredicate);
    }

    public RetryConfig withBackoffFactor(double backoffFactor) {
        return new RetryConfig(maxRetries, maxTotalMs, initialDelayMs, backoffFactor, maxDelayMs, jitter,
            retryableErrorCodes, retryableStatusCodes, retryPredicate);
    }

    public RetryConfig withMaxDelayMs(long maxDelayMs) {
        return new RetryConfig(maxRetries, maxTotalMs, initialDelayMs, backoffFactor, maxDelayMs, jitter,
            retryableErrorCodes, retryableStatusCodes, retryPredicate);
    }

    public RetryConfig withJitter(boolean jitter) {
        return new RetryConfig(maxRetries, maxTotalMs, initialDelayMs, backoffFactor, maxDelayMs, jitter,
            retryableErrorCodes, retryableStatusCodes, retryPredicate);
    }

    public RetryConfig withRetryableErrorCodes(Set<String> retryableErrorCodes) {
        return new RetryConfig(maxRetries, maxTotalMs, initialDelayMs, backoffFactor, maxDelayMs, jitter,
            retryableErrorCodes, retryableStatusCodes, retryPredicate);
    }

    public RetryConfig withRetryableStatusCodes(Set<Integer> retryableStatusCodes) {
        return new RetryConfig(maxRetries, maxTotalMs, initialDelayMs, backoffFactor, maxDelayMs, jitter,
            retryableErrorCodes, retryableStatusCodes, retryPredicate);
    }

    public RetryConfig withRetryPredicate(Predicate<Throwable> retryPredicate) {
        return new RetryConfig(maxRetries, maxTotalMs, initialDelayMs, backoffFactor, maxDelayMs, jitter,
            retryableErrorCodes, retryableStatusCodes, retryPredicate);
    }
}
