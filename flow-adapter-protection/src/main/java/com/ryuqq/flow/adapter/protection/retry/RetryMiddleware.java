package com.ryuqq.flow.adapter.protection.retry;

import com.ryuqq.flow.core.error.AbortedException;
import com.ryuqq.flow.core.error.FlowException;
import com.ryuqq.flow.core.error.RetryExceededException;
import com.ryuqq.flow.core.handler.AbortSignal;
import com.ryuqq.flow.core.handler.PipelineHandler;
import com.ryuqq.flow.core.handler.PipelineMiddleware;
import com.ryuqq.flow.core.model.CostContext;
import com.ryuqq.flow.core.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * 재시도 pipeline 미들웨어.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. 다음 핸들러 실행
 * 2. 실패 시 재시도 가능 여부 분류 (불가하면 원본 예외 그대로 전파)
 *    a. retryPredicate가 true
 *    b. FlowException 코드가 retryableErrorCodes에 포함
 *    c. FlowException 상태 코드가 retryableStatusCodes에 포함
 * 3. 재시도 횟수 또는 전체 시간 예산 초과 시 RetryExceededException
 * 4. 이벤트의 CostContext.retries 증가
 * 5. 백오프 대기 (중단 신호 시 즉시 AbortedException)
 * 6. 1로 돌아감
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RetryMiddleware implements PipelineMiddleware {

    private static final Logger log = LoggerFactory.getLogger(RetryMiddleware.class);

    private final RetryConfig config;
    private final BackoffCalculator backoff;
    private final Clock clock;

    public RetryMiddleware() {
        this(new RetryConfig());
    }

    public RetryMiddleware(RetryConfig config) {
        this(config, new BackoffCalculator(config), Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param config 재시도 설정
     * @param backoff 백오프 계산기
     * @param clock 시간 예산 측정용 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RetryMiddleware(RetryConfig config, BackoffCalculator backoff, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.backoff = backoff;
        this.clock = clock;
    }

    @Override
    public PipelineHandler apply(PipelineHandler next) {
        return (event, signal) -> {
            AbortSignal effectiveSignal = signal == null ? AbortSignal.none() : signal;
            long startedAt = clock.millis();
            int retries = 0;

            while (true) {
                try {
                    return next.handle(event, effectiveSignal);
                } catch (AbortedException e) {
                    throw e;
                } catch (Exception e) {
                    if (!isRetryable(e)) {
                        throw e;
                    }
                    int attempts = retries + 1;
                    if (retries >= config.maxRetries()) {
                        log.warn("Retry exhausted for {} after {} attempts: {}", event.type(), attempts, e.getMessage());
                        throw new RetryExceededException(attempts, event.type(), e);
                    }

                    long delay = backoff.calculate(retries);
                    long elapsed = clock.millis() - startedAt;
                    if (elapsed + delay > config.maxTotalMs()) {
                        log.warn("Retry time budget exhausted for {} after {} attempts ({}ms elapsed)",
                            event.type(), attempts, elapsed);
                        throw new RetryExceededException(attempts, event.type(), e);
                    }

                    retries++;
                    recordRetry(event);
                    log.warn("Retrying {} (retry {}/{}) in {}ms: {}",
                        event.type(), retries, config.maxRetries(), delay, e.getMessage());
                    effectiveSignal.await(delay);
                }
            }
        };
    }

    /**
     * 재시도 가능 여부 분류.
     *
     * @param error 실패 원인
     * @return 재시도 가능하면 true
     */
    public boolean isRetryable(Throwable error) {
        if (config.retryPredicate() != null && config.retryPredicate().test(error)) {
            return true;
        }
        if (error instanceof FlowException flowException) {
            if (config.retryableErrorCodes().contains(flowException.getCode())) {
                return true;
            }
            Integer status = flowException.getStatusCode();
            return status != null && config.retryableStatusCodes().contains(status);
        }
        return false;
    }

    @Override
    public String name() {
        return "retry";
    }

    public RetryConfig getConfig() {
        return config;
    }

    private static void recordRetry(Event event) {
        CostContext cost = event.metadata().cost();
        if (cost != null) {
            cost.incrementRetries();
        }
    }
}
