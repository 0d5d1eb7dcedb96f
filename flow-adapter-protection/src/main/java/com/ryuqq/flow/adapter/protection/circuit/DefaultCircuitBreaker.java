package com.ryuqq.flow.adapter.protection.circuit;

import com.ryuqq.flow.core.error.AbortedException;
import com.ryuqq.flow.core.error.OperationTimeoutException;
import com.ryuqq.flow.core.handler.AbortSignal;
import com.ryuqq.flow.core.protection.CircuitBreaker;
import com.ryuqq.flow.core.protection.CircuitBreakerConfig;
import com.ryuqq.flow.core.protection.CircuitBreakerListener;
import com.ryuqq.flow.core.protection.CircuitBreakerState;
import com.ryuqq.flow.core.protection.CircuitMetrics;
import com.ryuqq.flow.core.protection.CircuitResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 연속 실패 카운터 기반 Circuit Breaker.
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>CLOSED에서 연속 실패가 failureThreshold에 도달하면 OPEN</li>
 *   <li>OPEN에서는 작업을 실행하지 않고 거부 결과 반환</li>
 *   <li>recoveryTimeout 경과 후 첫 호출 시점에 HALF_OPEN 전이 (백그라운드 타이머 없음)</li>
 *   <li>HALF_OPEN에서 successThreshold 연속 성공 시 CLOSED, 실패 1회 시 OPEN</li>
 *   <li>모든 실행을 operationTimeout과 경합, 타임아웃은 실패 1회로 계산</li>
 *   <li>{@link Error}를 포함한 모든 실패를 {@link CircuitResult}로 반환 (execute는 예외를 던지지 않음)</li>
 * </ul>
 *
 * <p><strong>스레드 모델:</strong> 작업은 주입된 {@link ExecutorService}에서 실행되고
 * 호출 스레드는 타임아웃까지 결과를 기다립니다. 상태와 카운터는 이 인스턴스의
 * 모니터로 보호되며, 리스너는 모니터 밖에서 호출됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DefaultCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(DefaultCircuitBreaker.class);

    private final CircuitBreakerConfig config;
    private final ExecutorService executor;
    private final Clock clock;

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private long stateChangedAt;
    private long nextAttemptAt;

    private long totalCalls;
    private long successfulCalls;
    private long failedCalls;
    private long rejectedCalls;
    private Long lastFailureTime;
    private String lastFailureMessage;
    private Long lastSuccessTime;

    /**
     * 생성자.
     *
     * @param config 설정
     * @param executor 작업 실행용 스레드 풀 (호출자가 소유)
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultCircuitBreaker(CircuitBreakerConfig config, ExecutorService executor, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.executor = executor;
        this.clock = clock;
        this.stateChangedAt = clock.millis();
    }

    @Override
    public <T> CircuitResult<T> execute(Callable<T> operation, AbortSignal signal) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        AbortSignal effectiveSignal = signal == null ? AbortSignal.none() : signal;

        Transition transition = null;
        synchronized (this) {
            totalCalls++;
            if (state == CircuitBreakerState.OPEN) {
                if (clock.millis() < nextAttemptAt) {
                    rejectedCalls++;
                    log.debug("Circuit {} is OPEN, rejecting call (next attempt at {})", config.name(), nextAttemptAt);
                    return CircuitResult.rejected(CircuitBreakerState.OPEN);
                }
                transition = transitionTo(CircuitBreakerState.HALF_OPEN);
            }
        }
        notifyStateChange(transition);

        long startedAt = clock.millis();
        try {
            T result = runWithTimeout(operation, effectiveSignal);
            long durationMs = clock.millis() - startedAt;
            CircuitBreakerState after = recordSuccess(durationMs);
            return CircuitResult.success(result, after, durationMs);
        } catch (Exception | Error e) {
            long durationMs = clock.millis() - startedAt;
            CircuitBreakerState after = recordFailure(e);
            return CircuitResult.failure(e, after, durationMs);
        }
    }

    @Override
    public synchronized CircuitBreakerState getState() {
        return state;
    }

    @Override
    public synchronized CircuitMetrics getMetrics() {
        double successRate = totalCalls == 0 ? 0.0 : (double) successfulCalls / totalCalls;
        double failureRate = totalCalls == 0 ? 0.0 : (double) failedCalls / totalCalls;
        return new CircuitMetrics(
            config.name(),
            state,
            totalCalls,
            successfulCalls,
            failedCalls,
            rejectedCalls,
            consecutiveFailures,
            consecutiveSuccesses,
            successRate,
            failureRate,
            clock.millis() - stateChangedAt,
            lastFailureTime,
            lastFailureMessage,
            lastSuccessTime,
            state == CircuitBreakerState.OPEN ? nextAttemptAt : null
        );
    }

    @Override
    public void forceOpen() {
        Transition transition;
        synchronized (this) {
            transition = transitionTo(CircuitBreakerState.OPEN);
        }
        log.warn("Circuit {} forced OPEN", config.name());
        notifyStateChange(transition);
    }

    @Override
    public void forceClose() {
        Transition transition;
        synchronized (this) {
            transition = transitionTo(CircuitBreakerState.CLOSED);
            consecutiveFailures = 0;
            consecutiveSuccesses = 0;
        }
        log.info("Circuit {} forced CLOSED", config.name());
        notifyStateChange(transition);
    }

    @Override
    public void reset() {
        Transition transition;
        synchronized (this) {
            transition = transitionTo(CircuitBreakerState.CLOSED);
            consecutiveFailures = 0;
            consecutiveSuccesses = 0;
            totalCalls = 0;
            successfulCalls = 0;
            failedCalls = 0;
            rejectedCalls = 0;
            lastFailureTime = null;
            lastFailureMessage = null;
            lastSuccessTime = null;
            stateChangedAt = clock.millis();
        }
        log.info("Circuit {} reset", config.name());
        notifyStateChange(transition);
    }

    @Override
    public String getName() {
        return config.name();
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    private <T> T runWithTimeout(Callable<T> operation, AbortSignal signal) throws Exception {
        signal.throwIfAborted();
        Future<T> future = executor.submit(operation);
        Runnable unsubscribe = signal.onAbort(() -> future.cancel(true));
        try {
            return future.get(config.operationTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new OperationTimeoutException(config.name(), config.operationTimeoutMs());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        } catch (CancellationException e) {
            throw new AbortedException(signal.reason());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AbortedException("interrupted");
        } finally {
            unsubscribe.run();
        }
    }

    private CircuitBreakerState recordSuccess(long durationMs) {
        Transition transition = null;
        CircuitBreakerState after;
        synchronized (this) {
            successfulCalls++;
            lastSuccessTime = clock.millis();
            if (state == CircuitBreakerState.HALF_OPEN) {
                consecutiveSuccesses++;
                if (consecutiveSuccesses >= config.successThreshold()) {
                    transition = transitionTo(CircuitBreakerState.CLOSED);
                }
            } else if (state == CircuitBreakerState.CLOSED) {
                consecutiveFailures = 0;
            }
            after = state;
        }
        notifyStateChange(transition);
        notifyListener(() -> config.listener().onSuccess(config.name(), durationMs));
        return after;
    }

    private CircuitBreakerState recordFailure(Throwable error) {
        Transition transition = null;
        CircuitBreakerState after;
        synchronized (this) {
            failedCalls++;
            lastFailureTime = clock.millis();
            lastFailureMessage = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
            if (state == CircuitBreakerState.HALF_OPEN) {
                transition = transitionTo(CircuitBreakerState.OPEN);
            } else if (state == CircuitBreakerState.CLOSED) {
                consecutiveFailures++;
                if (consecutiveFailures >= config.failureThreshold()) {
                    transition = transitionTo(CircuitBreakerState.OPEN);
                }
            }
            after = state;
        }
        log.debug("Circuit {} recorded failure: {}", config.name(), lastFailureMessage);
        notifyStateChange(transition);
        notifyListener(() -> config.listener().onFailure(config.name(), error));
        return after;
    }

    /**
     * 모니터를 잡은 상태에서 호출.
     *
     * @return 실제 전이가 일어났으면 전이 정보, 같은 상태면 null
     */
    private Transition transitionTo(CircuitBreakerState next) {
        CircuitBreakerState previous = state;
        if (previous == next) {
            return null;
        }
        long now = clock.millis();
        state = next;
        stateChangedAt = now;
        switch (next) {
            case OPEN -> {
                nextAttemptAt = now + config.recoveryTimeoutMs();
                consecutiveSuccesses = 0;
            }
            case HALF_OPEN -> consecutiveSuccesses = 0;
            case CLOSED -> {
                consecutiveFailures = 0;
                consecutiveSuccesses = 0;
            }
        }
        return new Transition(previous, next);
    }

    private void notifyStateChange(Transition transition) {
        if (transition == null) {
            return;
        }
        log.info("Circuit {} state changed: {} → {}", config.name(), transition.from(), transition.to());
        CircuitBreakerListener listener = config.listener();
        notifyListener(() -> listener.onStateChange(config.name(), transition.from(), transition.to()));
    }

    private void notifyListener(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Circuit {} listener failed: {}", config.name(), e.getMessage(), e);
        }
    }

    private record Transition(CircuitBreakerState from, CircuitBreakerState to) {
    }
}
