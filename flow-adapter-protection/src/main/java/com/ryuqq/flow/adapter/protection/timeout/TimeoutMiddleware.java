package com.ryuqq.flow.adapter.protection.timeout;

import com.ryuqq.flow.core.error.AbortedException;
import com.ryuqq.flow.core.error.OperationTimeoutException;
import com.ryuqq.flow.core.handler.AbortSignal;
import com.ryuqq.flow.core.handler.HandlerResult;
import com.ryuqq.flow.core.handler.PipelineHandler;
import com.ryuqq.flow.core.handler.PipelineMiddleware;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-call timeout pipeline middleware.
 *
 * <p>Runs the next handler on a worker thread and waits at most {@code timeoutMs}. On timeout the
 * worker is interrupted, the child signal handed to inner middlewares is aborted, and
 * {@link OperationTimeoutException} ({@code TIMEOUT_EXCEEDED}) is thrown. An abort of the caller's
 * signal cancels the wait immediately.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TimeoutMiddleware implements PipelineMiddleware, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TimeoutMiddleware.class);

    private final long timeoutMs;
    private final ExecutorService executor;

    /**
     * @param timeoutMs per-call limit in millis (positive)
     */
    public TimeoutMiddleware(long timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive (current: " + timeoutMs + ")");
        }
        this.timeoutMs = timeoutMs;
        AtomicInteger sequence = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "flow-timeout-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public PipelineHandler apply(PipelineHandler next) {
        return (event, signal) -> {
            AbortSignal parent = signal == null ? AbortSignal.none() : signal;
            parent.throwIfAborted();

            AbortSignal child = new AbortSignal();
            Runnable unlink = parent.onAbort(() -> child.abort(parent.reason()));
            Future<HandlerResult> future = executor.submit(() -> next.handle(event, child));
            Runnable unsubscribe = child.onAbort(() -> future.cancel(true));
            try {
                return future.get(timeoutMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.warn("Handler for {} timed out after {}ms", event.type(), timeoutMs);
                child.abort("timeout");
                throw new OperationTimeoutException(event.type(), timeoutMs);
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
                throw new AbortedException(parent.reason());
            } catch (InterruptedException e) {
                child.abort("interrupted");
                Thread.currentThread().interrupt();
                throw new AbortedException("interrupted");
            } finally {
                unsubscribe.run();
                unlink.run();
            }
        };
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    @Override
    public String name() {
        return "timeout";
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
