package com.ryuqq.flow.adapter.runner.event;

import com.ryuqq.flow.adapter.runner.CancellableTask;
import com.ryuqq.flow.adapter.runner.TaskScheduler;
import com.ryuqq.flow.application.dispatcher.DispatcherStats;
import com.ryuqq.flow.application.dispatcher.EventDispatcher;
import com.ryuqq.flow.application.dispatcher.EventRecord;
import com.ryuqq.flow.core.context.RuntimeContext;
import com.ryuqq.flow.core.error.EventChainException;
import com.ryuqq.flow.core.error.HandlerExecutionException;
import com.ryuqq.flow.core.handler.AbortSignal;
import com.ryuqq.flow.core.handler.EventHandler;
import com.ryuqq.flow.core.handler.HandlerMiddleware;
import com.ryuqq.flow.core.handler.HandlerResult;
import com.ryuqq.flow.core.handler.PipelineHandler;
import com.ryuqq.flow.core.handler.PipelineMiddleware;
import com.ryuqq.flow.core.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * 인메모리 이벤트 디스패처.
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>exact, wildcard, pattern 순으로 핸들러를 찾아 모두 호출 (fan-out)</li>
 *   <li>미들웨어 진입 전 깊이/체인 길이/루프 검사</li>
 *   <li>handler 미들웨어는 등록 시 1회, pipeline 미들웨어는 호출마다 적용</li>
 *   <li>{@link HandlerResult.ReEmit} 결과를 같은 컨텍스트로 재귀 디스패치</li>
 *   <li>최근 이벤트 이력 보관 및 오래된 핸들러 주기 정리</li>
 * </ul>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * processEvent(event)
 *   ↓
 * history.record → (trace span) → dispatch
 *   ↓
 * context.enter(type)   // 깊이, 길이, 루프 검사
 *   ↓
 * handlers ≤ batchSize : 등록 순서대로 순차 실행, 실패 시 즉시 전파
 * handlers &gt; batchSize : batchSize 청크 단위, 청크 안에서는 병렬 실행, 실패는 로깅만
 *   ↓
 * context.exit()        // finally
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EventProcessor implements EventDispatcher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventProcessor.class);

    static final String SPAN_NAME = "event.process";

    private final EventProcessorConfig config;
    private final RuntimeContext context;
    private final HandlerRegistry registry = new HandlerRegistry();
    private final EventHistoryBuffer history;
    private final List<PipelineMiddleware> pipelineMiddlewares;
    private final List<HandlerMiddleware> handlerMiddlewares;
    private final ExecutorService batchExecutor;
    private final TaskScheduler scheduler;
    private final CancellableTask cleanupTask;

    private final AtomicLong handlerSequence = new AtomicLong();
    private final AtomicLong processedEvents = new AtomicLong();
    private final AtomicLong failedEvents = new AtomicLong();

    public EventProcessor() {
        this(new EventProcessorConfig(), RuntimeContext.defaults());
    }

    /**
     * 생성자.
     *
     * <p>{@code cleanupIntervalMs > 0}이면 정리 작업을 바로 예약합니다.</p>
     *
     * @param config 설정
     * @param context 런타임 컨텍스트 (시계, 관측성)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public EventProcessor(EventProcessorConfig config, RuntimeContext context) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        this.config = config;
        this.context = context;
        this.history = new EventHistoryBuffer(config.historyCapacity());
        this.pipelineMiddlewares = config.pipelineMiddlewares();
        this.handlerMiddlewares = config.handlerMiddlewares();

        AtomicInteger threadSequence = new AtomicInteger();
        this.batchExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "event-batch-" + threadSequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        if (config.cleanupIntervalMs() > 0) {
            this.scheduler = new TaskScheduler("event-processor-cleanup", 1);
            this.cleanupTask = scheduler.scheduleWithFixedDelay(
                "handler-cleanup", this::cleanupStaleHandlers, config.cleanupIntervalMs()
            );
        } else {
            this.scheduler = null;
            this.cleanupTask = null;
        }
    }

    // ===== 등록 =====

    @Override
    public String registerHandler(String eventType, EventHandler handler) {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType cannot be null or blank");
        }
        String id = nextHandlerId();
        registry.add(RegisteredHandler.exact(id, eventType, decorate(handler), context.now()));
        log.debug("Handler {} registered for {}", id, eventType);
        return id;
    }

    @Override
    public String registerWildcardHandler(EventHandler handler) {
        String id = nextHandlerId();
        registry.add(RegisteredHandler.wildcard(id, decorate(handler), context.now()));
        log.debug("Wildcard handler {} registered", id);
        return id;
    }

    @Override
    public String registerPatternHandler(Pattern pattern, EventHandler handler) {
        if (pattern == null) {
            throw new IllegalArgumentException("pattern cannot be null");
        }
        String id = nextHandlerId();
        registry.add(RegisteredHandler.pattern(id, pattern, decorate(handler), context.now()));
        log.debug("Pattern handler {} registered for /{}/", id, pattern.pattern());
        return id;
    }

    @Override
    public boolean unregister(String handlerId) {
        boolean deactivated = handlerId != null && registry.deactivate(handlerId);
        if (deactivated) {
            log.debug("Handler {} marked inactive", handlerId);
        }
        return deactivated;
    }

    // ===== 처리 =====

    @Override
    public void processEvent(Event event) {
        processEvent(event, AbortSignal.none());
    }

    @Override
    public void processEvent(Event event, AbortSignal signal) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        AbortSignal effectiveSignal = signal == null ? AbortSignal.none() : signal;
        ProcessingContext processing = ProcessingContext.root(
            config.maxEventChainLength(), effectiveSignal, event.correlationId(), context.now()
        );
        processedEvents.incrementAndGet();

        try {
            if (config.enableObservability()) {
                context.observability().trace(SPAN_NAME, spanAttributes(event), () -> {
                    dispatch(event, processing);
                    return null;
                });
            } else {
                dispatch(event, processing);
            }
        } catch (RuntimeException e) {
            failedEvents.incrementAndGet();
            log.error("Event {} ({}) failed: {}", event.type(), event.id(), e.getMessage());
            throw e;
        }
    }

    private void dispatch(Event event, ProcessingContext processing) {
        history.record(event);
        try {
            processing.enter(event.type(), config.maxEventDepth(), config.maxEventChainLength());
        } catch (EventChainException e) {
            log.error("Event chain rejected {}: {} (chain={})", event.type(), e.getMessage(), e.getChain());
            throw e;
        }

        try {
            List<RegisteredHandler> handlers = registry.resolve(event.type());
            if (handlers.isEmpty()) {
                log.debug("No handlers for event type {}", event.type());
                return;
            }
            if (handlers.size() > config.batchSize()) {
                dispatchInBatches(event, handlers, processing);
            } else {
                for (RegisteredHandler handler : handlers) {
                    invoke(handler, event, processing);
                }
            }
        } finally {
            processing.exit();
        }
    }

    private void dispatchInBatches(Event event, List<RegisteredHandler> handlers, ProcessingContext processing) {
        log.debug("Dispatching {} to {} handlers in batches of {}", event.type(), handlers.size(), config.batchSize());
        AtomicInteger failures = new AtomicInteger();

        for (int from = 0; from < handlers.size(); from += config.batchSize()) {
            List<RegisteredHandler> chunk = handlers.subList(from, Math.min(from + config.batchSize(), handlers.size()));
            List<CompletableFuture<Void>> futures = new ArrayList<>(chunk.size());
            for (RegisteredHandler handler : chunk) {
                ProcessingContext branch = processing.fork();
                futures.add(CompletableFuture.runAsync(() -> {
                    try {
                        invoke(handler, event, branch);
                    } catch (RuntimeException e) {
                        failures.incrementAndGet();
                        log.warn("Handler {} failed for {} in batch: {}", handler.id(), event.type(), e.getMessage());
                    }
                }, batchExecutor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        }

        if (failures.get() > 0) {
            log.warn("Batch dispatch of {} finished with {}/{} handler failures",
                event.type(), failures.get(), handlers.size());
        }
    }

    private void invoke(RegisteredHandler registered, Event event, ProcessingContext processing) {
        registered.markUsed(context.now());
        HandlerResult result;
        try {
            result = pipeline(registered).handle(event, processing.signal());
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new HandlerExecutionException(registered.id(), event.type(), e);
        }

        if (result instanceof HandlerResult.ReEmit reEmit) {
            dispatch(reEmit.event(), processing);
        }
    }

    /**
     * 목록의 첫 미들웨어가 가장 바깥을 감쌉니다.
     */
    private PipelineHandler pipeline(RegisteredHandler registered) {
        EventHandler handler = registered.handler();
        PipelineHandler composed = (event, signal) -> {
            signal.throwIfAborted();
            return handler.handle(event);
        };
        for (int i = pipelineMiddlewares.size() - 1; i >= 0; i--) {
            composed = pipelineMiddlewares.get(i).apply(composed);
        }
        return composed;
    }

    private EventHandler decorate(EventHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        EventHandler decorated = handler;
        for (int i = handlerMiddlewares.size() - 1; i >= 0; i--) {
            decorated = handlerMiddlewares.get(i).apply(decorated);
        }
        return decorated;
    }

    // ===== 관리 =====

    /**
     * 비활성 핸들러와 staleThreshold 동안 사용되지 않은 핸들러 제거.
     *
     * <p>한 번도 호출되지 않은 활성 핸들러는 남겨둡니다.</p>
     *
     * @return 제거된 핸들러 수
     */
    public int cleanupStaleHandlers() {
        int removed = registry.removeStale(context.now(), config.staleThresholdMs());
        if (removed > 0) {
            log.info("Removed {} stale handlers ({} remaining)", removed, registry.size());
        }
        return removed;
    }

    @Override
    public List<EventRecord> getRecentEvents(int limit) {
        return history.recent(limit);
    }

    @Override
    public DispatcherStats getStats() {
        return new DispatcherStats(
            registry.countsByType(),
            registry.wildcardCount(),
            registry.patternCount(),
            history.size(),
            history.capacity(),
            processedEvents.get(),
            failedEvents.get(),
            config.operationTimeoutMs()
        );
    }

    @Override
    public void clearHandlers() {
        registry.clear();
        log.info("All handlers cleared");
    }

    public EventProcessorConfig getConfig() {
        return config;
    }

    /**
     * 정리 작업과 배치 스레드 종료. 핸들러와 이벤트 이력도 비웁니다.
     */
    @Override
    public void close() {
        if (cleanupTask != null) {
            cleanupTask.cancel();
            scheduler.close();
        }
        batchExecutor.shutdownNow();
        registry.clear();
        history.clear();
        log.info("Event processor closed");
    }

    private String nextHandlerId() {
        return "handler-" + handlerSequence.incrementAndGet();
    }

    private static Map<String, Object> spanAttributes(Event event) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("eventId", event.id());
        attributes.put("eventType", event.type());
        if (event.correlationId() != null) {
            attributes.put("correlationId", event.correlationId());
        }
        return attributes;
    }
}
