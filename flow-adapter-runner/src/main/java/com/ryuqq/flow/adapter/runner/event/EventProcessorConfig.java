package com.ryuqq.flow.adapter.runner.event;

import com.ryuqq.flow.core.handler.HandlerMiddleware;
import com.ryuqq.flow.core.handler.Middleware;
import com.ryuqq.flow.core.handler.PipelineMiddleware;

import java.util.List;

/**
 * EventProcessor 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxEventDepth: 재귀 디스패치 최대 깊이 (기본 100)</li>
 *   <li>maxEventChainLength: 체인 추적 최대 길이 (기본 1000)</li>
 *   <li>enableObservability: 트레이스 스팬 사용 여부 (기본 true)</li>
 *   <li>middlewares: pipeline/handler 미들웨어 목록, 앞쪽이 바깥 (기본 없음)</li>
 *   <li>batchSize: 이 수를 넘는 핸들러는 청크 단위 병렬 실행 (기본 100)</li>
 *   <li>cleanupIntervalMs: 오래된 핸들러 정리 주기 (기본 120000ms = 2분, 0이면 비활성)</li>
 *   <li>staleThresholdMs: 마지막 사용 후 이 시간이 지나면 정리 대상 (기본 600000ms = 10분)</li>
 *   <li>operationTimeoutMs: 작업 타임아웃 (기본 30000ms, 통계로 노출)</li>
 *   <li>historyCapacity: 최근 이벤트 이력 용량 (기본 10000)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record EventProcessorConfig(
    int maxEventDepth,
    int maxEventChainLength,
    boolean enableObservability,
    List<Middleware> middlewares,
    int batchSize,
    long cleanupIntervalMs,
    long staleThresholdMs,
    long operationTimeoutMs,
    int historyCapacity
) {

    /**
     * 기본 설정 생성자.
     */
    public EventProcessorConfig() {
        this(100, 1000, true, List.of(), 100, 120000, 600000, 30000, 10000);
    }

    public EventProcessorConfig {
        if (maxEventDepth <= 0) {
            throw new IllegalArgumentException("maxEventDepth must be positive (current: " + maxEventDepth + ")");
        }
        if (maxEventChainLength <= 0) {
            throw new IllegalArgumentException(
                "maxEventChainLength must be positive (current: " + maxEventChainLength + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        if (cleanupIntervalMs < 0) {
            throw new IllegalArgumentException(
                "cleanupIntervalMs must not be negative (current: " + cleanupIntervalMs + ")"
            );
        }
        if (staleThresholdMs <= 0) {
            throw new IllegalArgumentException(
                "staleThresholdMs must be positive (current: " + staleThresholdMs + ")"
            );
        }
        if (operationTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "operationTimeoutMs must be positive (current: " + operationTimeoutMs + ")"
            );
        }
        if (historyCapacity <= 0) {
            throw new IllegalArgumentException("historyCapacity must be positive (current: " + historyCapacity + ")");
        }
        middlewares = middlewares == null ? List.of() : List.copyOf(middlewares);
    }

    /**
     * 등록 시점에 적용되는 미들웨어 (선언 순서).
     */
    public List<HandlerMiddleware> handlerMiddlewares() {
        return middlewares.stream()
            .filter(HandlerMiddleware.class::isInstance)
            .map(HandlerMiddleware.class::cast)
            .toList();
    }

    /**
     * 호출마다 적용되는 미들웨어 (선언 순서).
     */
    public List<PipelineMiddleware> pipelineMiddlewares() {
        return middlewares.stream()
            .filter(PipelineMiddleware.class::isInstance)
            .map(PipelineMiddleware.class::cast)
            .toList();
    }

    public EventProcessorConfig withMaxEventDepth(int maxEventDepth) {
        return new EventProcessorConfig(maxEventDepth, maxEventChainLength, enableObservability, middlewares,
            batchSize, cleanupIntervalMs, staleThresholdMs, operationTimeoutMs, historyCapacity);
    }

    public EventProcessorConfig withMaxEventChainLength(int maxEventChainLength) {
        return new EventProcessorConfig(maxEventDepth, maxEventChainLength, enableObservability, middlewares,
            batchSize, cleanupIntervalMs, staleThresholdMs, operationTimeoutMs, historyCapacity);
    }

    public EventProcessorConfig withEnableObservability(boolean enableObservability) {
        return new EventProcessorConfig(maxEventDepth, maxEventChainLength, enableObservability, middlewares,
            batchSize, cleanupIntervalMs, staleThresholdMs, operationTimeoutMs, historyCapacity);
    }

    public EventProcessorConfig withMiddlewares(List<Middleware> middlewares) {
        return new EventProcessorConfig(maxEventDepth, maxEventChainLength, enableObservability, middlewares,
            batchSize, cleanupIntervalMs, staleThresholdMs, operationTimeoutMs, historyCapacity);
    }

    public EventProcessorConfig withBatchSize(int batchSize) {
        return new EventProcessorConfig(maxEventDepth, maxEventChainLength, enableObservability, middlewares,
            batchSize, cleanupIntervalMs, staleThresholdMs, operationTimeoutMs, historyCapacity);
    }

    public EventProcessorConfig withCleanupIntervalMs(long cleanupIntervalMs) {
        return new EventProcessorConfig(maxEventDepth, maxEventChainLength, enableObservability, middlewares,
            batchSize, cleanupIntervalMs, staleThresholdMs, operationTimeoutMs, historyCapacity);
    }

    public EventProcessorConfig withStaleThresholdMs(long staleThresholdMs) {
        return new EventProcessorConfig(maxEventDepth, maxEventChainLength, enableObservability, middlewares,
            batchSize, cleanupIntervalMs, staleThresholdMs, operationTimeoutMs, historyCapacity);
    }

    public EventProcessorConfig withOperationTimeoutMs(long operationTimeoutMs) {
        return new EventProcessorConfig(maxEventDepth, maxEventChainLength, enableObservability, middlewares,
            batchSize, cleanupIntervalMs, staleThresholdMs, operationTimeoutMs, historyCapacity);
    }

    public EventProcessorConfig withHistoryCapacity(int historyCapacity) {
        return new EventProcessorConfig(maxEventDepth, maxEventChainLength, enableObservability, middlewares,
            batchSize, cleanupIntervalMs, staleThresholdMs, operationTimeoutMs, historyCapacity);
    }
}
