package com.ryuqq.flow.core.spi;

import java.util.Map;

/**
 * State Store 집계 통계.
 *
 * @param namespaceCount 네임스페이스 수 (빈 네임스페이스 포함)
 * @param totalKeys 전체 키 수
 * @param memoryUsage 추정 메모리 사용량 (bytes, 근사치)
 * @param namespaces 네임스페이스별 통계
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StateStoreStats(
    int namespaceCount,
    int totalKeys,
    long memoryUsage,
    Map<String, NamespaceStats> namespaces
) {

    public StateStoreStats {
        namespaces = namespaces == null ? Map.of() : Map.copyOf(namespaces);
    }

    /**
     * 네임스페이스 통계.
     *
     * @param keyCount 키 수
     * @param estimatedSize 추정 크기 (bytes)
     */
    public record NamespaceStats(int keyCount, long estimatedSize) {
    }
}
