package com.ryuqq.flow.core.spi;

import java.util.List;
import java.util.Optional;

/**
 * 네임스페이스 단위 키/값 저장소 SPI.
 *
 * <p>두 단계 맵 {@code namespace → (key → value)} 구조이며, 구현체는
 * 네임스페이스 수와 네임스페이스별 키 수의 상한을 강제합니다.</p>
 *
 * <p><strong>용량 정책:</strong></p>
 * <ul>
 *   <li>한도를 넘는 새 네임스페이스/키 생성은
 *       {@link com.ryuqq.flow.core.error.StateCapacityExceededException}으로 실패</li>
 *   <li>기존 키 덮어쓰기는 항상 허용</li>
 *   <li>조용한 축출(eviction)은 발생하지 않음</li>
 * </ul>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>동시 접근을 허용하는 구현은 같은 네임스페이스에 대한 변경을 직렬화해야 함</li>
 *   <li>null 값 저장 불가 ({@link IllegalArgumentException})</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StateStore {

    /**
     * 값 조회.
     *
     * @param namespace 네임스페이스
     * @param key 키
     * @return 값 (없으면 empty)
     */
    Optional<Object> get(String namespace, String key);

    /**
     * 값 저장.
     *
     * @param namespace 네임스페이스
     * @param key 키
     * @param value 값 (null 불가)
     * @throws com.ryuqq.flow.core.error.StateCapacityExceededException 용량 한도 초과 시
     */
    void set(String namespace, String key, Object value);

    /**
     * 키 삭제.
     *
     * <p>마지막 키가 삭제되면 네임스페이스도 함께 제거되어 슬롯이 즉시 반환됩니다.</p>
     *
     * @return 삭제된 키가 있었으면 true
     */
    boolean delete(String namespace, String key);

    boolean has(String namespace, String key);

    /**
     * 네임스페이스의 키 목록 (삽입 순서).
     *
     * @return 키 목록 (네임스페이스가 없으면 빈 목록)
     */
    List<String> keys(String namespace);

    /**
     * 네임스페이스의 키 개수.
     */
    int size(String namespace);

    /**
     * 전체 키 개수.
     */
    int size();

    /**
     * 네임스페이스의 모든 키 삭제.
     */
    void clear(String namespace);

    /**
     * 전체 삭제.
     */
    void clear();

    /**
     * 집계 통계 (메모리 추정 포함).
     */
    StateStoreStats getStats();
}
