package com.ryuqq.flow.application.dispatcher;

import com.ryuqq.flow.core.handler.AbortSignal;
import com.ryuqq.flow.core.handler.EventHandler;
import com.ryuqq.flow.core.model.Event;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 이벤트 디스패처.
 *
 * <p>이벤트를 핸들러로 라우팅하고, 핸들러가 반환한 후속 이벤트를
 * 같은 깊이/체인 추적 아래에서 재귀적으로 처리합니다.</p>
 *
 * <p><strong>핸들러 해석 순서 (fan-out, 모두 실행):</strong></p>
 * <ol>
 *   <li>정확한 타입 핸들러 (등록 순서)</li>
 *   <li>와일드카드 핸들러</li>
 *   <li>타입이 패턴과 일치하는 패턴 핸들러</li>
 * </ol>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * dispatcher.registerHandler("order.created", event -&gt; {
 *     inventory.reserve(event.data());
 *     return HandlerResult.reEmit(Event.of("inventory.reserved", event.data()));
 * });
 *
 * dispatcher.processEvent(Event.of("order.created", order));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface EventDispatcher {

    /**
     * 정확한 타입 핸들러 등록.
     *
     * @param eventType 이벤트 타입
     * @param handler 핸들러 (등록 시점에 handler 미들웨어가 적용됨)
     * @return 핸들러 ID ({@link #unregister(String)}에 사용)
     * @throws IllegalArgumentException eventType 또는 handler가 null인 경우
     */
    String registerHandler(String eventType, EventHandler handler);

    /**
     * 모든 이벤트 타입에 반응하는 핸들러 등록.
     *
     * @return 핸들러 ID
     */
    String registerWildcardHandler(EventHandler handler);

    /**
     * 정규식 패턴과 일치하는 타입에 반응하는 핸들러 등록.
     *
     * <p>매칭은 {@link java.util.regex.Matcher#find()} 기준(부분 일치)입니다. 전체 일치가 필요하면 {@code ^...$}를 사용합니다.</p>
     *
     * @return 핸들러 ID
     */
    String registerPatternHandler(Pattern pattern, EventHandler handler);

    /**
     * 핸들러를 비활성화.
     *
     * <p>비활성 핸들러는 즉시 디스패치 대상에서 제외되며 다음 정리 주기에 제거됩니다.</p>
     *
     * @return 해당 ID의 활성 핸들러가 있었으면 true
     */
    boolean unregister(String handlerId);

    /**
     * 이벤트 처리.
     *
     * @param event 이벤트
     * @throws com.ryuqq.flow.core.error.EventChainException 깊이/체인 한도 초과 또는 루프 감지 시
     * @throws RuntimeException 순차 모드에서 핸들러가 실패한 경우 (원본 또는 감싼 예외)
     */
    void processEvent(Event event);

    /**
     * 중단 신호와 함께 이벤트 처리.
     *
     * <p>신호는 pipeline 미들웨어(재시도, 타임아웃 등)에 전달됩니다.
     * 디스패처 자체는 실행 중인 핸들러를 중단하지 않습니다.</p>
     */
    void processEvent(Event event, AbortSignal signal);

    /**
     * 최근 이벤트 기록 (최신순).
     *
     * @param limit 최대 개수
     * @return 최근 이벤트 기록
     */
    List<EventRecord> getRecentEvents(int limit);

    /**
     * 디스패처 통계.
     */
    DispatcherStats getStats();

    /**
     * 모든 핸들러 제거.
     */
    void clearHandlers();
}
