package com.ryuqq.flow.core.handler;

import com.ryuqq.flow.core.model.Event;

/**
 * 핸들러 실행 결과.
 *
 * <p>재디스패치 여부를 타입으로 구분합니다.</p>
 * <ul>
 *   <li>{@link None}: 후속 이벤트 없음</li>
 *   <li>{@link ReEmit}: 이벤트를 같은 체인에서 재귀 디스패치</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface HandlerResult permits HandlerResult.None, HandlerResult.ReEmit {

    static HandlerResult none() {
        return None.INSTANCE;
    }

    static HandlerResult reEmit(Event event) {
        return new ReEmit(event);
    }

    /**
     * 후속 이벤트 없음.
     */
    final class None implements HandlerResult {

        private static final None INSTANCE = new None();

        private None() {
        }

        @Override
        public String toString() {
            return "HandlerResult.None";
        }
    }

    /**
     * 후속 이벤트 재디스패치.
     *
     * @param event 재디스패치할 이벤트 (null 불가)
     */
    record ReEmit(Event event) implements HandlerResult {

        public ReEmit {
            if (event == null) {
                throw new IllegalArgumentException("event cannot be null");
            }
        }
    }
}
