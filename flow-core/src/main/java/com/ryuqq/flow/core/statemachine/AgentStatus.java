package com.ryuqq.flow.core.statemachine;

/**
 * 에이전트 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 *            ┌──────────── schedule ────────────┐
 *            ▼                                  │
 * STOPPED ─► STARTING ─► RUNNING ─► PAUSING ─► PAUSED
 *    ▲          ▲           ▲                    │
 *    │          │           └──── RESUMING ◄─────┘
 *    │      SCHEDULED
 *    │          │
 *    └─ STOPPING ◄── RUNNING | PAUSED | SCHEDULED | ERROR
 *
 * STARTING | PAUSING | RESUMING | STOPPING ─► ERROR (실패 시)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum AgentStatus {

    /**
     * 정지 (초기 상태, 레지스트리에서 제거된 상태).
     */
    STOPPED("stopped"),

    /**
     * 시작 중.
     */
    STARTING("starting"),

    /**
     * 실행 중.
     */
    RUNNING("running"),

    /**
     * 일시정지 중.
     */
    PAUSING("pausing"),

    /**
     * 일시정지됨.
     */
    PAUSED("paused"),

    /**
     * 재개 중.
     */
    RESUMING("resuming"),

    /**
     * 정지 중.
     */
    STOPPING("stopping"),

    /**
     * 예약됨 (타이머 대기).
     */
    SCHEDULED("scheduled"),

    /**
     * 전이 도중 실패.
     */
    ERROR("error");

    private final String value;

    AgentStatus(String value) {
        this.value = value;
    }

    /**
     * 외부 표현 (소문자).
     */
    public String value() {
        return value;
    }

    /**
     * 전이 중인 상태인지 확인.
     *
     * <p>전이 중인 상태에서 실패하면 ERROR로 이동합니다.</p>
     *
     * @return STARTING, PAUSING, RESUMING, STOPPING인 경우 true
     */
    public boolean isTransitional() {
        return this == STARTING || this == PAUSING || this == RESUMING || this == STOPPING;
    }

    /**
     * 새로운 start 요청과 충돌하는 상태인지 확인.
     *
     * @return RUNNING, STARTING, PAUSING, RESUMING인 경우 true
     */
    public boolean blocksStart() {
        return this == RUNNING || this == STARTING || this == PAUSING || this == RESUMING;
    }

    @Override
    public String toString() {
        return value;
    }
}
