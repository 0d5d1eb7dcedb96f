package com.ryuqq.flow.core.statemachine;

import java.util.EnumSet;
import java.util.Set;

/**
 * 에이전트 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>STOPPED → STARTING, SCHEDULED</li>
 *   <li>STARTING → RUNNING, ERROR</li>
 *   <li>RUNNING → PAUSING, STOPPING</li>
 *   <li>PAUSING → PAUSED, ERROR</li>
 *   <li>PAUSED → RESUMING, STOPPING</li>
 *   <li>RESUMING → RUNNING, ERROR</li>
 *   <li>STOPPING → STOPPED, ERROR</li>
 *   <li>SCHEDULED → STARTING, STOPPING, SCHEDULED (재예약)</li>
 *   <li>ERROR → STARTING (재시작), STOPPING</li>
 * </ul>
 *
 * <p>검증에 실패하면 호출자는 상태를 변경하지 않아야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StatusTransition {

    // Utility class - prevent instantiation
    private StatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws InvalidStatusTransitionException 허용되지 않은 전이인 경우
     */
    public static void validate(AgentStatus from, AgentStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Statuses cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (!allowedTargets(from).contains(to)) {
            throw new InvalidStatusTransitionException(from, to);
        }
    }

    /**
     * 전이 가능 여부.
     *
     * @return 허용된 전이이면 true
     */
    public static boolean isAllowed(AgentStatus from, AgentStatus to) {
        return from != null && to != null && allowedTargets(from).contains(to);
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws InvalidStatusTransitionException 유효하지 않은 전이인 경우
     */
    public static AgentStatus transition(AgentStatus current, AgentStatus next) {
        validate(current, next);
        return next;
    }

    /**
     * 주어진 상태에서 이동 가능한 상태 집합.
     */
    public static Set<AgentStatus> allowedTargets(AgentStatus from) {
        return switch (from) {
            case STOPPED -> EnumSet.of(AgentStatus.STARTING, AgentStatus.SCHEDULED);
            case STARTING -> EnumSet.of(AgentStatus.RUNNING, AgentStatus.ERROR);
            case RUNNING -> EnumSet.of(AgentStatus.PAUSING, AgentStatus.STOPPING);
            case PAUSING -> EnumSet.of(AgentStatus.PAUSED, AgentStatus.ERROR);
            case PAUSED -> EnumSet.of(AgentStatus.RESUMING, AgentStatus.STOPPING);
            case RESUMING -> EnumSet.of(AgentStatus.RUNNING, AgentStatus.ERROR);
            case STOPPING -> EnumSet.of(AgentStatus.STOPPED, AgentStatus.ERROR);
            case SCHEDULED -> EnumSet.of(AgentStatus.STARTING, AgentStatus.STOPPING, AgentStatus.SCHEDULED);
            case ERROR -> EnumSet.of(AgentStatus.STARTING, AgentStatus.STOPPING);
        };
    }
}
