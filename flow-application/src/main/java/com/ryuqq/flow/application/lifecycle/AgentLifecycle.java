package com.ryuqq.flow.application.lifecycle;

import com.ryuqq.flow.core.statemachine.AgentStatus;

import java.util.List;
import java.util.Optional;

/**
 * 에이전트 생명주기 관리.
 *
 * <p>(tenantId, agentName) 단위 레지스트리 항목의 상태를
 * {@link com.ryuqq.flow.core.statemachine.StatusTransition} 전이 표에 따라 구동합니다.</p>
 *
 * <p><strong>명령별 동작:</strong></p>
 * <ul>
 *   <li>start: RUNNING/STARTING/PAUSING/RESUMING이면 충돌, 아니면 RUNNING으로</li>
 *   <li>stop: 항목이 없거나 STOPPED이면 "already stopped" 결과 반환 (멱등)</li>
 *   <li>pause: RUNNING에서만, 선택적으로 스냅샷 저장</li>
 *   <li>resume: PAUSED에서만, 스냅샷/컨텍스트 병합</li>
 *   <li>schedule: 타이머를 등록하고 실행 시 start, repeat이면 재등록</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface AgentLifecycle extends AutoCloseable {

    /**
     * 에이전트 시작.
     *
     * @throws com.ryuqq.flow.core.error.LifecycleConflictException 이미 활성 상태인 경우
     */
    LifecycleResult start(StartAgentCommand command);

    /**
     * 에이전트 정지.
     */
    LifecycleResult stop(StopAgentCommand command);

    /**
     * 에이전트 일시정지.
     *
     * @throws com.ryuqq.flow.core.error.AgentNotFoundException 항목이 없는 경우
     * @throws com.ryuqq.flow.core.statemachine.InvalidStatusTransitionException RUNNING이 아닌 경우
     */
    LifecycleResult pause(PauseAgentCommand command);

    /**
     * 에이전트 재개.
     *
     * @throws com.ryuqq.flow.core.error.AgentNotFoundException 항목이 없는 경우
     * @throws com.ryuqq.flow.core.statemachine.InvalidStatusTransitionException PAUSED가 아닌 경우
     */
    LifecycleResult resume(ResumeAgentCommand command);

    /**
     * 에이전트 실행 예약.
     *
     * @throws com.ryuqq.flow.core.statemachine.InvalidStatusTransitionException 예약할 수 없는 상태인 경우
     */
    LifecycleResult schedule(ScheduleAgentCommand command);

    /**
     * 에이전트 상태 조회.
     */
    Optional<AgentInfo> getAgentStatus(String agentName, String tenantId);

    /**
     * 테넌트의 에이전트 목록.
     */
    List<AgentInfo> listAgentsByTenant(String tenantId);

    /**
     * 특정 상태의 에이전트 목록.
     */
    List<AgentInfo> listAgentsByStatus(AgentStatus status);

    /**
     * 집계 통계.
     */
    LifecycleStats getStats();

    /**
     * 상태 변경 리스너 등록.
     *
     * @return 등록 해제용 핸들
     */
    Runnable addStatusListener(AgentStatusListener listener);

    /**
     * 실행/일시정지/예약 중인 모든 에이전트를 최선 노력으로 정지하고 레지스트리를 비움.
     *
     * <p>개별 정지 실패는 로깅만 하고 계속 진행합니다.</p>
     */
    void dispose();

    @Override
    default void close() {
        dispose();
    }
}
