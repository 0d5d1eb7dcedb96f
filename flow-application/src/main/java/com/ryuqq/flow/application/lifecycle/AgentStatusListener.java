package com.ryuqq.flow.application.lifecycle;

/**
 * 상태 변경 리스너.
 *
 * <p>리스너 실패는 로깅만 되며 이미 적용된 전이를 되돌리지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AgentStatusListener {

    void onStatusChanged(AgentStatusChanged change);
}
