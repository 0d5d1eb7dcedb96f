package com.ryuqq.flow.application.lifecycle;

/**
 * 생명주기 명령 종류.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum LifecycleOperation {
    START,
    STOP,
    PAUSE,
    RESUME,
    SCHEDULE
}
