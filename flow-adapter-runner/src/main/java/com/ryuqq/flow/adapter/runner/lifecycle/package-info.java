/**
 * 에이전트 생명주기 관리 구현.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.flow.adapter.runner.lifecycle;
