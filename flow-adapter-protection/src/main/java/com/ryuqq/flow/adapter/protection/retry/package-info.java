/**
 * 재시도 미들웨어와 백오프 계산.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.flow.adapter.protection.retry;
