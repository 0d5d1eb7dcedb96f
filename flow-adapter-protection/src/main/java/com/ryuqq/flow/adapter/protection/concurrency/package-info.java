/**
 * 키 단위 동시 실행 제한 (Bulkhead) 미들웨어.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.flow.adapter.protection.concurrency;
