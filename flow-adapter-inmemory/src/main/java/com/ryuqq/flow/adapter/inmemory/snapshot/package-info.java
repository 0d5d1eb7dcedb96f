/**
 * In-memory snapshot persistence used by agent pause/resume.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.flow.adapter.inmemory.snapshot;
