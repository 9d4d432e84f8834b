/**
 * Deterministic replay scheduler.
 *
 * <p>{@link com.ryuqq.agentflow.core.replay.ReplayContext#replay} re-runs an orchestration function
 * against its History and returns a {@link com.ryuqq.agentflow.core.outcome.ReplayOutcome}. It performs
 * no I/O; the engine persists and dispatches the returned actions.</p>
 *
 * @since 1.0.0
 * @author Agentflow Team
 */
package com.ryuqq.agentflow.core.replay;
