/**
 * Orchestration History model.
 *
 * <p>History is an append-only, per-instance list of {@link com.ryuqq.agentflow.core.history.HistoryEvent}
 * records with contiguous sequence numbers. The instance summary
 * ({@link com.ryuqq.agentflow.core.history.InstanceRecord}) is updated atomically with every append.</p>
 *
 * @since 1.0.0
 * @author Agentflow Team
 */
package com.ryuqq.agentflow.core.history;
