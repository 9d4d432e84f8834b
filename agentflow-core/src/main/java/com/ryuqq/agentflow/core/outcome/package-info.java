/**
 * Replay outcome types.
 *
 * <p>{@link com.ryuqq.agentflow.core.outcome.ReplayOutcome} is a sealed interface over
 * {@code Completed}, {@code Suspended} and {@code Failed}. The engine maps each outcome to
 * an instance status transition and a History append.</p>
 *
 * @since 1.0.0
 * @author Agentflow Team
 */
package com.ryuqq.agentflow.core.outcome;
