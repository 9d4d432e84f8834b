/**
 * Error taxonomy.
 *
 * <p>Every domain failure extends {@link com.ryuqq.agentflow.core.error.DurableAgentException},
 * which carries an error code and a retryable flag.</p>
 *
 * <h2>Propagation Policy</h2>
 * <ul>
 *   <li>Session Entity failures never persist partial state</li>
 *   <li>A failed fan-out branch never corrupts the recorded results of its siblings</li>
 *   <li>{@link com.ryuqq.agentflow.core.error.EventMismatchException} is logged, not propagated</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Agentflow Team
 */
package com.ryuqq.agentflow.core.error;
