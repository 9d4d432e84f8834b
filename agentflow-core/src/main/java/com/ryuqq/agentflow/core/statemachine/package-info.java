/**
 * Orchestration instance state machine.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.agentflow.core.statemachine.InstanceStatus} - Instance lifecycle states</li>
 *   <li>{@link com.ryuqq.agentflow.core.statemachine.StatusTransition} - Transition validation</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * InstanceStatus status = InstanceStatus.RUNNING;
 * status = StatusTransition.transition(status, InstanceStatus.PENDING);
 * status = StatusTransition.transition(status, InstanceStatus.COMPLETED);
 *
 * // This will throw IllegalStateException
 * StatusTransition.validate(status, InstanceStatus.RUNNING);
 * </pre>
 *
 * @since 1.0.0
 * @author Agentflow Team
 */
package com.ryuqq.agentflow.core.statemachine;
