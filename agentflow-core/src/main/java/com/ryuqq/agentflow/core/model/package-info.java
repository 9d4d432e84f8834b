/**
 * Identifier value objects.
 *
 * <ul>
 *   <li>{@link com.ryuqq.agentflow.core.model.SessionKey} - (agentName, sessionId) address of one Session Entity</li>
 *   <li>{@link com.ryuqq.agentflow.core.model.InstanceId} - Orchestration instance identifier</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Agentflow Team
 */
package com.ryuqq.agentflow.core.model;
