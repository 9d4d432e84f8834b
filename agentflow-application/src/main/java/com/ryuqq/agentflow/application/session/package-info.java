/**
 * Session Entity and the agent registry.
 *
 * <p>A {@link com.ryuqq.agentflow.application.session.SessionEntity} owns the conversation state of
 * one agent kind. Writes happen only after a successful agent run.</p>
 *
 * @since 1.0.0
 * @author Agentflow Team
 */
package com.ryuqq.agentflow.application.session;
