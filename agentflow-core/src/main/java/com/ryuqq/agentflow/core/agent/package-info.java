/**
 * Agent runner capability and session state codecs.
 *
 * <p>An agent kind is an {@link com.ryuqq.agentflow.core.agent.AgentDefinition}: a name, a
 * {@link com.ryuqq.agentflow.core.agent.SessionStateCodec} and an
 * {@link com.ryuqq.agentflow.core.agent.AgentRunner}. The reasoning itself is opaque.</p>
 *
 * @since 1.0.0
 * @author Agentflow Team
 */
package com.ryuqq.agentflow.core.agent;
