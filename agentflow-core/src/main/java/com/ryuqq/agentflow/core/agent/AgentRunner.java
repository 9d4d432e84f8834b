package com.ryuqq.agentflow.core.agent;

/**
 * Agent reasoning capability.
 *
 * <p>Given the current session state and the new input, produces the reply text and the
 * updated state. Implementations wrap an external reasoning library and may throw any
 * exception; the Session Entity converts failures into
 * {@link com.ryuqq.agentflow.core.error.AdapterException} and persists nothing.</p>
 *
 * @param <S> session state type
 * @author Agentflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AgentRunner<S> {

    /**
     * Runs one agent turn.
     *
     * @param state the session state, with the new input already applied
     * @param input the raw input text
     * @return the reply text and the updated state
     * @throws Exception any failure of the underlying agent
     */
    AgentReply<S> run(S state, String input) throws Exception;
}
