package com.ryuqq.agentflow.application.agent;

import com.ryuqq.agentflow.core.error.DurableAgentException;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Entry point for running one turn of an agent session.
 *
 * <p>Calls for the same session are executed strictly one at a time in receipt order;
 * calls for different sessions may run concurrently.</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public interface AgentGateway {

    /**
     * Submits one turn to a session.
     *
     * @param agentName the registered agent name
     * @param sessionId the session id (a random id is generated when blank)
     * @param input the input (serialized to JSON when not a String)
     * @return a future completing with the reply text, or exceptionally with a {@link DurableAgentException}
     * @throws com.ryuqq.agentflow.core.error.UnknownAgentException if the agent is not registered
     * @throws com.ryuqq.agentflow.core.error.SessionBusyException if the session queue is full
     */
    CompletableFuture<String> submit(String agentName, String sessionId, Object input);

    /**
     * Runs one turn and blocks until the reply is available.
     *
     * @return the reply text
     * @throws DurableAgentException on failure; check {@link DurableAgentException#isRetryable()}
     */
    default String runAgent(String agentName, String sessionId, Object input) {
        try {
            return submit(agentName, sessionId, input).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Agent run failed: " + agentName, cause);
        } catch (CancellationException e) {
            throw new IllegalStateException("Agent run cancelled: " + agentName, e);
        }
    }
}
