package com.ryuqq.agentflow.core.orchestration;

/**
 * Stateless, side-effecting function called from an orchestration.
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Activity {

    /**
     * Runs the activity.
     *
     * @param input the input as JSON text
     * @return the result, serialized to JSON in the caller's History
     * @throws Exception any failure; recorded as a FAILED record
     */
    Object run(String input) throws Exception;
}
