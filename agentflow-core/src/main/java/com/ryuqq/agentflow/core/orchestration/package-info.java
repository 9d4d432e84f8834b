/**
 * Orchestration programming model.
 *
 * <p>Workflows are plain functions over an {@link com.ryuqq.agentflow.core.orchestration.OrchestrationContext}.
 * Every context call is a call site whose result is read back from History on replay.</p>
 *
 * @since 1.0.0
 * @author Agentflow Team
 */
package com.ryuqq.agentflow.core.orchestration;
