/**
 * Orchestration client port, status view and registries.
 *
 * @since 1.0.0
 * @author Agentflow Team
 */
package com.ryuqq.agentflow.application.orchestration;
