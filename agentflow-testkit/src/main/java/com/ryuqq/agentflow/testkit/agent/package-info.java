/**
 * Agent test doubles.
 *
 * @since 1.0.0
 * @author Agentflow Team
 */
package com.ryuqq.agentflow.testkit.agent;
