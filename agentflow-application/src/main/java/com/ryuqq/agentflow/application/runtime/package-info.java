/**
 * Runtime abstraction for queue-polling components.
 *
 * @since 1.0.0
 * @author Agentflow Team
 */
package com.ryuqq.agentflow.application.runtime;
