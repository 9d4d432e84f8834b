/**
 * Messages exchanged between clients, the Event Bus and the engine.
 *
 * @since 1.0.0
 * @author Agentflow Team
 */
package com.ryuqq.agentflow.core.contract;
