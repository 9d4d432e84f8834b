/**
 * In-memory Event Bus adapter.
 *
 * <p>{@link com.ryuqq.agentflow.adapter.inmemory.bus.InMemoryEventBus} simulates an at-least-once
 * queue with delayed delivery, visibility timeout and a Dead Letter Queue. It is intended for
 * tests and single-process deployments.</p>
 *
 * @since 1.0.0
 * @author Agentflow Team
 */
package com.ryuqq.agentflow.adapter.inmemory.bus;
