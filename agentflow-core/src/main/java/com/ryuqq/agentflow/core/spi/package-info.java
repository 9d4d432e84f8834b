/**
 * Service Provider Interfaces (SPI) for durable storage and messaging.
 *
 * <p>The engine and the Session Entity depend only on these interfaces. The
 * {@code agentflow-adapter-inmemory} module provides reference implementations, and the
 * {@code agentflow-testkit} module provides contract tests every implementation must pass.</p>
 *
 * <h2>SPIs</h2>
 * <ul>
 *   <li>{@link com.ryuqq.agentflow.core.spi.ConversationStore}: per-session state blobs</li>
 *   <li>{@link com.ryuqq.agentflow.core.spi.HistoryStore}: instance summaries and History</li>
 *   <li>{@link com.ryuqq.agentflow.core.spi.EventBus}: at-least-once external event delivery</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Agentflow Team
 */
package com.ryuqq.agentflow.core.spi;
