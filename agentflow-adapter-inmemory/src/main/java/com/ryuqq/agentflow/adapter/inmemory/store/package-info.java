/**
 * In-memory store adapters.
 *
 * <ul>
 *   <li>{@link com.ryuqq.agentflow.adapter.inmemory.store.InMemoryConversationStore}: session state blobs</li>
 *   <li>{@link com.ryuqq.agentflow.adapter.inmemory.store.InMemoryHistoryStore}: instance summaries and History</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Agentflow Team
 */
package com.ryuqq.agentflow.adapter.inmemory.store;
