package com.ryuqq.agentflow.adapter.runner;

import com.ryuqq.agentflow.application.agent.AgentGateway;
import com.ryuqq.agentflow.application.session.AgentRegistry;
import com.ryuqq.agentflow.application.session.SessionEntity;
import com.ryuqq.agentflow.core.agent.AgentDefinition;
import com.ryuqq.agentflow.core.error.SessionBusyException;
import com.ryuqq.agentflow.core.json.JsonCodec;
import com.ryuqq.agentflow.core.model.SessionKey;
import com.ryuqq.agentflow.core.spi.ConversationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;

/**
 * 세션 엔티티 디스패처 ({@link AgentGateway} 구현체).
 *
 * <p>요청을 SessionKey별 직렬 레인에 넣어 같은 세션의 턴이 도착 순서대로 하나씩 실행되게 합니다.
 * 서로 다른 세션은 공유 풀에서 동시에 실행됩니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * submit(agentName, sessionId, input)
 *   ↓ AgentRegistry 조회 (없으면 UnknownAgentException)
 *   ↓ sessionId가 비어 있으면 무작위 UUID
 *   ↓ trySubmit(SessionKey, ...) (레인이 가득 차면 SessionBusyException)
 *   ↓ SessionEntity.run(key, input)
 * </pre>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public final class SessionEntityDispatcher implements AgentGateway {

    private static final Logger log = LoggerFactory.getLogger(SessionEntityDispatcher.class);

    private final AgentRegistry agents;
    private final Map<String, SessionEntity<?>> entities;
    private final SessionDispatcherConfig config;
    private final KeyedSerialExecutor<SessionKey> lanes;

    public SessionEntityDispatcher(AgentRegistry agents, ConversationStore store) {
        this(agents, store, JsonCodec.defaultCodec(), new SessionDispatcherConfig());
    }

    /**
     * 생성자.
     *
     * @param agents 등록된 에이전트
     * @param store 세션 상태 저장소
     * @param json JSON codec
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SessionEntityDispatcher(AgentRegistry agents, ConversationStore store, JsonCodec json,
                                   SessionDispatcherConfig config) {
        if (agents == null) {
            throw new IllegalArgumentException("agents cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (json == null) {
            throw new IllegalArgumentException("json cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.agents = agents;
        this.config = config;
        this.entities = new HashMap<>();
        for (String name : agents.names()) {
            entities.put(name, entityOf(agents.get(name), store, json));
        }
        this.lanes = new KeyedSerialExecutor<>(config.concurrency());
    }

    @Override
    public CompletableFuture<String> submit(String agentName, String sessionId, Object input) {
        if (agentName == null || agentName.isBlank()) {
            throw new IllegalArgumentException("agentName cannot be null or blank");
        }
        agents.get(agentName);
        SessionEntity<?> entity = entities.get(agentName);

        String effectiveSessionId = sessionId == null || sessionId.isBlank()
            ? UUID.randomUUID().toString()
            : sessionId;
        SessionKey key = SessionKey.of(agentName, effectiveSessionId);

        try {
            return lanes.trySubmit(key, () -> entity.run(key, input), config.maxQueuedPerSession());
        } catch (RejectedExecutionException e) {
            log.warn("Session {} is busy, rejecting turn", key.asString());
            throw new SessionBusyException(key, config.maxQueuedPerSession(), e);
        }
    }

    /**
     * 세션의 대기 턴 수 (실행 중인 턴 제외).
     */
    public int queuedTurns(SessionKey key) {
        return lanes.queuedCount(key);
    }

    /**
     * 디스패처 종료 (진행 중인 턴 완료 대기).
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        lanes.shutdown();
    }

    private static <S> SessionEntity<S> entityOf(AgentDefinition<S> definition, ConversationStore store,
                                                 JsonCodec json) {
        return SessionEntity.of(definition, store, json);
    }
}
