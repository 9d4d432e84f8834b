package com.ryuqq.agentflow.application.session;

import com.ryuqq.agentflow.core.agent.AgentDefinition;
import com.ryuqq.agentflow.core.agent.AgentReply;
import com.ryuqq.agentflow.core.agent.SessionStateCodec;
import com.ryuqq.agentflow.core.error.AdapterException;
import com.ryuqq.agentflow.core.json.JsonCodec;
import com.ryuqq.agentflow.core.model.SessionKey;
import com.ryuqq.agentflow.core.spi.ConversationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 세션 엔티티 (에이전트 종류 하나).
 *
 * <p>세션 상태를 읽고, 입력을 반영하고, 에이전트를 실행한 뒤, 성공한 경우에만
 * 갱신된 상태를 저장합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * run(key, input)
 *   ↓
 * 1. store.get(key) → 없으면 codec.initialState()
 * 2. codec.applyInput(state, input)
 * 3. runner.run(state, input) → AgentReply(updatedState, output)
 *    - 실패 시 AdapterException (4단계 생략, 상태 변경 없음)
 * 4. store.put(key, codec.serialize(updatedState))
 * 5. output 반환
 * </pre>
 *
 * <p><strong>동시성:</strong> 이 클래스 자체는 직렬화하지 않습니다.
 * 같은 세션 키에 대한 호출은 dispatcher가 한 번에 하나씩 전달해야 합니다.</p>
 *
 * @param <S> 세션 상태 타입
 * @author Agentflow Team
 * @since 1.0.0
 */
public final class SessionEntity<S> {

    private static final Logger log = LoggerFactory.getLogger(SessionEntity.class);

    private final AgentDefinition<S> definition;
    private final ConversationStore store;
    private final JsonCodec json;

    /**
     * 생성자.
     *
     * @param definition 에이전트 정의
     * @param store 대화 상태 저장소
     * @param json 구조화 입력 변환용 JSON codec
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SessionEntity(AgentDefinition<S> definition, ConversationStore store, JsonCodec json) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (json == null) {
            throw new IllegalArgumentException("json cannot be null");
        }
        this.definition = definition;
        this.store = store;
        this.json = json;
    }

    /**
     * 에이전트 정의로부터 세션 엔티티 생성.
     */
    public static <S> SessionEntity<S> of(AgentDefinition<S> definition, ConversationStore store, JsonCodec json) {
        return new SessionEntity<>(definition, store, json);
    }

    /**
     * 세션에 입력을 전달하고 응답을 반환.
     *
     * @param key 세션 키 (에이전트 이름이 이 엔티티와 같아야 함)
     * @param input 입력 (문자열이 아니면 JSON으로 변환)
     * @return 응답 텍스트
     * @throws IllegalArgumentException key가 null이거나 다른 에이전트의 키인 경우
     * @throws AdapterException 에이전트 실행 실패 시 (상태는 저장되지 않음)
     * @throws com.ryuqq.agentflow.core.error.TransientInfraException 저장소 일시 장애 시
     */
    public String run(SessionKey key, Object input) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (!definition.name().equals(key.getAgentName())) {
            throw new IllegalArgumentException(
                "SessionKey " + key.asString() + " does not belong to agent " + definition.name());
        }
        String text = input instanceof String ? (String) input : json.toJson(input);
        SessionStateCodec<S> codec = definition.codec();

        // 1. 상태 로드 (없으면 초기 상태)
        S state = store.get(key).map(codec::deserialize).orElseGet(codec::initialState);

        // 2. 입력 반영
        S withInput = codec.applyInput(state, text);

        // 3. 에이전트 실행 (실패 시 저장하지 않음)
        AgentReply<S> reply;
        try {
            reply = definition.runner().run(withInput, text);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AdapterException(key, e);
        } catch (Exception e) {
            log.warn("Agent run failed for {}, session state left unchanged: {}", key.asString(), e.getMessage());
            throw new AdapterException(key, e);
        }
        if (reply == null) {
            throw new AdapterException(key, new IllegalStateException("runner returned no reply"));
        }

        // 4. 저장
        store.put(key, codec.serialize(reply.state()));
        log.debug("Session {} updated", key.asString());

        // 5. 응답 반환
        return reply.output();
    }

    public String getAgentName() {
        return definition.name();
    }
}
