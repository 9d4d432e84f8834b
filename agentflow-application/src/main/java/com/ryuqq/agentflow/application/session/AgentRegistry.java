package com.ryuqq.agentflow.application.session;

import com.ryuqq.agentflow.core.agent.AgentDefinition;
import com.ryuqq.agentflow.core.error.UnknownAgentException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 시작 시점에 명시적으로 구성되는 에이전트 종류 목록.
 *
 * <p>같은 이름을 두 번 등록하면 실패합니다. 생성 후에는 변경할 수 없습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * AgentRegistry registry = AgentRegistry.builder()
 *     .register(AgentDefinition.transcript("haiku_agent", haikuRunner))
 *     .build();
 * </pre>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public final class AgentRegistry {

    private final Map<String, AgentDefinition<?>> definitions;

    private AgentRegistry(Map<String, AgentDefinition<?>> definitions) {
        this.definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 에이전트 정의 조회.
     *
     * @param agentName 에이전트 이름
     * @return 에이전트 정의
     * @throws UnknownAgentException 등록되지 않은 이름인 경우
     */
    public AgentDefinition<?> get(String agentName) {
        AgentDefinition<?> definition = definitions.get(agentName);
        if (definition == null) {
            throw new UnknownAgentException(agentName);
        }
        return definition;
    }

    public boolean contains(String agentName) {
        return definitions.containsKey(agentName);
    }

    public Set<String> names() {
        return definitions.keySet();
    }

    /**
     * AgentRegistry 빌더.
     */
    public static final class Builder {

        private final Map<String, AgentDefinition<?>> definitions = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * 에이전트 정의 등록.
         *
         * @throws IllegalArgumentException definition이 null이거나 이름이 중복된 경우
         */
        public Builder register(AgentDefinition<?> definition) {
            if (definition == null) {
                throw new IllegalArgumentException("definition cannot be null");
            }
            if (definitions.putIfAbsent(definition.name(), definition) != null) {
                throw new IllegalArgumentException("Agent already registered: " + definition.name());
            }
            return this;
        }

        public AgentRegistry build() {
            return new AgentRegistry(definitions);
        }
    }
}
