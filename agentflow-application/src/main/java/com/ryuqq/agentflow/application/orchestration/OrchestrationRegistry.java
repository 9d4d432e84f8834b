package com.ryuqq.agentflow.application.orchestration;

import com.ryuqq.agentflow.core.error.UnknownOrchestrationException;
import com.ryuqq.agentflow.core.orchestration.Orchestration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 이름으로 찾는 Orchestration 함수 목록 (시작 시점에 구성, 불변).
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public final class OrchestrationRegistry {

    private final Map<String, Orchestration> orchestrations;

    private OrchestrationRegistry(Map<String, Orchestration> orchestrations) {
        this.orchestrations = Collections.unmodifiableMap(new LinkedHashMap<>(orchestrations));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Orchestration 조회.
     *
     * @throws UnknownOrchestrationException 등록되지 않은 이름인 경우
     */
    public Orchestration get(String name) {
        Orchestration orchestration = orchestrations.get(name);
        if (orchestration == null) {
            throw new UnknownOrchestrationException("Orchestration", name);
        }
        return orchestration;
    }

    public boolean contains(String name) {
        return orchestrations.containsKey(name);
    }

    public Set<String> names() {
        return orchestrations.keySet();
    }

    public static final class Builder {

        private final Map<String, Orchestration> orchestrations = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(String name, Orchestration orchestration) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            if (orchestration == null) {
                throw new IllegalArgumentException("orchestration cannot be null");
            }
            if (orchestrations.putIfAbsent(name, orchestration) != null) {
                throw new IllegalArgumentException("Orchestration already registered: " + name);
            }
            return this;
        }

        public OrchestrationRegistry build() {
            return new OrchestrationRegistry(orchestrations);
        }
    }
}
