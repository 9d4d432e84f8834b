package com.ryuqq.agentflow.application.orchestration;

import com.ryuqq.agentflow.core.error.UnknownOrchestrationException;
import com.ryuqq.agentflow.core.orchestration.Activity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 이름으로 찾는 Activity 목록 (시작 시점에 구성, 불변).
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public final class ActivityRegistry {

    private final Map<String, Activity> activities;

    private ActivityRegistry(Map<String, Activity> activities) {
        this.activities = Collections.unmodifiableMap(new LinkedHashMap<>(activities));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ActivityRegistry empty() {
        return new ActivityRegistry(Map.of());
    }

    /**
     * Activity 조회.
     *
     * @throws UnknownOrchestrationException 등록되지 않은 이름인 경우
     */
    public Activity get(String name) {
        Activity activity = activities.get(name);
        if (activity == null) {
            throw new UnknownOrchestrationException("Activity", name);
        }
        return activity;
    }

    public boolean contains(String name) {
        return activities.containsKey(name);
    }

    public static final class Builder {

        private final Map<String, Activity> activities = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(String name, Activity activity) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            if (activity == null) {
                throw new IllegalArgumentException("activity cannot be null");
            }
            if (activities.putIfAbsent(name, activity) != null) {
                throw new IllegalArgumentException("Activity already registered: " + name);
            }
            return this;
        }

        public ActivityRegistry build() {
            return new ActivityRegistry(activities);
        }
    }
}
