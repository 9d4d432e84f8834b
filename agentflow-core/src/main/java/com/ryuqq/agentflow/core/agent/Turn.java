package com.ryuqq.agentflow.core.agent;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 대화 기록의 한 턴.
 *
 * @param role 발화자 (user 또는 assistant)
 * @param content 내용
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public record Turn(
    String role,
    String content
) {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    @JsonCreator
    public Turn(@JsonProperty("role") String role, @JsonProperty("content") String content) {
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("role cannot be null or blank");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        this.role = role;
        this.content = content;
    }

    public static Turn user(String content) {
        return new Turn(USER, content);
    }

    public static Turn assistant(String content) {
        return new Turn(ASSISTANT, content);
    }
}
