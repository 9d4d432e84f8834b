package com.ryuqq.agentflow.core.agent;

/**
 * 에이전트 한 턴의 결과.
 *
 * @param state 갱신된 세션 상태
 * @param output 응답 텍스트
 * @param <S> 세션 상태 타입
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public record AgentReply<S>(
    S state,
    String output
) {

    public AgentReply {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (output == null) {
            throw new IllegalArgumentException("output cannot be null");
        }
    }
}
