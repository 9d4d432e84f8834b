package com.ryuqq.agentflow.core.agent;

/**
 * 등록 가능한 에이전트 종류 정의.
 *
 * @param name 에이전트 이름 (세션 키의 agentName)
 * @param codec 세션 상태 codec
 * @param runner 에이전트 실행기
 * @param <S> 세션 상태 타입
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public record AgentDefinition<S>(
    String name,
    SessionStateCodec<S> codec,
    AgentRunner<S> runner
) {

    public AgentDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (name.contains("--")) {
            throw new IllegalArgumentException("name cannot contain '--' (current: " + name + ")");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (runner == null) {
            throw new IllegalArgumentException("runner cannot be null");
        }
    }

    /**
     * Transcript 상태를 쓰는 에이전트 정의 생성.
     *
     * @param name 에이전트 이름
     * @param runner 에이전트 실행기
     * @return AgentDefinition 인스턴스
     */
    public static AgentDefinition<Transcript> transcript(String name, AgentRunner<Transcript> runner) {
        return new AgentDefinition<>(name, new TranscriptCodec(), runner);
    }
}
