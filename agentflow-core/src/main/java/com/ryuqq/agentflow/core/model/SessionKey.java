package com.ryuqq.agentflow.core.model;

/**
 * 에이전트 세션(Session Entity)의 복합 식별자.
 *
 * <p>SessionKey는 {@code (agentName, sessionId)} 쌍으로 하나의 Session Entity 인스턴스를
 * 유일하게 지정합니다. 대화 저장소(Conversation Store)의 행 키로도 사용됩니다.</p>
 *
 * <p><strong>문자열 표현:</strong> {@code agentName--sessionId}</p>
 * <ul>
 *   <li>첫 번째 {@code --} 가 구분자입니다 (sessionId에는 {@code --} 포함 가능)</li>
 *   <li>agentName에는 {@code --} 를 포함할 수 없습니다</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public final class SessionKey {

    private static final String SEPARATOR = "--";

    private final String agentName;
    private final String sessionId;

    private SessionKey(String agentName, String sessionId) {
        if (agentName == null || agentName.isBlank()) {
            throw new IllegalArgumentException("agentName cannot be null or blank");
        }
        if (agentName.contains(SEPARATOR)) {
            throw new IllegalArgumentException("agentName cannot contain '" + SEPARATOR + "': " + agentName);
        }
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be null or blank");
        }
        this.agentName = agentName;
        this.sessionId = sessionId;
    }

    /**
     * SessionKey 생성.
     *
     * @param agentName 에이전트 이름 (에이전트 종류)
     * @param sessionId 세션 식별자
     * @return SessionKey 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static SessionKey of(String agentName, String sessionId) {
        return new SessionKey(agentName, sessionId);
    }

    /**
     * 문자열 표현({@code agentName--sessionId})에서 SessionKey 복원.
     *
     * @param value 문자열 표현
     * @return SessionKey 인스턴스
     * @throws IllegalArgumentException 구분자가 없거나 유효하지 않은 경우
     */
    public static SessionKey parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        int index = value.indexOf(SEPARATOR);
        if (index < 0) {
            throw new IllegalArgumentException("SessionKey must have the form agentName--sessionId: " + value);
        }
        return new SessionKey(value.substring(0, index), value.substring(index + SEPARATOR.length()));
    }

    public String getAgentName() {
        return agentName;
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * 저장소 행 키로 사용하는 문자열 표현.
     *
     * @return {@code agentName--sessionId}
     */
    public String asString() {
        return agentName + SEPARATOR + sessionId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SessionKey that = (SessionKey) o;
        return agentName.equals(that.agentName) && sessionId.equals(that.sessionId);
    }

    @Override
    public int hashCode() {
        return 31 * agentName.hashCode() + sessionId.hashCode();
    }

    @Override
    public String toString() {
        return "SessionKey{" + asString() + '}';
    }
}
