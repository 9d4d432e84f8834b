package com.ryuqq.agentflow.core.model;

/**
 * Orchestration 인스턴스의 전역 고유 식별자.
 *
 * <p>클라이언트가 상태 조회 및 외부 이벤트 전달 시 사용하며,
 * 하위 Orchestration은 {@code parentId:taskId} 형태로 결정적으로 생성됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 콜론(:)만 허용</li>
 * </ul>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public final class InstanceId {

    private final String value;

    private InstanceId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("InstanceId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("InstanceId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_:]+$")) {
            throw new IllegalArgumentException(
                "InstanceId contains invalid characters. Only alphanumeric, hyphen, underscore and colon are allowed");
        }
        this.value = value;
    }

    /**
     * InstanceId 생성.
     *
     * @param value InstanceId 값
     * @return InstanceId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static InstanceId of(String value) {
        return new InstanceId(value);
    }

    /**
     * 하위 Orchestration 식별자 생성.
     *
     * <p>동일한 부모와 호출 지점(taskId)은 항상 동일한 식별자를 만듭니다.</p>
     *
     * @param taskId 부모 Orchestration 내 호출 지점 번호
     * @return 하위 InstanceId
     */
    public InstanceId child(int taskId) {
        return new InstanceId(value + ":" + taskId);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InstanceId that = (InstanceId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "InstanceId{" + value + '}';
    }
}
