package com.ryuqq.agentflow.core.history;

import com.ryuqq.agentflow.core.model.InstanceId;

/**
 * 하위 Orchestration이 결과를 돌려줄 부모 호출 지점.
 *
 * @param parentId 부모 인스턴스 ID
 * @param taskId 부모 내 호출 지점 번호
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public record ParentLink(
    InstanceId parentId,
    int taskId
) {

    public ParentLink {
        if (parentId == null) {
            throw new IllegalArgumentException("parentId cannot be null");
        }
        if (taskId < 0) {
            throw new IllegalArgumentException("taskId cannot be negative (current: " + taskId + ")");
        }
    }
}
