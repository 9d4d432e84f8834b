package com.ryuqq.agentflow.core.history;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * History 레코드 목록 조회 유틸리티.
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public final class History {

    private History() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 아직 해소되지 않은 SCHEDULED 레코드 조회 (외부 이벤트 대기 제외).
     *
     * @param history 인스턴스 History
     * @return 해소 레코드가 없는 SCHEDULED 호출/타이머 레코드 (taskId 순)
     */
    public static List<HistoryEvent> unresolved(List<HistoryEvent> history) {
        Set<Integer> resolved = resolvedTaskIds(history);
        List<HistoryEvent> result = new ArrayList<>();
        for (HistoryEvent event : history) {
            if (event.status() == ActionStatus.SCHEDULED
                && event.kind() != ActionKind.EXTERNAL_EVENT
                && !resolved.contains(event.taskId())) {
                result.add(event);
            }
        }
        return result;
    }

    /**
     * 주어진 호출 지점이 이미 해소되었는지 확인.
     *
     * @param history 인스턴스 History
     * @param taskId 호출 지점 번호
     * @return COMPLETED 또는 FAILED 레코드가 있으면 true
     */
    public static boolean isResolved(List<HistoryEvent> history, int taskId) {
        for (HistoryEvent event : history) {
            if (event.taskId() == taskId && event.status().isResolution() && !event.isReceivedEvent()) {
                return true;
            }
        }
        return false;
    }

    /**
     * 같은 eventId를 가진 수신 이벤트가 이미 기록되었는지 확인.
     */
    public static boolean containsEvent(List<HistoryEvent> history, String eventId) {
        if (eventId == null) {
            return false;
        }
        for (HistoryEvent event : history) {
            if (event.isReceivedEvent() && eventId.equals(event.eventId())) {
                return true;
            }
        }
        return false;
    }

    /**
     * 다음에 기록할 순번.
     */
    public static long nextSequenceNo(List<HistoryEvent> history) {
        return history.isEmpty() ? 0 : history.get(history.size() - 1).sequenceNo() + 1;
    }

    private static Set<Integer> resolvedTaskIds(List<HistoryEvent> history) {
        Set<Integer> resolved = new HashSet<>();
        for (HistoryEvent event : history) {
            if (event.status().isResolution() && !event.isReceivedEvent()) {
                resolved.add(event.taskId());
            }
        }
        return resolved;
    }
}
