package com.ryuqq.agentflow.core.agent;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * 순서가 있는 대화 기록 (불변).
 *
 * <p>세션 상태의 기본 형태입니다. 새 턴을 추가하면 새 인스턴스가 반환됩니다.</p>
 *
 * @param turns 턴 목록 (오래된 순)
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public record Transcript(
    List<Turn> turns
) {

    @JsonCreator
    public Transcript(@JsonProperty("turns") List<Turn> turns) {
        this.turns = turns == null ? List.of() : List.copyOf(turns);
    }

    public static Transcript empty() {
        return new Transcript(List.of());
    }

    /**
     * 턴을 추가한 새 Transcript 반환.
     *
     * @param turn 추가할 턴
     * @return 새 Transcript
     */
    public Transcript append(Turn turn) {
        if (turn == null) {
            throw new IllegalArgumentException("turn cannot be null");
        }
        List<Turn> next = new ArrayList<>(turns);
        next.add(turn);
        return new Transcript(next);
    }

    @JsonIgnore
    public int size() {
        return turns.size();
    }

    /**
     * 마지막 턴 (없으면 null).
     */
    @JsonIgnore
    public Turn last() {
        return turns.isEmpty() ? null : turns.get(turns.size() - 1);
    }
}
