package com.ryuqq.agentflow.core.agent;

import com.ryuqq.agentflow.core.json.JsonCodec;

/**
 * {@link Transcript} 세션 상태 codec.
 *
 * <p>상태는 {@code {"turns":[{"role":"user","content":"..."}]}} 형태의 JSON으로 저장되고,
 * 입력은 user 턴으로 추가됩니다.</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public final class TranscriptCodec implements SessionStateCodec<Transcript> {

    private final JsonCodec json;

    public TranscriptCodec() {
        this(JsonCodec.defaultCodec());
    }

    public TranscriptCodec(JsonCodec json) {
        if (json == null) {
            throw new IllegalArgumentException("json cannot be null");
        }
        this.json = json;
    }

    @Override
    public Transcript initialState() {
        return Transcript.empty();
    }

    @Override
    public String serialize(Transcript state) {
        return json.toJson(state);
    }

    @Override
    public Transcript deserialize(String blob) {
        return json.fromJson(blob, Transcript.class);
    }

    @Override
    public Transcript applyInput(Transcript state, String input) {
        return state.append(Turn.user(input));
    }
}
