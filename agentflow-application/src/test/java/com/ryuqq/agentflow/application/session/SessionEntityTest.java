package com.ryuqq.agentflow.application.session;

import com.ryuqq.agentflow.core.agent.AgentDefinition;
import com.ryuqq.agentflow.core.agent.AgentReply;
import com.ryuqq.agentflow.core.agent.AgentRunner;
import com.ryuqq.agentflow.core.agent.Transcript;
import com.ryuqq.agentflow.core.agent.TranscriptCodec;
import com.ryuqq.agentflow.core.agent.Turn;
import com.ryuqq.agentflow.core.error.AdapterException;
import com.ryuqq.agentflow.core.error.TransientInfraException;
import com.ryuqq.agentflow.core.json.JsonCodec;
import com.ryuqq.agentflow.core.model.SessionKey;
import com.ryuqq.agentflow.core.spi.ConversationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * SessionEntity 유닛 테스트.
 *
 * <p>상태 로드 → 입력 반영 → 실행 → 저장 순서와 실패 시 무저장을 검증합니다.</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class SessionEntityTest {

    private static final SessionKey KEY = SessionKey.of("haiku_agent", "s1");

    @Mock
    private ConversationStore store;

    @Mock
    private AgentRunner<Transcript> runner;

    private final TranscriptCodec codec = new TranscriptCodec();
    private SessionEntity<Transcript> entity;

    @BeforeEach
    void setUp() {
        entity = SessionEntity.of(new AgentDefinition<>("haiku_agent", codec, runner), store, JsonCodec.defaultCodec());
    }

    @Test
    void 첫_호출은_초기_상태에_user_턴을_추가하여_실행하고_저장한다() throws Exception {
        // given
        when(store.get(KEY)).thenReturn(Optional.empty());
        when(runner.run(any(), eq("rain"))).thenAnswer(invocation -> {
            Transcript state = invocation.getArgument(0);
            return new AgentReply<>(state.append(Turn.assistant("Soft rain on the roof")), "Soft rain on the roof");
        });

        // when
        String output = entity.run(KEY, "rain");

        // then
        assertThat(output).isEqualTo("Soft rain on the roof");
        ArgumentCaptor<String> saved = ArgumentCaptor.forClass(String.class);
        verify(store).put(eq(KEY), saved.capture());
        Transcript persisted = codec.deserialize(saved.getValue());
        assertThat(persisted.turns()).containsExactly(Turn.user("rain"), Turn.assistant("Soft rain on the roof"));
    }

    @Test
    void 기존_상태가_있으면_이어서_대화한다() throws Exception {
        // given
        Transcript previous = Transcript.empty().append(Turn.user("hi")).append(Turn.assistant("hello"));
        when(store.get(KEY)).thenReturn(Optional.of(codec.serialize(previous)));
        when(runner.run(any(), anyString())).thenAnswer(invocation -> {
            Transcript state = invocation.getArgument(0);
            return new AgentReply<>(state.append(Turn.assistant("turns=" + state.size())), "turns=" + state.size());
        });

        // when
        String output = entity.run(KEY, "again");

        // then
        assertThat(output).isEqualTo("turns=3");
    }

    @Test
    void 구조화_입력은_JSON_문자열로_전달된다() throws Exception {
        // given
        when(store.get(KEY)).thenReturn(Optional.empty());
        when(runner.run(any(), anyString())).thenAnswer(invocation ->
            new AgentReply<>(invocation.<Transcript>getArgument(0), invocation.getArgument(1)));

        // when
        String output = entity.run(KEY, Map.of("city", "Seoul"));

        // then
        assertThat(output).isEqualTo("{\"city\":\"Seoul\"}");
    }

    @Test
    void 실행_실패시_AdapterException을_던지고_저장하지_않는다() throws Exception {
        // given
        when(store.get(KEY)).thenReturn(Optional.empty());
        when(runner.run(any(), anyString())).thenThrow(new IllegalStateException("model overloaded"));

        // when & then
        assertThatThrownBy(() -> entity.run(KEY, "rain"))
            .isInstanceOf(AdapterException.class)
            .hasMessageContaining("haiku_agent--s1")
            .hasMessageContaining("model overloaded")
            .hasCauseInstanceOf(IllegalStateException.class)
            .satisfies(e -> assertThat(((AdapterException) e).isRetryable()).isTrue());
        verify(store, never()).put(any(), any());
    }

    @Test
    void 저장소_일시_장애는_그대로_전파된다() {
        // given
        when(store.get(KEY)).thenThrow(new TransientInfraException("store unavailable"));

        // when & then
        assertThatThrownBy(() -> entity.run(KEY, "rain"))
            .isInstanceOf(TransientInfraException.class);
        verifyNoInteractions(runner);
    }

    @Test
    void 다른_에이전트의_세션_키는_거부된다() {
        assertThatThrownBy(() -> entity.run(SessionKey.of("other_agent", "s1"), "rain"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("does not belong");
    }
}
