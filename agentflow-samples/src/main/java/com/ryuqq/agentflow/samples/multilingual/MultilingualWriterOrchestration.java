package com.ryuqq.agentflow.samples.multilingual;

import com.ryuqq.agentflow.core.error.InputMissingException;
import com.ryuqq.agentflow.core.orchestration.Orchestration;
import com.ryuqq.agentflow.core.orchestration.OrchestrationContext;
import com.ryuqq.agentflow.core.orchestration.Task;
import com.ryuqq.agentflow.samples.AgentCatalog;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 영어 문단 작성 후 프랑스어 / 스페인어 번역으로 fan-out 하는 Orchestration.
 *
 * <p>출력: {@code {english, french, spanish}}</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public final class MultilingualWriterOrchestration implements Orchestration {

    public static final String NAME = "multilingual_writer";

    @Override
    public Object run(OrchestrationContext ctx) {
        String topic = ctx.getInput(String.class);
        if (topic == null || topic.isBlank()) {
            throw new InputMissingException(NAME);
        }

        String english = ctx.callAgent(AgentCatalog.ENGLISH_PARAGRAPH_WRITER.agentName(), null, topic).await();

        Task<String> french = ctx.callAgent(AgentCatalog.FRENCH_TRANSLATOR.agentName(), null, english);
        Task<String> spanish = ctx.callAgent(AgentCatalog.SPANISH_TRANSLATOR.agentName(), null, english);
        List<String> translations = ctx.allOf(List.of(french, spanish)).await();

        Map<String, String> result = new LinkedHashMap<>();
        result.put("english", english);
        result.put("french", translations.get(0));
        result.put("spanish", translations.get(1));
        return result;
    }
}
