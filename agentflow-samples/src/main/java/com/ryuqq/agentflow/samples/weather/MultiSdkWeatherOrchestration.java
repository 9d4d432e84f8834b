package com.ryuqq.agentflow.samples.weather;

import com.ryuqq.agentflow.core.error.InputMissingException;
import com.ryuqq.agentflow.core.orchestration.Orchestration;
import com.ryuqq.agentflow.core.orchestration.OrchestrationContext;
import com.ryuqq.agentflow.core.orchestration.Task;
import com.ryuqq.agentflow.samples.AgentCatalog;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 서로 다른 추론 라이브러리로 구현된 두 날씨 에이전트를 동시에 호출하는 Orchestration.
 *
 * <p>출력: {@code {city1_weather, city2_weather}}</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public final class MultiSdkWeatherOrchestration implements Orchestration {

    public static final String NAME = "multi_sdk_weather";

    @Override
    public Object run(OrchestrationContext ctx) {
        WeatherRequest request = ctx.getInput(WeatherRequest.class);
        if (request == null || request.city1() == null || request.city2() == null) {
            throw new InputMissingException(NAME);
        }

        Task<String> first = ctx.callAgent(AgentCatalog.OPENAI_WEATHER.agentName(), null,
            "Current weather in " + request.city1());
        Task<String> second = ctx.callAgent(AgentCatalog.PYDANTICAI_WEATHER.agentName(), null,
            "Current weather in " + request.city2());
        List<String> reports = ctx.allOf(List.of(first, second)).await();

        Map<String, String> result = new LinkedHashMap<>();
        result.put("city1_weather", reports.get(0));
        result.put("city2_weather", reports.get(1));
        return result;
    }
}
