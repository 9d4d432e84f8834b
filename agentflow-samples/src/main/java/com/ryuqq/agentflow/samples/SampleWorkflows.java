package com.ryuqq.agentflow.samples;

import com.ryuqq.agentflow.application.agent.AgentRunOrchestration;
import com.ryuqq.agentflow.application.orchestration.ActivityRegistry;
import com.ryuqq.agentflow.application.orchestration.OrchestrationRegistry;
import com.ryuqq.agentflow.core.json.JsonCodec;
import com.ryuqq.agentflow.samples.multilingual.MultilingualWriterOrchestration;
import com.ryuqq.agentflow.samples.travel.BookTravelActivity;
import com.ryuqq.agentflow.samples.travel.TravelPlannerOrchestration;
import com.ryuqq.agentflow.samples.weather.MultiSdkWeatherOrchestration;

/**
 * 샘플 Orchestration / Activity 등록 헬퍼.
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public final class SampleWorkflows {

    private SampleWorkflows() {
    }

    public static OrchestrationRegistry orchestrations() {
        return orchestrations(JsonCodec.defaultCodec());
    }

    /**
     * 샘플 Orchestration 전체 등록.
     *
     * @param json 에이전트 JSON 응답 파싱에 쓸 codec
     * @return OrchestrationRegistry 인스턴스
     */
    public static OrchestrationRegistry orchestrations(JsonCodec json) {
        return OrchestrationRegistry.builder()
            .register(AgentRunOrchestration.NAME, new AgentRunOrchestration())
            .register(MultilingualWriterOrchestration.NAME, new MultilingualWriterOrchestration())
            .register(TravelPlannerOrchestration.NAME, new TravelPlannerOrchestration(json))
            .register(MultiSdkWeatherOrchestration.NAME, new MultiSdkWeatherOrchestration())
            .build();
    }

    public static ActivityRegistry activities() {
        return ActivityRegistry.builder()
            .register(BookTravelActivity.NAME, new BookTravelActivity())
            .build();
    }
}
