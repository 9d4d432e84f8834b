package com.ryuqq.agentflow.samples;

import com.ryuqq.agentflow.application.session.AgentRegistry;
import com.ryuqq.agentflow.core.agent.AgentDefinition;
import com.ryuqq.agentflow.core.agent.AgentRunner;
import com.ryuqq.agentflow.core.agent.Transcript;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;

/**
 * 샘플 워크플로우가 사용하는 에이전트 목록.
 *
 * <p>각 항목은 세션 키에 쓰이는 에이전트 이름과 모델에 전달할 지시문을 가집니다.
 * 실제 추론 라이브러리 바인딩은 {@link #registry(Function)}의 runnerFactory가 결정합니다.</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public enum AgentCatalog {

    HAIKU("haiku_agent",
        "You are a haiku poet. Respond to the user's question with a haiku."),
    ENGLISH_PARAGRAPH_WRITER("english_paragraph_writer_agent",
        "You are an expert paragraph writer. Write a detailed paragraph based on the user's input."),
    FRENCH_TRANSLATOR("french_translator_agent",
        "You are a French translator. Translate the user's input into French."),
    SPANISH_TRANSLATOR("spanish_translator_agent",
        "You are a Spanish translator. Translate the user's input into Spanish."),
    DESTINATION_EXPERT("destination_expert_agent",
        "You are a travel destination expert. Recommend 3 destinations with a name, a short description, "
            + "a short reasoning and a match score (0-100). Always respond with valid JSON: "
            + "{\"recommendations\": [{\"destination_name\": \"\", \"description\": \"\", "
            + "\"reasoning\": \"\", \"match_score\": 0}]}"),
    ITINERARY_PLANNER("itinerary_planner_agent",
        "Create a concise daily itinerary with at most 3 activities per day and simple cost estimates. "
            + "Always respond with valid JSON: {\"destination_name\": \"\", \"travel_dates\": \"\", "
            + "\"daily_plan\": [{\"day\": 1, \"date\": \"\", \"activities\": [{\"time\": \"\", "
            + "\"activity_name\": \"\", \"description\": \"\", \"location\": \"\", \"estimated_cost\": \"\"}]}], "
            + "\"estimated_total_cost\": \"\", \"additional_notes\": \"\"}"),
    LOCAL_RECOMMENDATIONS("local_recommendations_agent",
        "Provide brief local recommendations: at most 3 attractions, at most 3 restaurants and insider tips. "
            + "Always respond with valid JSON: {\"attractions\": [{\"name\": \"\", \"category\": \"\", "
            + "\"description\": \"\", \"location\": \"\", \"visit_duration\": \"\", \"estimated_cost\": \"\", "
            + "\"rating\": 4.5}], \"restaurants\": [{\"name\": \"\", \"cuisine\": \"\", \"description\": \"\", "
            + "\"location\": \"\", \"price_range\": \"\", \"rating\": 4.5}], \"insider_tips\": \"\"}"),
    OPENAI_WEATHER("openai_weather_agent",
        "You are an expert in weather information."),
    PYDANTICAI_WEATHER("pydanticai_weather_agent",
        "You are an expert in weather information.");

    private final String agentName;
    private final String instructions;

    AgentCatalog(String agentName, String instructions) {
        this.agentName = agentName;
        this.instructions = instructions;
    }

    public String agentName() {
        return agentName;
    }

    public String instructions() {
        return instructions;
    }

    /**
     * 에이전트 이름으로 항목 조회.
     *
     * @param agentName 에이전트 이름
     * @return 항목 (없으면 empty)
     */
    public static Optional<AgentCatalog> byName(String agentName) {
        return Arrays.stream(values())
            .filter(entry -> entry.agentName.equals(agentName))
            .findFirst();
    }

    /**
     * 전체 목록을 Transcript 상태 에이전트로 등록한 AgentRegistry 생성.
     *
     * @param runnerFactory 항목별 에이전트 실행기 생성 함수
     * @return AgentRegistry 인스턴스
     * @throws IllegalArgumentException runnerFactory가 null인 경우
     */
    public static AgentRegistry registry(Function<AgentCatalog, AgentRunner<Transcript>> runnerFactory) {
        if (runnerFactory == null) {
            throw new IllegalArgumentException("runnerFactory cannot be null");
        }
        AgentRegistry.Builder builder = AgentRegistry.builder();
        for (AgentCatalog entry : values()) {
            builder.register(AgentDefinition.transcript(entry.agentName, runnerFactory.apply(entry)));
        }
        return builder.build();
    }
}
