package com.ryuqq.agentflow.samples.travel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.agentflow.core.error.InputMissingException;
import com.ryuqq.agentflow.core.json.JsonCodec;
import com.ryuqq.agentflow.core.orchestration.Orchestration;
import com.ryuqq.agentflow.core.orchestration.OrchestrationContext;
import com.ryuqq.agentflow.samples.AgentCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 여러 에이전트로 여행 계획을 만들고 사람의 승인을 받아 예약하는 Orchestration.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 입력이 비어 있으면 InputMissingException
 *   ↓
 * destination_expert_agent → 추천 목록 (JSON), 첫 번째 추천 선택
 *   ↓
 * itinerary_planner_agent → 일정 (JSON)
 *   ↓
 * local_recommendations_agent → 현지 추천 (JSON)
 *   ↓
 * customStatus = 계획 + approval_status=pending
 *   ↓
 * approval_event 대기
 *   - "approved" 외의 값 → approval_status=rejected 로 완료
 *   - "approved" → book_travel_activity 호출, booking_details 포함하여 완료
 * </pre>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public final class TravelPlannerOrchestration implements Orchestration {

    public static final String NAME = "travel_planner";
    public static final String APPROVAL_EVENT = "approval_event";
    public static final String APPROVED = "approved";

    private static final Logger log = LoggerFactory.getLogger(TravelPlannerOrchestration.class);

    private final JsonCodec json;

    public TravelPlannerOrchestration(JsonCodec json) {
        if (json == null) {
            throw new IllegalArgumentException("json cannot be null");
        }
        this.json = json;
    }

    @Override
    public Object run(OrchestrationContext ctx) {
        JsonNode input = ctx.getInput(JsonNode.class);
        if (isMissing(input)) {
            throw new InputMissingException(NAME);
        }
        TravelRequest request = json.convert(input, TravelRequest.class);

        JsonNode destinations = json.readTree(ctx.callAgent(AgentCatalog.DESTINATION_EXPERT.agentName(), null,
            request.specialRequirements()).await());
        JsonNode recommendations = destinations.path("recommendations");
        if (!recommendations.isArray() || recommendations.isEmpty()) {
            throw new IllegalStateException("Destination expert returned no recommendations");
        }
        JsonNode topDestination = recommendations.get(0);
        String destinationName = topDestination.path("destination_name").asText();

        Map<String, Object> itineraryRequest = new LinkedHashMap<>();
        itineraryRequest.put("destination_name", destinationName);
        itineraryRequest.put("duration_in_days", request.durationInDays());
        itineraryRequest.put("budget", request.budget());
        itineraryRequest.put("travel_dates", request.travelDates());
        itineraryRequest.put("special_requirements", request.specialRequirements());
        JsonNode itinerary = json.readTree(ctx.callAgent(AgentCatalog.ITINERARY_PLANNER.agentName(), null,
            itineraryRequest).await());

        Map<String, Object> localRequest = new LinkedHashMap<>();
        localRequest.put("destination_name", destinationName);
        localRequest.put("duration_in_days", request.durationInDays());
        localRequest.put("preferred_cuisine", "Any");
        localRequest.put("include_hidden_gems", true);
        localRequest.put("family_friendly", true);
        JsonNode localRecommendations = json.readTree(ctx.callAgent(AgentCatalog.LOCAL_RECOMMENDATIONS.agentName(),
            null, localRequest).await());

        ObjectNode response = json.getObjectMapper().createObjectNode();
        response.set("destination", topDestination);
        response.set("itinerary", itinerary);
        response.set("local_recommendations", localRecommendations);
        response.put("approval_status", "pending");
        ctx.setCustomStatus(response);

        if (!ctx.isReplaying()) {
            log.info("Travel plan for {} awaiting approval ({})", destinationName, ctx.getInstanceId().getValue());
        }
        String decision = ctx.waitForEvent(APPROVAL_EVENT, String.class).await();

        if (!APPROVED.equals(decision)) {
            response.put("approval_status", "rejected");
            return response;
        }

        JsonNode booking = ctx.callActivity(BookTravelActivity.NAME, response, JsonNode.class).await();
        response.set("booking_details", booking);
        response.put("approval_status", APPROVED);
        return response;
    }

    /**
     * null, 빈 객체, 또는 모든 항목이 비어 있는 객체를 입력 누락으로 판단.
     */
    private static boolean isMissing(JsonNode input) {
        if (input == null || input.isNull() || input.isMissingNode()) {
            return true;
        }
        if (!input.isObject()) {
            return false;
        }
        Iterator<JsonNode> values = input.elements();
        while (values.hasNext()) {
            JsonNode value = values.next();
            if (!value.isNull() && !(value.isTextual() && value.asText().isBlank())) {
                return false;
            }
        }
        return true;
    }
}
