package com.ryuqq.agentflow.samples.travel;

/**
 * 여행 계획 요청.
 *
 * <p>누락된 항목은 기본값으로 채웁니다: durationInDays=3, budget="$1000", travelDates="TBD".</p>
 *
 * @param specialRequirements 요구 사항 (자유 텍스트)
 * @param durationInDays 여행 일수
 * @param budget 예산
 * @param travelDates 여행 날짜
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public record TravelRequest(
    String specialRequirements,
    Integer durationInDays,
    String budget,
    String travelDates
) {

    public static final int DEFAULT_DURATION_IN_DAYS = 3;
    public static final String DEFAULT_BUDGET = "$1000";
    public static final String DEFAULT_TRAVEL_DATES = "TBD";

    public TravelRequest {
        if (specialRequirements == null) {
            specialRequirements = "";
        }
        if (durationInDays == null) {
            durationInDays = DEFAULT_DURATION_IN_DAYS;
        }
        if (durationInDays <= 0) {
            throw new IllegalArgumentException("durationInDays must be positive (current: " + durationInDays + ")");
        }
        if (budget == null || budget.isBlank()) {
            budget = DEFAULT_BUDGET;
        }
        if (travelDates == null || travelDates.isBlank()) {
            travelDates = DEFAULT_TRAVEL_DATES;
        }
    }

    public static TravelRequest of(String specialRequirements) {
        return new TravelRequest(specialRequirements, null, null, null);
    }
}
