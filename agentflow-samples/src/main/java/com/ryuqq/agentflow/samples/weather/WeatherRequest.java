package com.ryuqq.agentflow.samples.weather;

/**
 * 날씨 비교 요청.
 *
 * @param city1 첫 번째 도시
 * @param city2 두 번째 도시
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public record WeatherRequest(String city1, String city2) {
}
