/**
 * 다중 에이전트 라이브러리 날씨 비교 워크플로우.
 */
package com.ryuqq.agentflow.samples.weather;
