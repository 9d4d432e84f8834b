package com.ryuqq.agentflow.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Orchestration 입력/출력, 이벤트 데이터, 세션 상태의 JSON 변환기.
 *
 * <p>알 수 없는 필드는 무시합니다. 변환 실패는 {@link IllegalArgumentException}으로 던집니다.</p>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public final class JsonCodec {

    private static final JsonCodec DEFAULT = new JsonCodec(new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));

    private final ObjectMapper objectMapper;

    /**
     * 생성자 (ObjectMapper 주입).
     *
     * @param objectMapper Jackson ObjectMapper
     * @throws IllegalArgumentException objectMapper가 null인 경우
     */
    public JsonCodec(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * 기본 설정 JsonCodec.
     *
     * @return 공유 인스턴스
     */
    public static JsonCodec defaultCodec() {
        return DEFAULT;
    }

    /**
     * 객체를 JSON 문자열로 변환.
     *
     * @param value 변환할 값 (null이면 "null")
     * @return JSON 문자열
     * @throws IllegalArgumentException 직렬화 실패 시
     */
    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + value.getClass().getName() + " to JSON", e);
        }
    }

    /**
     * JSON 문자열을 객체로 변환.
     *
     * @param json JSON 문자열 (null이면 null 반환)
     * @param type 대상 타입
     * @param <T> 대상 타입
     * @return 변환된 객체
     * @throws IllegalArgumentException 역직렬화 실패 시
     */
    public <T> T fromJson(String json, Class<T> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to read JSON as " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * JSON 문자열을 트리로 읽기.
     *
     * @param json JSON 문자열
     * @return JsonNode (json이 null이면 NullNode)
     * @throws IllegalArgumentException 파싱 실패 시
     */
    public JsonNode readTree(String json) {
        if (json == null) {
            return objectMapper.nullNode();
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * 객체를 다른 타입으로 변환 (예: Map → record).
     */
    public <T> T convert(Object value, Class<T> type) {
        try {
            return objectMapper.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Failed to convert value to " + type.getSimpleName(), e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
