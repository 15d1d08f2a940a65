package com.boardrag.pipeline.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts free-form metadata maps to and from {@code jsonb} column text.
 */
@Component
@RequiredArgsConstructor
public class JsonColumns {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    @SneakyThrows
    public String write(Map<String, Object> value) {
        return objectMapper.writeValueAsString(value == null ? Map.of() : value);
    }

    @SneakyThrows
    public Map<String, Object> read(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        return objectMapper.readValue(json, MAP_TYPE);
    }
}
