package com.company.sla.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Jackson mapping for JSONB columns
 */
@Component
@RequiredArgsConstructor
public class JsonColumnMapper {

    private static final TypeReference<Map<String, Object>> OBJECT_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<Map<String, Object>>> OBJECT_LIST_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public String write(Object value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JSON column value", e);
        }
    }

    public <T> T read(String json, Class<T> type) {
        if (json == null) return null;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read JSON column as " + type.getSimpleName(), e);
        }
    }

    public Map<String, Object> readObject(String json) {
        return read(json, OBJECT_TYPE);
    }

    public List<Map<String, Object>> readObjectList(String json) {
        List<Map<String, Object>> values = read(json, OBJECT_LIST_TYPE);
        return values != null ? values : List.of();
    }

    private <T> T read(String json, TypeReference<T> type) {
        if (json == null) return null;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read JSON column", e);
        }
    }
}
