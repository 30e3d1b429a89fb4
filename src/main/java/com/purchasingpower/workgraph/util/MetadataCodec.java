package com.purchasingpower.workgraph.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.workgraph.exception.GraphOperationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stores structured metadata and settings as JSON strings on graph entities.
 *
 * <p>Neo4j properties cannot hold nested maps, so objects are serialized on
 * write and parsed back when a node is returned to the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetadataCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public String encode(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value != null ? value : Map.of());
        } catch (JsonProcessingException e) {
            throw GraphOperationException.validation("Metadata is not serializable: " + e.getOriginalMessage());
        }
    }

    /**
     * Parses a stored JSON object; unreadable values come back as {@code {"raw": value}}.
     */
    public Map<String, Object> decode(Object stored) {
        if (stored == null) {
            return new LinkedHashMap<>();
        }
        if (stored instanceof Map<?, ?>) {
            @SuppressWarnings("unchecked")
            Map<String, Object> map = (Map<String, Object>) stored;
            return map;
        }
        String json = stored.toString();
        if (json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Stored metadata is not a JSON object: {}", e.getOriginalMessage());
            Map<String, Object> fallback = new LinkedHashMap<>();
            fallback.put("raw", json);
            return fallback;
        }
    }

    /**
     * Copy of a node's property map with the named JSON property parsed back into an object.
     */
    public Map<String, Object> withDecoded(Map<String, Object> properties, String key) {
        if (properties == null) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>(properties);
        if (copy.containsKey(key)) {
            copy.put(key, decode(copy.get(key)));
        }
        return copy;
    }
}
