package com.example.signage.shared.util;

import com.example.signage.shared.dto.ErrorLogEntry;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Utility class for the JSON text columns: schedule content lists, display
 * error logs and display performance metrics.
 */
@Slf4j
public final class JsonUtils {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private JsonUtils() {}

    /**
     * Parses a JSON array of ids.
     *
     * @param json The JSON string to parse.
     * @return The ids in their stored order, or an empty list if parsing fails or the input is null/blank.
     */
    public static List<Long> parseIdList(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<List<Long>>() {});
        } catch (Exception e) {
            log.warn("Failed to parse JSON id array: {}", json, e);
            return List.of();
        }
    }

    /**
     * Converts a list of ids into a JSON array string.
     *
     * @return A JSON array, or null if the list is null/empty.
     */
    public static String toJsonArray(List<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(ids);
        } catch (Exception e) {
            log.error("Failed to serialize id list to JSON array string", e);
            return null;
        }
    }

    public static List<ErrorLogEntry> parseErrorLog(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<ArrayList<ErrorLogEntry>>() {});
        } catch (Exception e) {
            log.warn("Failed to parse error log, starting a new one: {}", e.getMessage());
            return new ArrayList<>();
        }
    }

    /**
     * Leniently reads a JSON object. Anything that is not an object (arrays,
     * scalars, malformed text) yields null.
     */
    public static Map<String, Object> parseObject(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isObject()) {
                return null;
            }
            return objectMapper.convertValue(node, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (Exception e) {
            log.debug("Ignoring malformed JSON object: {}", e.getMessage());
            return null;
        }
    }

    public static String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            log.error("Failed to serialize value of type {} to JSON", value.getClass().getSimpleName(), e);
            return null;
        }
    }
}
