package com.whereq.memori.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.memori.exception.InvalidLlmResponseException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Pulls structured data out of model output.
 *
 * Models wrap JSON in markdown fences or chatter around it, so the first
 * balanced {@code {...}} block is taken. Anything unusable raises
 * {@link InvalidLlmResponseException}.
 */
public final class LlmResponseParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() { };

    private LlmResponseParser() {
    }

    /**
     * Extract the first JSON object from text
     */
    public static Map<String, Object> extractJson(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidLlmResponseException("Empty model response");
        }
        int start = text.indexOf('{');
        if (start >= 0) {
            int depth = 0;
            boolean inString = false;
            for (int i = start; i < text.length(); i++) {
                char c = text.charAt(i);
                if (inString) {
                    if (c == '\\') {
                        i++;
                    } else if (c == '"') {
                        inString = false;
                    }
                } else if (c == '"') {
                    inString = true;
                } else if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                    if (depth == 0) {
                        String candidate = text.substring(start, i + 1);
                        try {
                            return MAPPER.readValue(candidate, MAP_TYPE);
                        } catch (JsonProcessingException e) {
                            throw new InvalidLlmResponseException("Malformed JSON in model response: "
                                + abbreviate(candidate), e);
                        }
                    }
                }
            }
        }
        throw new InvalidLlmResponseException("No JSON object in model response: " + abbreviate(text));
    }

    /**
     * Get a non-blank string field
     *
     * @throws InvalidLlmResponseException if the field is missing or blank
     */
    public static String requireString(Map<String, Object> json, String field) {
        Object value = json.get(field);
        if (value == null || value.toString().isBlank()) {
            throw new InvalidLlmResponseException("Model response missing required field: " + field);
        }
        return value.toString();
    }

    public static String optionalString(Map<String, Object> json, String field) {
        Object value = json.get(field);
        return value == null || value.toString().isBlank() ? null : value.toString();
    }

    /**
     * Read a list of strings; a single string becomes a one-element list
     */
    public static List<String> stringList(Map<String, Object> json, String field) {
        Object value = json.get(field);
        List<String> values = new ArrayList<>();
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                if (item != null && !item.toString().isBlank()) {
                    values.add(item.toString().strip());
                }
            }
        } else if (value != null && !value.toString().isBlank()) {
            values.add(value.toString().strip());
        }
        return values;
    }

    public static double doubleValue(Map<String, Object> json, String field, double defaultValue) {
        Object value = json.get(field);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value != null) {
            try {
                return Double.parseDouble(value.toString());
            } catch (NumberFormatException e) {
                throw new InvalidLlmResponseException("Field " + field + " is not a number: " + value, e);
            }
        }
        return defaultValue;
    }

    private static String abbreviate(String text) {
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
