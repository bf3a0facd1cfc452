package com.proofsmith.core.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for reading structured data out of raw model text.
 */
public final class LlmJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private LlmJson() {}

    /**
     * Removes a leading {@code ```json} / {@code ```} fence and a trailing {@code ```}.
     * Text without fences is only trimmed.
     */
    public static String stripFences(String text) {
        if (text == null) return "";
        String cleaned = text.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }

    /**
     * Parses fenced or bare JSON into an object node.
     *
     * @throws JsonProcessingException if the text is not JSON or not a JSON object
     */
    public static JsonNode readObject(String text) throws JsonProcessingException {
        JsonNode root = MAPPER.readTree(stripFences(text));
        if (root == null || !root.isObject()) {
            throw new JsonMappingException((Closeable) null,
                    "Expected a JSON object, got: " + (root == null ? "nothing" : root.getNodeType()));
        }
        return root;
    }

    /** Text value of a field, or null when absent, null or blank. */
    public static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) return null;
        String value = node.isTextual() ? node.asText() : node.toString();
        return value.isBlank() ? null : value;
    }

    /** Array field as a list of strings; a scalar becomes a one-element list. */
    public static List<String> textList(JsonNode root, String field) {
        JsonNode node = root.get(field);
        List<String> out = new ArrayList<>();
        if (node == null || node.isNull()) return out;
        if (node.isArray()) {
            for (JsonNode item : node) {
                String value = item.isTextual() ? item.asText().trim() : item.toString();
                if (!value.isEmpty()) out.add(value);
            }
        } else {
            String value = node.asText().trim();
            if (!value.isEmpty()) out.add(value);
        }
        return out;
    }

    public static double number(JsonNode root, String field, double defaultValue) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) return defaultValue;
        if (node.isNumber()) return node.asDouble();
        try {
            return Double.parseDouble(node.asText().trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
