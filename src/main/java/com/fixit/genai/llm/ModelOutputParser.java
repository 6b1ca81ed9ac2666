package com.fixit.genai.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fixit.genai.exception.ModelUnavailableException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the JSON object out of free-form model text.
 * <p>
 * Small models wrap their JSON in markdown fences or prose. Accepted, in order: the whole
 * text, the body of a {@code ```json} fence, the first {@code {...}} span. Anything else
 * is a {@link FailureKind#MALFORMED_RESPONSE}.
 * </p>
 */
public class ModelOutputParser {

    private static final Pattern FENCED = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)\\s*```");
    private static final Pattern BRACES = Pattern.compile("\\{[\\s\\S]*}");

    private final ObjectMapper objectMapper;

    public ModelOutputParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode parseObject(String raw) {
        if (raw == null || raw.isBlank()) {
            throw malformed("empty answer");
        }
        JsonNode node = tryRead(raw.strip());
        if (node == null) {
            Matcher fenced = FENCED.matcher(raw);
            if (fenced.find()) {
                node = tryRead(fenced.group(1));
            }
        }
        if (node == null) {
            Matcher braces = BRACES.matcher(raw);
            if (braces.find()) {
                node = tryRead(braces.group());
            }
        }
        if (node == null) {
            throw malformed("no JSON object in: " + abbreviate(raw));
        }
        return node;
    }

    /**
     * Reads a numeric field and clamps it to [0,1]. A missing or non-numeric field is malformed.
     */
    public double readUnitScore(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw malformed("missing field '" + field + "'");
        }
        double score;
        if (value.isNumber()) {
            score = value.asDouble();
        } else if (value.isTextual()) {
            try {
                score = Double.parseDouble(value.asText().strip());
            } catch (NumberFormatException e) {
                throw malformed("field '" + field + "' is not a number: " + value.asText());
            }
        } else {
            throw malformed("field '" + field + "' is not a number");
        }
        if (Double.isNaN(score)) {
            throw malformed("field '" + field + "' is NaN");
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    /** Reads an optional array of strings; a single string is accepted as a one-element list. */
    public List<String> readStrings(JsonNode node, String field) {
        JsonNode value = node.get(field);
        List<String> result = new ArrayList<>();
        if (value == null || value.isNull()) {
            return result;
        }
        if (value.isArray()) {
            value.forEach(item -> {
                String text = item.asText("").strip();
                if (!text.isEmpty()) {
                    result.add(text);
                }
            });
        } else if (value.isTextual() && !value.asText().isBlank()) {
            result.add(value.asText().strip());
        }
        return result;
    }

    public String readText(JsonNode node, String field, String defaultValue) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return defaultValue;
        }
        return value.asText().strip();
    }

    /** The candidate as a JSON object, or null when it is not one. */
    private JsonNode tryRead(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static ModelUnavailableException malformed(String detail) {
        return new ModelUnavailableException(FailureKind.MALFORMED_RESPONSE, "Unparseable model output: " + detail);
    }

    private static String abbreviate(String raw) {
        return raw.length() <= 200 ? raw : raw.substring(0, 200) + "...";
    }
}
