package com.meridian.service.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Builds content-addressed cache keys.
 *
 * Steps:
 * 1. Normalize prompt text (NFC, LF line endings, trailing whitespace, collapsed spaces/tabs, trim)
 * 2. Canonicalize parameters (drop nulls, sort keys, round floats)
 * 3. SHA-256 over prompt, provider, model and parameters
 *
 * Same logical request, same key.
 */
@Component
public class PromptCanonicalizer {

    private static final int FLOAT_PRECISION = 2;
    private static final Pattern TRAILING_WHITESPACE = Pattern.compile("[ \\t]+(?=\\n)|[ \\t]+$");
    private static final Pattern INLINE_WHITESPACE = Pattern.compile("[ \\t]+");
    private static final char SEPARATOR = '\u001f';

    private final ObjectMapper objectMapper;

    public PromptCanonicalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Compute the cache key for a prompt served by a given provider/model.
     *
     * @return SHA-256 hash (64 hex chars)
     */
    public String computeKey(String prompt, String provider, String model, Map<String, Object> parameters) {
        String canonical = normalizePrompt(prompt)
                + SEPARATOR + provider
                + SEPARATOR + model
                + SEPARATOR + canonicalizeParameters(parameters);
        return DigestUtils.sha256Hex(canonical);
    }

    /**
     * Normalize prompt text so incidental formatting does not change the key.
     */
    public String normalizePrompt(String prompt) {
        if (prompt == null) {
            return "";
        }
        String text = Normalizer.normalize(prompt, Normalizer.Form.NFC)
                .replace("\r\n", "\n")
                .replace('\r', '\n');
        text = TRAILING_WHITESPACE.matcher(text).replaceAll("");
        text = INLINE_WHITESPACE.matcher(text).replaceAll(" ");
        return text.trim();
    }

    /**
     * Canonical JSON for generation parameters: sorted keys, no nulls, floats rounded.
     */
    public String canonicalizeParameters(Map<String, Object> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            return "{}";
        }
        JsonNode canonical = canonicalizeNode(objectMapper.valueToTree(parameters));
        StringBuilder sb = new StringBuilder();
        serializeNode(canonical, sb);
        return sb.toString();
    }

    private JsonNode canonicalizeNode(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isObject()) {
            ObjectNode canonical = objectMapper.createObjectNode();
            List<String> fieldNames = new ArrayList<>();
            node.fieldNames().forEachRemaining(fieldNames::add);
            Collections.sort(fieldNames);
            for (String fieldName : fieldNames) {
                JsonNode value = canonicalizeNode(node.get(fieldName));
                if (value != null) {
                    canonical.set(fieldName, value);
                }
            }
            return canonical;
        }
        if (node.isArray()) {
            ArrayNode canonical = objectMapper.createArrayNode();
            for (JsonNode element : node) {
                JsonNode value = canonicalizeNode(element);
                if (value != null) {
                    canonical.add(value);
                }
            }
            return canonical;
        }
        if (node.isNumber() && !node.isIntegralNumber()) {
            BigDecimal rounded = BigDecimal.valueOf(node.asDouble()).setScale(FLOAT_PRECISION, RoundingMode.HALF_UP);
            return objectMapper.getNodeFactory().numberNode(rounded.doubleValue());
        }
        if (node.isTextual()) {
            return objectMapper.getNodeFactory().textNode(node.asText().trim());
        }
        return node;
    }

    private void serializeNode(JsonNode node, StringBuilder sb) {
        if (node == null || node.isNull()) {
            sb.append("null");
        } else if (node.isObject()) {
            sb.append('{');
            List<String> fieldNames = new ArrayList<>();
            node.fieldNames().forEachRemaining(fieldNames::add);
            Collections.sort(fieldNames);
            for (int i = 0; i < fieldNames.size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                sb.append('"').append(escapeJson(fieldNames.get(i))).append("\":");
                serializeNode(node.get(fieldNames.get(i)), sb);
            }
            sb.append('}');
        } else if (node.isArray()) {
            sb.append('[');
            for (int i = 0; i < node.size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                serializeNode(node.get(i), sb);
            }
            sb.append(']');
        } else if (node.isTextual()) {
            sb.append('"').append(escapeJson(node.asText())).append('"');
        } else {
            sb.append(node.asText());
        }
    }

    private static String escapeJson(String text) {
        return text
                .replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }
}
