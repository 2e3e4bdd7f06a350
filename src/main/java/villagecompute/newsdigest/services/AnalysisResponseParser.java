/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsdigest.services;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.newsdigest.api.types.AnalysisResultType;
import villagecompute.newsdigest.exceptions.AnalysisValidationException;
import villagecompute.newsdigest.exceptions.AnalysisValidationException.Reason;

/**
 * Validates raw analysis output into an {@link AnalysisResultType}.
 *
 * <p>
 * <b>Rules:</b>
 * <ul>
 * <li>Markdown code fences around the JSON are stripped</li>
 * <li>The payload must be a JSON object with {@code summary}, {@code score} and {@code category}</li>
 * <li>{@code summary} and {@code category} must be non-blank text</li>
 * <li>{@code score} is a number or numeric string in [1,10], truncated to int; anything else becomes
 * {@value #FALLBACK_SCORE}</li>
 * <li>Every other field is kept as an annotation, text as-is and other values in their JSON form</li>
 * </ul>
 */
@ApplicationScoped
public class AnalysisResponseParser {

    private static final Logger LOG = Logger.getLogger(AnalysisResponseParser.class);

    static final int FALLBACK_SCORE = 5;

    static final int MIN_SCORE = 1;

    static final int MAX_SCORE = 10;

    @Inject
    ObjectMapper objectMapper;

    /**
     * Parses and validates a raw response.
     *
     * @param raw
     *            text returned by the analysis service
     * @return the validated result
     * @throws AnalysisValidationException
     *             if the response cannot be used
     */
    public AnalysisResultType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new AnalysisValidationException(Reason.EMPTY_RESPONSE, "Analysis response is empty");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(stripMarkdown(raw));
        } catch (JsonProcessingException e) {
            throw new AnalysisValidationException(Reason.UNPARSEABLE, "Analysis response is not valid JSON", e);
        }

        if (root == null || !root.isObject()) {
            throw new AnalysisValidationException(Reason.NOT_AN_OBJECT, "Analysis response is not a JSON object");
        }

        String summary = requireText(root, "summary");
        String category = requireText(root, "category");
        if (!root.has("score") || root.get("score").isNull()) {
            throw new AnalysisValidationException(Reason.MISSING_FIELD, "Analysis response has no score");
        }

        Integer score = coerceScore(root.get("score"));
        boolean fallbackApplied = score == null;
        if (fallbackApplied) {
            LOG.warnf("Score out of range or not numeric, using %d: score=%s", FALLBACK_SCORE, root.get("score"));
            score = FALLBACK_SCORE;
        }

        Map<String, String> annotations = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            if ("summary".equals(name) || "score".equals(name) || "category".equals(name)) {
                continue;
            }
            JsonNode value = field.getValue();
            if (value.isNull()) {
                continue;
            }
            annotations.put(name, value.isTextual() ? value.asText() : value.toString());
        }

        return new AnalysisResultType(summary.trim(), score, category.trim(), annotations, fallbackApplied);
    }

    /**
     * Returns the score as an int when it is a number or numeric string in [1,10], otherwise null.
     */
    static Integer coerceScore(JsonNode node) {
        BigDecimal value;
        if (node.isNumber()) {
            // 1e400 parses to an infinite double, which has no decimal form
            if (node.isFloatingPointNumber() && !Double.isFinite(node.doubleValue())) {
                return null;
            }
            value = node.decimalValue();
        } else if (node.isTextual()) {
            try {
                value = new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }

        if (value.compareTo(BigDecimal.valueOf(MIN_SCORE)) < 0 || value.compareTo(BigDecimal.valueOf(MAX_SCORE)) > 0) {
            return null;
        }
        return value.intValue();
    }

    /**
     * Removes a surrounding markdown code fence, if present.
     */
    static String stripMarkdown(String response) {
        String json = response.trim();
        if (json.startsWith("```json")) {
            json = json.substring(7);
        } else if (json.startsWith("```")) {
            json = json.substring(3);
        }
        if (json.endsWith("```")) {
            json = json.substring(0, json.length() - 3);
        }
        return json.trim();
    }

    private static String requireText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || !node.isTextual() || node.asText().isBlank()) {
            throw new AnalysisValidationException(Reason.MISSING_FIELD,
                    "Analysis response field missing or blank: " + field);
        }
        return node.asText();
    }
}
