package com.delta.talentmatch.screening.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads the JSON object a model returns, tolerating Markdown code fences, prose around the object,
 * numbers sent as strings and single strings where a list was asked for.
 */
@Component
public class AiResponseParser {
    private final ObjectMapper objectMapper;

    public AiResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public AiAnalysisResponse parse(String content) {
        if (content == null || content.isBlank()) {
            throw new AiServiceException("Empty AI response");
        }
        String json = extractObject(stripFences(content));
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new AiServiceException("Unparsable AI response", e);
        }
        if (root == null || !root.isObject()) {
            throw new AiServiceException("AI response is not a JSON object");
        }
        return new AiAnalysisResponse(
            text(root.get("summary")),
            textList(root.get("pros")),
            textList(root.get("cons")),
            integer(firstPresent(root, "score_adjustment", "scoreAdjustment", "adjustment"))
        );
    }

    private String stripFences(String content) {
        String trimmed = content.strip();
        int fence = trimmed.indexOf("```");
        if (fence < 0) {
            return trimmed;
        }
        int bodyStart = trimmed.indexOf('\n', fence);
        if (bodyStart < 0) {
            return trimmed;
        }
        int closing = trimmed.indexOf("```", bodyStart);
        return closing < 0 ? trimmed.substring(bodyStart + 1) : trimmed.substring(bodyStart + 1, closing);
    }

    private String extractObject(String text) {
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new AiServiceException("No JSON object in AI response");
        }
        return text.substring(start, end + 1);
    }

    private JsonNode firstPresent(JsonNode root, String... names) {
        for (String name : names) {
            JsonNode node = root.get(name);
            if (node != null && !node.isNull()) {
                return node;
            }
        }
        return null;
    }

    private String text(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return node.isTextual() ? node.asText().strip() : node.toString();
    }

    private List<String> textList(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node == null || node.isNull()) {
            return out;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                String value = text(item);
                if (value != null && !value.isBlank()) {
                    out.add(value);
                }
            }
        } else {
            String value = text(node);
            if (value != null && !value.isBlank()) {
                out.add(value);
            }
        }
        return out;
    }

    private Integer integer(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return toInt(node.asDouble());
        }
        if (node.isTextual()) {
            String raw = node.asText().strip().toLowerCase(Locale.ROOT).replace("+", "").replace("points", "").strip();
            try {
                return toInt(Double.parseDouble(raw));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private Integer toInt(double value) {
        if (Double.isNaN(value)) {
            return null;
        }
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, Math.round(value)));
    }
}
