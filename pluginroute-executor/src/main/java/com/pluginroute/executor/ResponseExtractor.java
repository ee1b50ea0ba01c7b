package com.pluginroute.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.pluginroute.common.infra.JsonFile;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a generated response into markdown and an embedded JSON object.
 *
 * <p>
 * Strategies, first success wins:
 * <ol>
 * <li>a {@code ```json} fenced block; markdown is the text before the fence</li>
 * <li>the first balanced object after a known marker such as
 * {@code ## JSON Output}; markdown is the text before the marker</li>
 * <li>the balanced object ending at the last closing brace of the response</li>
 * </ol>
 * Invalid JSON at any step falls through to the next one. Only JSON objects
 * count; arrays and scalars are ignored. Never throws.
 */
@Slf4j
public final class ResponseExtractor {

    private ResponseExtractor() {
    }

    private static final Pattern JSON_FENCE = Pattern.compile("```json\\s*\\n(.*?)\\n```", Pattern.DOTALL);

    /** Checked in order; {@code ## JSON} must come after its longer variants. */
    static final List<String> MARKERS = List.of(
            "## Structured Data",
            "## JSON Output",
            "## Structured JSON",
            "## JSON",
            "---\n\n{");

    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_TYPE = new TypeReference<>() {
    };

    public static ExtractionResult extract(String responseText) {
        if (responseText == null)
            return new ExtractionResult("", null);

        ExtractionResult result = fromFence(responseText);
        if (result == null)
            result = fromMarkers(responseText);
        if (result == null)
            result = fromTrailingObject(responseText);
        if (result != null)
            return result;

        log.debug("No structured JSON found in response");
        return new ExtractionResult(responseText, null);
    }

    // =========================================================================
    // Strategies
    // =========================================================================

    static ExtractionResult fromFence(String text) {
        Matcher m = JSON_FENCE.matcher(text);
        if (!m.find())
            return null;
        Map<String, Object> data = parseObject(m.group(1));
        if (data == null) {
            log.warn("Failed to parse ```json block, trying other strategies");
            return null;
        }
        log.debug("Parsed JSON from code fence");
        return new ExtractionResult(text.substring(0, m.start()).strip(), data);
    }

    static ExtractionResult fromMarkers(String text) {
        for (String marker : MARKERS) {
            int markerAt = text.indexOf(marker);
            if (markerAt < 0)
                continue;

            int open = text.indexOf('{', markerAt + marker.length());
            if (open < 0)
                continue;
            int close = matchForward(text, open);
            if (close < 0)
                continue;

            Map<String, Object> data = parseObject(text.substring(open, close + 1));
            if (data != null) {
                log.debug("Parsed JSON after marker '{}'", marker.strip());
                return new ExtractionResult(text.substring(0, markerAt).strip(), data);
            }
        }
        return null;
    }

    static ExtractionResult fromTrailingObject(String text) {
        int close = text.lastIndexOf('}');
        if (close <= 0)
            return null;
        int open = matchBackward(text, close);
        if (open < 0)
            return null;

        Map<String, Object> data = parseObject(text.substring(open, close + 1));
        if (data == null)
            return null;
        log.debug("Parsed JSON from end of response");
        return new ExtractionResult(text.substring(0, open).strip(), data);
    }

    // =========================================================================
    // Brace matching
    // =========================================================================

    /**
     * Index of the '}' closing the '{' at {@code open}, or -1. Braces inside
     * strings are counted too.
     */
    static int matchForward(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0)
                    return i;
            }
        }
        return -1;
    }

    /**
     * Index of the '{' opening the '}' at {@code close}, or -1.
     */
    static int matchBackward(String text, int close) {
        int depth = 0;
        for (int i = close; i >= 0; i--) {
            char c = text.charAt(i);
            if (c == '}') {
                depth++;
            } else if (c == '{') {
                depth--;
                if (depth == 0)
                    return i;
            }
        }
        return -1;
    }

    private static Map<String, Object> parseObject(String json) {
        try {
            JsonNode node = JsonFile.mapper().readTree(json);
            if (node == null || !node.isObject())
                return null;
            return JsonFile.mapper().convertValue(node, OBJECT_TYPE);
        } catch (JsonProcessingException e) {
            log.debug("Invalid JSON candidate: {}", e.getOriginalMessage());
            return null;
        }
    }
}
