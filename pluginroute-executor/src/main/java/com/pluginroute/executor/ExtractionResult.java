package com.pluginroute.executor;

import java.util.Map;
import java.util.Optional;

/**
 * Markdown narrative of a generated response and the JSON object embedded in
 * it, if one was found. When nothing is found the markdown is the whole
 * response.
 */
public record ExtractionResult(String markdown, Map<String, Object> structuredData) {

    public boolean hasStructuredData() {
        return structuredData != null;
    }

    public Optional<Map<String, Object>> structured() {
        return Optional.ofNullable(structuredData);
    }
}
