package com.pluginroute.executor;

/**
 * Text-generation call used by {@link CommandExecutor}. Implementations own the
 * transport and credentials.
 */
public interface GenerationClient {

    Generation generate(GenerationRequest request) throws GenerationException;

    /**
     * @param systemPrompt optional; null sends no system prompt
     */
    record GenerationRequest(String model, int maxTokens, String systemPrompt, String userPrompt) {
    }

    record Generation(String text, long inputTokens, long outputTokens) {
    }
}
