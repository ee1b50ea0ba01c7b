package com.pluginroute.executor;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs an intercepted plugin command: builds the prompt, calls the generation
 * client, splits the response into markdown and structured data, then applies
 * the command's post-processor if one is registered.
 *
 * <p>
 * Failures come back as a {@link PluginResult} with {@code success=false} and a
 * message meant for the user. A failing post-processor keeps the generated
 * result and only records its error.
 */
@Slf4j
public class CommandExecutor {

    public static final String DEFAULT_MODEL = "claude-sonnet-4-20250514";
    public static final int DEFAULT_MAX_TOKENS = 16384;

    public static final String META_MODEL = "model";
    public static final String META_INPUT_TOKENS = "input_tokens";
    public static final String META_OUTPUT_TOKENS = "output_tokens";
    public static final String META_ELAPSED_SECONDS = "elapsed_seconds";
    public static final String META_COMMAND_NAME = "command_name";

    private final GenerationClient client;
    private final PromptBuilder promptBuilder;
    private final Map<String, PostProcessor> postProcessors;

    public CommandExecutor(GenerationClient client) {
        this(client, new PromptBuilder(), Map.of());
    }

    /**
     * @param postProcessors post-processors keyed by command name
     */
    public CommandExecutor(GenerationClient client, PromptBuilder promptBuilder,
            Map<String, PostProcessor> postProcessors) {
        this.client = client;
        this.promptBuilder = promptBuilder;
        this.postProcessors = Map.copyOf(postProcessors);
    }

    public PluginResult execute(PluginInvocation invocation, String outputRequirements) {
        return execute(invocation, outputRequirements, null, null);
    }

    /**
     * @param outputRequirements instructions for the structured output, appended to the prompt
     * @param systemPrompt       optional system prompt
     * @param promptTemplate     optional template, see {@link PromptBuilder#DEFAULT_TEMPLATE}
     */
    public PluginResult execute(PluginInvocation invocation, String outputRequirements,
            String systemPrompt, String promptTemplate) {
        long start = System.nanoTime();

        String userPrompt;
        try {
            userPrompt = promptBuilder.build(invocation, outputRequirements, promptTemplate);
        } catch (RuntimeException e) {
            log.error("Failed to build prompt for command '{}'", invocation.getCommandName(), e);
            return PluginResult.failure("Prompt building failed: " + e.getMessage(), elapsedSeconds(start));
        }

        String model = invocation.getModel() != null ? invocation.getModel() : DEFAULT_MODEL;
        int maxTokens = invocation.getMaxTokens() != null ? invocation.getMaxTokens() : DEFAULT_MAX_TOKENS;

        GenerationClient.Generation generation;
        try {
            log.info("Making LLM call for command '{}' with model '{}'", invocation.getCommandName(), model);
            generation = client.generate(new GenerationClient.GenerationRequest(
                    model, maxTokens, systemPrompt, userPrompt));
        } catch (GenerationException e) {
            if (e.isAuthenticationFailure()) {
                return PluginResult.failure(
                        "Authentication failed: " + e.getMessage() + ". Check your API key.", elapsedSeconds(start));
            }
            log.error("LLM API error for command '{}'", invocation.getCommandName(), e);
            return PluginResult.failure("LLM API error: " + e.getMessage(), elapsedSeconds(start));
        }

        ExtractionResult extracted = ResponseExtractor.extract(generation.text());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(META_MODEL, model);
        metadata.put(META_INPUT_TOKENS, generation.inputTokens());
        metadata.put(META_OUTPUT_TOKENS, generation.outputTokens());
        metadata.put(META_ELAPSED_SECONDS, elapsedSeconds(start));
        metadata.put(META_COMMAND_NAME, invocation.getCommandName());

        PluginResult result = PluginResult.builder()
                .markdown(extracted.markdown())
                .structuredData(extracted.structuredData())
                .metadata(metadata)
                .build();

        PostProcessor postProcessor = invocation.getCommandName() != null
                ? postProcessors.get(invocation.getCommandName())
                : null;
        if (postProcessor != null) {
            log.info("Running post-processor for command '{}'", invocation.getCommandName());
            try {
                PluginResult processed = postProcessor.process(result, invocation);
                if (processed != null)
                    result = processed;
            } catch (Exception e) {
                log.error("Post-processor failed for {}", invocation.getCommandName(), e);
                result.setErrorMessage("Post-processing error: " + e.getMessage());
            }
        }

        Map<String, Object> finalMetadata = result.getMetadata() != null
                ? new LinkedHashMap<>(result.getMetadata())
                : new LinkedHashMap<>();
        finalMetadata.put(META_ELAPSED_SECONDS, elapsedSeconds(start));
        result.setMetadata(finalMetadata);
        return result;
    }

    private static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }
}
