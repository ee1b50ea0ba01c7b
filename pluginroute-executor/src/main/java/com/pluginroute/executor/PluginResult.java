package com.pluginroute.executor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of executing a plugin command.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PluginResult {

    @Builder.Default
    private String markdown = "";
    private Map<String, Object> structuredData;

    /** Files produced by post-processing (DOCX, PDF, ...). */
    @Builder.Default
    private List<String> outputPaths = new ArrayList<>();

    /** Timing, token usage and model info. */
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Builder.Default
    private boolean success = true;
    private String errorMessage;

    static PluginResult failure(String errorMessage, double elapsedSeconds) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(CommandExecutor.META_ELAPSED_SECONDS, elapsedSeconds);
        return PluginResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .metadata(metadata)
                .build();
    }
}
