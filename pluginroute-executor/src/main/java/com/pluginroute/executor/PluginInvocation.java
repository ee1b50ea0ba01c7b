package com.pluginroute.executor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to run an intercepted plugin command outside the agent's
 * own context: instruction files, user configuration, source material and the
 * context gathered in conversation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PluginInvocation {

    private String commandName;
    private String commandMdPath;

    @Builder.Default
    private List<String> skillMdPaths = new ArrayList<>();
    @Builder.Default
    private List<String> configPaths = new ArrayList<>();

    @Builder.Default
    private List<String> sourcePaths = new ArrayList<>();
    /** Raw text to analyze in addition to (or instead of) source files. */
    @Builder.Default
    private List<String> sourceTexts = new ArrayList<>();

    private Map<String, Object> supplemental;

    /** Null selects {@link CommandExecutor#DEFAULT_MODEL}. */
    private String model;
    /** Null selects {@link CommandExecutor#DEFAULT_MAX_TOKENS}. */
    private Integer maxTokens;

    private String outputPath;
    private String pluginName;
}
