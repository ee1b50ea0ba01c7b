package com.pluginroute.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.pluginroute.common.infra.JsonFile;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assembles the generation prompt for a {@link PluginInvocation} by reading
 * every referenced file into a template.
 *
 * <p>
 * Unreadable files do not fail the prompt; they are inlined as
 * {@code [File not found: ...]} or {@code [Error reading ...]} so the model
 * sees what is missing.
 */
@Slf4j
public class PromptBuilder {

    public static final String DEFAULT_TEMPLATE = """
            A user has invoked the "{command_name}" command.

            ## Command Instructions

            {command_md_content}

            ## Expert Skills

            {skills_md_content}

            ## Configuration

            {config_content}

            ## Source Material

            {source_content}

            ## Additional Context

            {supplemental_content}

            ## Output Requirements

            {output_requirements}
            """;

    private static final Pattern PLACEHOLDER = Pattern.compile(
            "\\{(command_name|command_md_content|skills_md_content|config_content"
                    + "|source_content|supplemental_content|output_requirements)}");

    private static final String PART_SEPARATOR = "\n\n---\n\n";

    private final Map<String, SourceReader> sourceReaders;

    public PromptBuilder() {
        this(SourceReader.defaults());
    }

    /**
     * @param sourceReaders readers keyed by file extension including the dot,
     *                      e.g. {@code .docx}; matched case-insensitively
     */
    public PromptBuilder(Map<String, SourceReader> sourceReaders) {
        Map<String, SourceReader> normalized = new HashMap<>();
        sourceReaders.forEach((ext, reader) -> normalized.put(ext.toLowerCase(Locale.ROOT), reader));
        this.sourceReaders = Map.copyOf(normalized);
    }

    public String build(PluginInvocation invocation, String outputRequirements) {
        return build(invocation, outputRequirements, null);
    }

    /**
     * @param template custom template using the same placeholders as
     *                 {@link #DEFAULT_TEMPLATE}; null selects the default
     */
    public String build(PluginInvocation invocation, String outputRequirements, String template) {
        Map<String, String> values = new HashMap<>();
        values.put("command_name", invocation.getCommandName());
        values.put("command_md_content", readFile(invocation.getCommandMdPath()));
        values.put("skills_md_content", skillsSection(invocation.getSkillMdPaths()));
        values.put("config_content", configSection(invocation.getConfigPaths()));
        values.put("source_content", sourceSection(invocation.getSourcePaths(), invocation.getSourceTexts()));
        values.put("supplemental_content", supplementalSection(invocation.getSupplemental()));
        values.put("output_requirements", outputRequirements);

        Matcher m = PLACEHOLDER.matcher(template != null ? template : DEFAULT_TEMPLATE);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String value = values.get(m.group(1));
            m.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : ""));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    // =========================================================================
    // Sections
    // =========================================================================

    private String skillsSection(List<String> paths) {
        List<String> parts = new ArrayList<>();
        int n = 1;
        for (String path : orEmpty(paths)) {
            parts.add("### Skill " + n++ + ": " + stem(path) + "\n\n" + readFile(path));
        }
        return parts.isEmpty() ? "No skills specified." : String.join(PART_SEPARATOR, parts);
    }

    private String configSection(List<String> paths) {
        List<String> parts = new ArrayList<>();
        for (String path : orEmpty(paths)) {
            parts.add("### " + fileName(path) + "\n\n" + readFile(path));
        }
        return parts.isEmpty() ? "No configuration provided." : String.join(PART_SEPARATOR, parts);
    }

    private String sourceSection(List<String> paths, List<String> texts) {
        List<String> parts = new ArrayList<>();
        for (String path : orEmpty(paths)) {
            parts.add("### " + fileName(path) + "\n\n" + readSourceFile(path));
        }
        int n = 1;
        for (String text : orEmpty(texts)) {
            parts.add("### Source text " + n++ + "\n\n" + text);
        }
        return parts.isEmpty() ? "No source material provided." : String.join(PART_SEPARATOR, parts);
    }

    private static String supplementalSection(Map<String, Object> supplemental) {
        if (supplemental == null || supplemental.isEmpty())
            return "No additional context provided.";
        try {
            return JsonFile.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(supplemental);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Supplemental context is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    // =========================================================================
    // File reading
    // =========================================================================

    String readSourceFile(String path) {
        SourceReader reader = sourceReaders.get(extension(path));
        if (reader == null)
            return readFile(path);
        try {
            return reader.read(Path.of(path));
        } catch (IOException | RuntimeException e) {
            log.warn("Source reader failed for {}: {}", path, e.getMessage());
            return "[Error reading " + path + ": " + e.getMessage() + "]";
        }
    }

    static String readFile(String path) {
        try {
            return Files.readString(Path.of(path));
        } catch (NoSuchFileException e) {
            log.warn("File not found: {}", path);
            return "[File not found: " + path + "]";
        } catch (IOException | InvalidPathException e) {
            log.warn("Error reading {}: {}", path, e.getMessage());
            return "[Error reading " + path + ": " + e.getMessage() + "]";
        }
    }

    private static String fileName(String path) {
        Path name = Path.of(path).getFileName();
        return name != null ? name.toString() : path;
    }

    private static String stem(String path) {
        String name = fileName(path);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String extension(String path) {
        String name = fileName(path);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot).toLowerCase(Locale.ROOT) : "";
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list != null ? list : List.of();
    }
}
