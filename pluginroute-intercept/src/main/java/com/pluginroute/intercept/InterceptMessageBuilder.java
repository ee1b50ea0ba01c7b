package com.pluginroute.intercept;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.pluginroute.common.infra.JsonFile;

import java.nio.file.Path;
import java.util.List;

/**
 * Renders the system message that tells the agent to gather context itself
 * and delegate the actual work to the intercepting MCP tool.
 */
public final class InterceptMessageBuilder {

    private InterceptMessageBuilder() {
    }

    public static String build(InterceptMatch match) {
        String skillPathsJson = toJsonArray(match.skillFiles());

        return "IMPORTANT: Command Interception Active for /" + match.commandName() + "\n"
                + "\n"
                + "This command has an MCP interception binding. Follow this protocol:\n"
                + "\n"
                + "## What You Do:\n"
                + "Follow the command's context-gathering workflow yourself — accept input, gather user\n"
                + "context, load configuration/playbook files. Do this conversationally across as many\n"
                + "turns as needed.\n"
                + "\n"
                + "## What You Delegate:\n"
                + "When context gathering is complete and you are ready to begin analysis/execution,\n"
                + "call the MCP tool instead of performing the work yourself:\n"
                + "\n"
                + "  Tool: " + match.toolName() + "\n"
                + "  Parameters:\n"
                + "    command_name: \"" + match.commandName() + "\"\n"
                + "    command_md_path: \"" + match.commandFile() + "\"\n"
                + "    skill_md_paths: '" + skillPathsJson + "'\n"
                + "    source_paths: <JSON array of source file paths from the user>\n"
                + "    config_paths: <JSON array of playbook/config files you found>\n"
                + "    supplemental: <JSON object with all context gathered from the user>\n"
                + "\n"
                + "## Rules:\n"
                + "1. Do NOT perform the analysis/execution yourself — the MCP tool handles it\n"
                + "2. Do NOT skip context gathering — the MCP tool needs the full context\n"
                + "3. After receiving the MCP tool result, present the markdown to the user and\n"
                + "   mention any files in output_paths\n"
                + "4. If the tool returns an API key error, ask the user for their Anthropic API key";
    }

    static String toJsonArray(List<Path> paths) {
        List<String> values = paths.stream().map(Path::toString).toList();
        try {
            return JsonFile.mapper().writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode skill paths", e);
        }
    }
}
