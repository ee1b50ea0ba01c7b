package com.pluginroute.intercept;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of a successful interception lookup: everything needed to tell the
 * invoking agent to delegate a command to an MCP tool.
 *
 * @param pluginName       plugin part of the skill name, e.g. {@code legal}
 * @param commandName      command part of the skill name, e.g. {@code review-contract}
 * @param serverName       MCP server claiming the command
 * @param toolName         MCP tool to call, derived from {@code serverName}
 * @param pluginDir        absolute plugin directory
 * @param commandFile      absolute path of {@code commands/<command>.md}
 * @param skillFiles       absolute paths of {@code skills/<dir>/SKILL.md}, by directory name
 * @param serverConfigured whether the server is registered in the user's MCP config
 */
public record InterceptMatch(
        String pluginName,
        String commandName,
        String serverName,
        String toolName,
        Path pluginDir,
        Path commandFile,
        List<Path> skillFiles,
        boolean serverConfigured) {

    public InterceptMatch {
        skillFiles = List.copyOf(skillFiles);
    }
}
