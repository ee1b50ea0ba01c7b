package com.pluginroute.intercept;

import com.pluginroute.common.config.RoutePaths;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Finds the interception binding, if any, for a qualified skill name.
 *
 * <p>
 * Lookup steps, stopping at the first that yields nothing: parse the name,
 * locate the plugin directory, find a server claiming the command, resolve the
 * command and skill markdown files, then probe the user's MCP config. Every
 * failure surfaces as an empty result. Instances hold no mutable state and can
 * be shared across threads.
 */
@Slf4j
public class InterceptResolver {

    private static final String TOOL_PREFIX = "mcp__";
    private static final String TOOL_SUFFIX = "__execute_plugin_command";

    private final RoutePaths.Locations locations;

    public InterceptResolver() {
        this(RoutePaths.resolve());
    }

    public InterceptResolver(RoutePaths.Locations locations) {
        this.locations = locations;
    }

    /**
     * Resolve a skill name such as {@code legal:review-contract}.
     *
     * @return the match, or empty if the name is unqualified, the plugin is
     *         unknown, no server claims the command, or its command file is missing
     */
    public Optional<InterceptMatch> findIntercept(String skillName) {
        Optional<InterceptTypes.QualifiedName> parsed = QualifiedNames.parse(skillName);
        if (parsed.isEmpty())
            return Optional.empty();
        String pluginName = parsed.get().pluginName();
        String commandName = parsed.get().commandName();

        Optional<Path> pluginDir = PluginDirResolver.findPluginDir(
                pluginName, locations.pluginsRoot(), locations.installedPluginsFile());
        if (pluginDir.isEmpty())
            return Optional.empty();

        Optional<InterceptTypes.InterceptClaim> claim = InterceptLookup.readIntercepts(pluginDir.get(), commandName);
        if (claim.isEmpty())
            return Optional.empty();
        String serverName = claim.get().serverName();

        InterceptTypes.CommandPaths paths;
        try {
            paths = CommandPathResolver.resolvePaths(pluginDir.get(), commandName);
        } catch (CommandFileMissingException e) {
            log.warn("Server {} intercepts {}:{} but {}", serverName, pluginName, commandName, e.getMessage());
            return Optional.empty();
        } catch (InvalidPathException e) {
            log.debug("Command name {} is not a valid path: {}", commandName, e.getMessage());
            return Optional.empty();
        }

        boolean configured = ServerConfigProbe.isServerConfigured(serverName, locations.mcpConfigFile());

        return Optional.of(new InterceptMatch(
                pluginName,
                commandName,
                serverName,
                toolNameFor(serverName),
                CommandPathResolver.canonical(pluginDir.get()),
                paths.commandFile(),
                paths.skillFiles(),
                configured));
    }

    /**
     * MCP tool exposed by an intercepting server, e.g.
     * {@code mcp__generate-redlined__execute_plugin_command}.
     */
    public static String toolNameFor(String serverName) {
        return TOOL_PREFIX + serverName + TOOL_SUFFIX;
    }
}
