package com.pluginroute.common.config;

import java.nio.file.Path;
import java.util.Map;

/**
 * On-disk locations used by command interception: the plugins root, the
 * installed-plugins manifest and the user's MCP server config.
 *
 * <p>
 * Every location can be overridden through the environment:
 * <ul>
 * <li>{@code PLUGINROUTE_PLUGINS_ROOT} (default {@code ~/.claude/plugins})</li>
 * <li>{@code PLUGINROUTE_INSTALLED_PLUGINS} (default
 * {@code <plugins root>/installed_plugins.json})</li>
 * <li>{@code PLUGINROUTE_MCP_CONFIG} (default {@code ~/.claude/mcp.json})</li>
 * </ul>
 */
public final class RoutePaths {

    private RoutePaths() {
    }

    // =========================================================================
    // Directory / file name constants
    // =========================================================================

    public static final String ENV_PLUGINS_ROOT = "PLUGINROUTE_PLUGINS_ROOT";
    public static final String ENV_INSTALLED_PLUGINS = "PLUGINROUTE_INSTALLED_PLUGINS";
    public static final String ENV_MCP_CONFIG = "PLUGINROUTE_MCP_CONFIG";

    private static final String CLAUDE_DIRNAME = ".claude";
    private static final String PLUGINS_DIRNAME = "plugins";
    private static final String INSTALLED_PLUGINS_FILENAME = "installed_plugins.json";
    private static final String MCP_CONFIG_FILENAME = "mcp.json";

    /**
     * Resolved locations for a single lookup.
     */
    public record Locations(Path pluginsRoot, Path installedPluginsFile, Path mcpConfigFile) {
    }

    // =========================================================================
    // Resolution
    // =========================================================================

    /**
     * Resolve all locations from the process environment and home directory.
     */
    public static Locations resolve() {
        return resolve(System.getenv(), homeDir());
    }

    public static Locations resolve(Map<String, String> env, String homedir) {
        Path pluginsRoot = resolvePluginsRoot(env, homedir);
        return new Locations(
                pluginsRoot,
                resolveInstalledPluginsFile(env, homedir, pluginsRoot),
                resolveMcpConfigFile(env, homedir));
    }

    public static Path resolvePluginsRoot(Map<String, String> env, String homedir) {
        String override = envTrimmed(env, ENV_PLUGINS_ROOT);
        if (override != null) {
            return resolveUserPath(override, homedir);
        }
        return Path.of(homedir, CLAUDE_DIRNAME, PLUGINS_DIRNAME);
    }

    public static Path resolveInstalledPluginsFile(Map<String, String> env, String homedir, Path pluginsRoot) {
        String override = envTrimmed(env, ENV_INSTALLED_PLUGINS);
        if (override != null) {
            return resolveUserPath(override, homedir);
        }
        return pluginsRoot.resolve(INSTALLED_PLUGINS_FILENAME);
    }

    public static Path resolveMcpConfigFile(Map<String, String> env, String homedir) {
        String override = envTrimmed(env, ENV_MCP_CONFIG);
        if (override != null) {
            return resolveUserPath(override, homedir);
        }
        return Path.of(homedir, CLAUDE_DIRNAME, MCP_CONFIG_FILENAME);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    /**
     * Expand a leading {@code ~} to the home directory and make the path
     * absolute.
     */
    public static Path resolveUserPath(String input, String homedir) {
        String trimmed = input.trim();
        if (trimmed.startsWith("~")) {
            return Path.of(homedir + trimmed.substring(1)).toAbsolutePath().normalize();
        }
        return Path.of(trimmed).toAbsolutePath().normalize();
    }

    private static String envTrimmed(Map<String, String> env, String key) {
        if (env == null)
            return null;
        String value = env.get(key);
        if (value == null)
            return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String homeDir() {
        return System.getProperty("user.home");
    }
}
