package com.pluginroute.intercept;

import com.fasterxml.jackson.databind.JsonNode;
import com.pluginroute.common.infra.JsonFile;

import java.nio.file.Path;

/**
 * Checks whether an MCP server is registered in the user's MCP config.
 * Informational only: the answer never decides whether a command is intercepted.
 */
public final class ServerConfigProbe {

    private ServerConfigProbe() {
    }

    /**
     * @return true if {@code mcpServers} in {@code mcpConfigFile} has a
     *         {@code serverName} key; false if it does not or the file cannot be read
     */
    public static boolean isServerConfigured(String serverName, Path mcpConfigFile) {
        JsonNode servers = JsonFile.loadObjectField(mcpConfigFile, InterceptLookup.SERVERS_KEY);
        return servers != null && servers.has(serverName);
    }
}
