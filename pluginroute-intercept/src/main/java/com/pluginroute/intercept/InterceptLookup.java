package com.pluginroute.intercept;

import com.fasterxml.jackson.databind.JsonNode;
import com.pluginroute.common.infra.JsonFile;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads intercept bindings from a plugin's {@code .mcp.json}.
 *
 * <pre>
 * {
 *   "mcpServers": {
 *     "generate-redlined": { "intercepts": ["review-contract"] }
 *   }
 * }
 * </pre>
 */
@Slf4j
public final class InterceptLookup {

    private InterceptLookup() {
    }

    public static final String BINDINGS_FILENAME = ".mcp.json";
    public static final String SERVERS_KEY = "mcpServers";
    public static final String INTERCEPTS_KEY = "intercepts";

    /**
     * Find the first server, in file order, whose {@code intercepts} list contains
     * {@code commandName}. A missing or malformed file reads as no claim.
     */
    public static Optional<InterceptTypes.InterceptClaim> readIntercepts(Path pluginDir, String commandName) {
        JsonNode servers = JsonFile.loadObjectField(pluginDir.resolve(BINDINGS_FILENAME), SERVERS_KEY);
        if (servers == null)
            return Optional.empty();

        Iterator<Map.Entry<String, JsonNode>> it = servers.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> server = it.next();
            if (!server.getValue().isObject())
                continue;
            JsonNode intercepts = server.getValue().get(INTERCEPTS_KEY);
            if (intercepts == null || !intercepts.isArray())
                continue;
            List<String> claimed = JsonFile.stringElements(intercepts);
            if (claimed.contains(commandName)) {
                log.debug("Command {} in {} claimed by server {}", commandName, pluginDir, server.getKey());
                return Optional.of(new InterceptTypes.InterceptClaim(server.getKey(), claimed));
            }
        }
        return Optional.empty();
    }

    /**
     * Commands intercepted by {@code serverName} in a plugin's {@code .mcp.json};
     * empty when the file, the server entry or its list is missing or malformed.
     */
    public static List<String> listInterceptedCommands(Path pluginDir, String serverName) {
        JsonNode servers = JsonFile.loadObjectField(pluginDir.resolve(BINDINGS_FILENAME), SERVERS_KEY);
        if (servers == null)
            return List.of();
        JsonNode server = servers.get(serverName);
        if (server == null || !server.isObject())
            return List.of();
        return List.copyOf(JsonFile.stringElements(server.get(INTERCEPTS_KEY)));
    }
}
