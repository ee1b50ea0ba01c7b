package com.pluginroute.intercept;

import java.nio.file.Path;
import java.util.List;

/**
 * Value types shared by the interception lookup steps.
 */
public final class InterceptTypes {

    private InterceptTypes() {
    }

    /** Separator between plugin name and command name in a qualified skill name. */
    public static final char SEPARATOR = ':';

    // =========================================================================
    // Qualified names
    // =========================================================================

    /**
     * A skill name split on its first separator, e.g. {@code legal:review-contract}.
     */
    public record QualifiedName(String pluginName, String commandName) {
    }

    // =========================================================================
    // Lookup results
    // =========================================================================

    /**
     * An MCP server that claims a command, together with everything it claims.
     */
    public record InterceptClaim(String serverName, List<String> intercepts) {
        public InterceptClaim {
            intercepts = List.copyOf(intercepts);
        }
    }

    /**
     * Command markdown and skill markdown files resolved inside a plugin
     * directory. Skill files are ordered by their skill directory name.
     */
    public record CommandPaths(Path commandFile, List<Path> skillFiles) {
        public CommandPaths {
            skillFiles = List.copyOf(skillFiles);
        }
    }
}
