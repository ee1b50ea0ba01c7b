package com.pluginroute.intercept;

import java.nio.file.Path;

/**
 * Raised when a plugin claims a command but ships no {@code commands/<command>.md}.
 * This is the one lookup failure that points at a broken plugin rather than an
 * ordinary non-match.
 */
public class CommandFileMissingException extends Exception {

    private final Path commandFile;

    public CommandFileMissingException(Path commandFile) {
        super("Command file not found: " + commandFile);
        this.commandFile = commandFile;
    }

    public Path getCommandFile() {
        return commandFile;
    }
}
