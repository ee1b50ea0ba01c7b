package com.pluginroute.executor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Turns a source document into text that can be inserted into a prompt.
 * Readers are registered per file extension in the table handed to
 * {@link PromptBuilder}.
 */
@FunctionalInterface
public interface SourceReader {

    String read(Path path) throws IOException;

    /** Reads the file as UTF-8 text. */
    SourceReader PLAIN_TEXT = Files::readString;

    /**
     * Plain-text readers for {@code .txt}, {@code .md}, {@code .text} and
     * {@code .markdown}.
     */
    static Map<String, SourceReader> defaults() {
        return Map.of(
                ".txt", PLAIN_TEXT,
                ".md", PLAIN_TEXT,
                ".text", PLAIN_TEXT,
                ".markdown", PLAIN_TEXT);
    }
}
