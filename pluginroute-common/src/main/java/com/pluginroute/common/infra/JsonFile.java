package com.pluginroute.common.infra;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Best-effort JSON file reading. Plugin manifests, binding files and the user's
 * MCP config are all external artifacts: a missing or corrupt file reads as
 * absent, never as an error.
 */
@Slf4j
public final class JsonFile {

    private JsonFile() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    /**
     * Shared mapper configured to reject trailing content after a JSON value.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Load and parse a JSON file into a tree. Returns null if the file does not
     * exist, cannot be read, or is not valid JSON.
     */
    public static JsonNode loadTree(Path path) {
        if (path == null || !Files.isRegularFile(path))
            return null;
        try {
            String raw = Files.readString(path);
            JsonNode tree = MAPPER.readTree(raw);
            return tree == null || tree.isMissingNode() ? null : tree;
        } catch (IOException e) {
            log.debug("Ignoring unreadable JSON file {}: {}", path, e.getMessage());
            return null;
        }
    }

    /**
     * Load a JSON file and return the object stored under {@code field} of its
     * root object, or null when the file, the root object, or the field is
     * missing or not an object.
     */
    public static JsonNode loadObjectField(Path path, String field) {
        JsonNode root = loadTree(path);
        if (root == null || !root.isObject())
            return null;
        JsonNode value = root.get(field);
        return value != null && value.isObject() ? value : null;
    }

    /**
     * String elements of a JSON array node; non-string elements are skipped.
     * Returns an empty list when the node is null or not an array.
     */
    public static List<String> stringElements(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array == null || !array.isArray())
            return values;
        for (JsonNode item : array) {
            if (item.isTextual()) {
                values.add(item.asText());
            }
        }
        return values;
    }
}
