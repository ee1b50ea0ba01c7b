package com.pluginroute.common.infra;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileTest {

    @TempDir
    Path tempDir;

    @Test
    void loadTree_validObject() throws IOException {
        Path file = tempDir.resolve("data.json");
        Files.writeString(file, "{\"a\": 1, \"b\": [\"x\"]}");

        JsonNode tree = JsonFile.loadTree(file);
        assertNotNull(tree);
        assertEquals(1, tree.get("a").asInt());
    }

    @Test
    void loadTree_missingFileReturnsNull() {
        assertNull(JsonFile.loadTree(tempDir.resolve("missing.json")));
        assertNull(JsonFile.loadTree(null));
    }

    @Test
    void loadTree_invalidJsonReturnsNull() throws IOException {
        Path file = tempDir.resolve("bad.json");
        Files.writeString(file, "{not json");
        assertNull(JsonFile.loadTree(file));
    }

    @Test
    void loadTree_emptyFileReturnsNull() throws IOException {
        Path file = tempDir.resolve("empty.json");
        Files.writeString(file, "");
        assertNull(JsonFile.loadTree(file));
    }

    @Test
    void loadTree_trailingContentRejected() throws IOException {
        Path file = tempDir.resolve("trailing.json");
        Files.writeString(file, "{\"a\": 1} {\"b\": 2}");
        assertNull(JsonFile.loadTree(file));
    }

    @Test
    void loadTree_directoryReturnsNull() {
        assertNull(JsonFile.loadTree(tempDir));
    }

    @Test
    void loadObjectField_returnsNestedObject() throws IOException {
        Path file = tempDir.resolve("mcp.json");
        Files.writeString(file, "{\"mcpServers\": {\"srv\": {}}}");

        JsonNode servers = JsonFile.loadObjectField(file, "mcpServers");
        assertNotNull(servers);
        assertTrue(servers.has("srv"));
    }

    @Test
    void loadObjectField_wrongShapeReturnsNull() throws IOException {
        Path file = tempDir.resolve("mcp.json");
        Files.writeString(file, "{\"mcpServers\": [\"srv\"]}");
        assertNull(JsonFile.loadObjectField(file, "mcpServers"));

        Files.writeString(file, "[1, 2]");
        assertNull(JsonFile.loadObjectField(file, "mcpServers"));
    }

    @Test
    void stringElements_skipsNonStrings() throws IOException {
        JsonNode array = JsonFile.mapper().readTree("[\"a\", 1, null, \"b\", {}]");
        assertEquals(List.of("a", "b"), JsonFile.stringElements(array));
    }

    @Test
    void stringElements_nonArrayIsEmpty() throws IOException {
        assertTrue(JsonFile.stringElements(null).isEmpty());
        assertTrue(JsonFile.stringElements(JsonFile.mapper().readTree("\"a\"")).isEmpty());
    }
}
