package com.pluginroute.intercept;

import com.pluginroute.common.config.RoutePaths;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class InterceptResolverTest {

    @TempDir
    Path tempDir;

    Path pluginsRoot;
    Path pluginDir;
    Path mcpConfig;
    InterceptResolver resolver;

    @BeforeEach
    void setUp() throws IOException {
        pluginsRoot = tempDir.resolve("plugins");
        pluginDir = Files.createDirectories(pluginsRoot.resolve("knowledge-work-plugins/legal"));
        mcpConfig = tempDir.resolve("mcp.json");
        resolver = new InterceptResolver(new RoutePaths.Locations(
                pluginsRoot, pluginsRoot.resolve("installed_plugins.json"), mcpConfig));

        Files.createDirectories(pluginDir.resolve("commands"));
        Files.writeString(pluginDir.resolve("commands/review-contract.md"), "# Review");
        Files.writeString(pluginDir.resolve("commands/triage-nda.md"), "# Triage");
        Files.createDirectories(pluginDir.resolve("skills/contract-review"));
        Files.writeString(pluginDir.resolve("skills/contract-review/SKILL.md"), "# Skill");
        Files.writeString(pluginDir.resolve(".mcp.json"), """
                {"mcpServers": {"generate-redlined": {"intercepts": ["review-contract", "missing-cmd"]}}}
                """);
        Files.writeString(mcpConfig, """
                {"mcpServers": {"generate-redlined": {"command": "uvx"}}}
                """);
    }

    @Test
    void fullMatch() throws IOException {
        InterceptMatch match = resolver.findIntercept("legal:review-contract").orElseThrow();

        assertEquals("legal", match.pluginName());
        assertEquals("review-contract", match.commandName());
        assertEquals("generate-redlined", match.serverName());
        assertEquals("mcp__generate-redlined__execute_plugin_command", match.toolName());
        assertEquals(pluginDir.toRealPath(), match.pluginDir());
        assertTrue(match.commandFile().toString().endsWith("review-contract.md"));
        assertEquals(1, match.skillFiles().size());
        assertTrue(match.serverConfigured());
    }

    @Test
    void unqualifiedSkill() {
        assertTrue(resolver.findIntercept("review-contract").isEmpty());
    }

    @Test
    void pluginNotFound() {
        assertTrue(resolver.findIntercept("sales:review-contract").isEmpty());
    }

    @Test
    void nulCharacterInPluginNameYieldsNoMatch() {
        assertTrue(resolver.findIntercept("le\0gal:review-contract").isEmpty());
    }

    @Test
    void claimedCommandWithNulCharacterYieldsNoMatch() throws IOException {
        Files.writeString(pluginDir.resolve(".mcp.json"), """
                {"mcpServers": {"generate-redlined": {"intercepts": ["review\\u0000contract"]}}}
                """);

        assertTrue(resolver.findIntercept("legal:review\0contract").isEmpty());
    }

    @Test
    void commandNotIntercepted() {
        assertTrue(resolver.findIntercept("legal:triage-nda").isEmpty());
    }

    @Test
    void claimedCommandWithoutCommandFile() {
        assertTrue(resolver.findIntercept("legal:missing-cmd").isEmpty());
    }

    @Test
    void serverNotConfigured() throws IOException {
        Files.writeString(mcpConfig, "{\"mcpServers\": {}}");

        InterceptMatch match = resolver.findIntercept("legal:review-contract").orElseThrow();
        assertFalse(match.serverConfigured());
    }

    @Test
    void mcpConfigMissing() throws IOException {
        Files.delete(mcpConfig);

        InterceptMatch match = resolver.findIntercept("legal:review-contract").orElseThrow();
        assertFalse(match.serverConfigured());
    }

    @Test
    void repeatedLookupIsIdentical() {
        InterceptMatch first = resolver.findIntercept("legal:review-contract").orElseThrow();
        InterceptMatch second = resolver.findIntercept("legal:review-contract").orElseThrow();

        assertEquals(first, second);
        assertEquals(InterceptMessageBuilder.build(first), InterceptMessageBuilder.build(second));
    }

    @Test
    void toolNameFor() {
        assertEquals("mcp__srv__execute_plugin_command", InterceptResolver.toolNameFor("srv"));
    }
}
