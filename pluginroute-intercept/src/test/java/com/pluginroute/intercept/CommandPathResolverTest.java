package com.pluginroute.intercept;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandPathResolverTest {

    @TempDir
    Path pluginDir;

    private Path writeCommand(String name) throws IOException {
        Path commands = Files.createDirectories(pluginDir.resolve("commands"));
        return Files.writeString(commands.resolve(name + ".md"), "# " + name);
    }

    private Path writeSkill(String dir) throws IOException {
        Path skillDir = Files.createDirectories(pluginDir.resolve("skills").resolve(dir));
        return Files.writeString(skillDir.resolve("SKILL.md"), "# " + dir);
    }

    @Test
    void basicResolution() throws Exception {
        Path cmd = writeCommand("review-contract");
        Path b = writeSkill("negotiation");
        Path a = writeSkill("analysis");

        var paths = CommandPathResolver.resolvePaths(pluginDir, "review-contract");

        assertEquals(cmd.toRealPath(), paths.commandFile());
        assertEquals(List.of(a.toRealPath(), b.toRealPath()), paths.skillFiles());
    }

    @Test
    void skillsOrderedByDirectoryName() throws Exception {
        writeCommand("cmd");
        Path z = writeSkill("zeta");
        Path m = writeSkill("mid");
        Path a = writeSkill("alpha");

        var paths = CommandPathResolver.resolvePaths(pluginDir, "cmd");
        assertEquals(List.of(a.toRealPath(), m.toRealPath(), z.toRealPath()), paths.skillFiles());
    }

    @Test
    void noSkillsDirectory() throws Exception {
        writeCommand("my-command");

        var paths = CommandPathResolver.resolvePaths(pluginDir, "my-command");
        assertTrue(paths.commandFile().toString().endsWith("my-command.md"));
        assertTrue(paths.skillFiles().isEmpty());
    }

    @Test
    void skillDirWithoutSkillMdSkipped() throws Exception {
        writeCommand("cmd");
        Path kept = writeSkill("kept");
        Files.createDirectories(pluginDir.resolve("skills/empty"));
        Files.writeString(pluginDir.resolve("skills/loose.md"), "not a skill dir");

        var paths = CommandPathResolver.resolvePaths(pluginDir, "cmd");
        assertEquals(List.of(kept.toRealPath()), paths.skillFiles());
    }

    @Test
    void missingCommandFileThrows() throws IOException {
        writeSkill("analysis");

        var ex = assertThrows(CommandFileMissingException.class,
                () -> CommandPathResolver.resolvePaths(pluginDir, "review-contract"));
        assertEquals(pluginDir.resolve("commands/review-contract.md"), ex.getCommandFile());
        assertTrue(ex.getMessage().contains("review-contract.md"));
    }

    @Test
    void missingCommandFileThrowsWithoutSkills() {
        assertThrows(CommandFileMissingException.class,
                () -> CommandPathResolver.resolvePaths(pluginDir, "review-contract"));
    }
}
