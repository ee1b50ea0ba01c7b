package com.pluginroute.intercept;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Resolves the markdown files of a command inside a plugin directory.
 *
 * <pre>
 * plugin_dir/
 *   commands/&lt;command&gt;.md
 *   skills/&lt;skill&gt;/SKILL.md
 * </pre>
 */
@Slf4j
public final class CommandPathResolver {

    private CommandPathResolver() {
    }

    private static final String COMMANDS_DIRNAME = "commands";
    private static final String SKILLS_DIRNAME = "skills";
    private static final String SKILL_FILENAME = "SKILL.md";

    /**
     * Resolve the command markdown and every skill markdown of a plugin.
     * Skill directories without a {@code SKILL.md} are skipped; a plugin without
     * {@code skills/} has no skill files.
     *
     * @throws CommandFileMissingException if {@code commands/<command>.md} is absent
     */
    public static InterceptTypes.CommandPaths resolvePaths(Path pluginDir, String commandName)
            throws CommandFileMissingException {
        Path commandFile = pluginDir.resolve(COMMANDS_DIRNAME).resolve(commandName + ".md");
        if (!Files.isRegularFile(commandFile)) {
            throw new CommandFileMissingException(commandFile);
        }

        List<Path> skillFiles = new ArrayList<>();
        for (Path skillDir : listSkillDirs(pluginDir.resolve(SKILLS_DIRNAME))) {
            Path skillFile = skillDir.resolve(SKILL_FILENAME);
            if (Files.isRegularFile(skillFile)) {
                skillFiles.add(canonical(skillFile));
            }
        }
        return new InterceptTypes.CommandPaths(canonical(commandFile), skillFiles);
    }

    private static List<Path> listSkillDirs(Path skillsDir) {
        List<Path> dirs = new ArrayList<>();
        if (!Files.isDirectory(skillsDir))
            return dirs;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(skillsDir, Files::isDirectory)) {
            stream.forEach(dirs::add);
        } catch (IOException e) {
            log.debug("Failed to list skills directory {}: {}", skillsDir, e.getMessage());
        }
        dirs.sort(Comparator.comparing((Path p) -> p.getFileName().toString()));
        return dirs;
    }

    /**
     * Absolute path with symlinks resolved, falling back to the normalized
     * absolute path when the real path cannot be determined.
     */
    static Path canonical(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            log.debug("Cannot resolve real path of {}: {}", path, e.getMessage());
            return path.toAbsolutePath().normalize();
        }
    }
}
