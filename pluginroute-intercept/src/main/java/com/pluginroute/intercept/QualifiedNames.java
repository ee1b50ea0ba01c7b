package com.pluginroute.intercept;

import java.util.Optional;

/**
 * Parses {@code <plugin>:<command>} skill names.
 */
public final class QualifiedNames {

    private QualifiedNames() {
    }

    /**
     * Split a skill name on its first separator. Anything after the first
     * separator, further separators included, is the command name.
     *
     * @return the parsed name, or empty if there is no separator or either part
     *         is empty
     */
    public static Optional<InterceptTypes.QualifiedName> parse(String skillName) {
        if (skillName == null)
            return Optional.empty();
        int idx = skillName.indexOf(InterceptTypes.SEPARATOR);
        if (idx <= 0 || idx == skillName.length() - 1)
            return Optional.empty();
        return Optional.of(new InterceptTypes.QualifiedName(
                skillName.substring(0, idx), skillName.substring(idx + 1)));
    }

    /**
     * Cheap pre-check used before any filesystem work.
     */
    public static boolean isQualified(String skillName) {
        return skillName != null && skillName.indexOf(InterceptTypes.SEPARATOR) >= 0;
    }
}
