package org.stablemir.lint;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * What happens when a lint fires.
 */
public enum LintLevel {
    /** Report an error. */
    DENY("deny"),
    /** Report a warning. */
    WARN("warn"),
    /** Report nothing. */
    ALLOW("allow");

    private final String configName;

    LintLevel(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    /**
     * @param name A level as written in configuration, e.g. {@code warn}.
     * @return The level.
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static LintLevel fromConfigName(String name) {
        for (LintLevel level : values()) {
            if (level.configName.equals(name)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown lint level '" + name + "', expected one of "
                + Arrays.stream(values()).map(LintLevel::configName).collect(Collectors.joining(", ")));
    }
}
