package org.stablemir.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stablemir.bridge.intern.InternStrategy;
import org.stablemir.lint.LintLevel;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Settings of the stable layer, read from the {@code stablemir} section of a Typesafe config.
 * Defaults live in {@code reference.conf}.
 */
public final class StableMirConfig {

    private static final Logger LOG = LoggerFactory.getLogger(StableMirConfig.class);

    static final String ROOT = "stablemir";
    static final String INTERNING_STRATEGY = ROOT + ".interning.strategy";
    static final String LINTS = ROOT + ".lints";

    private final InternStrategy internStrategy;
    private final Map<String, LintLevel> lintLevels;

    private StableMirConfig(InternStrategy internStrategy, Map<String, LintLevel> lintLevels) {
        this.internStrategy = internStrategy;
        this.lintLevels = Collections.unmodifiableMap(lintLevels);
    }

    /**
     * Loads the configuration with the usual precedence:
     * 1. System properties (-Dstablemir.interning.strategy=...)
     * 2. application.conf on the classpath
     * 3. reference.conf on the classpath
     *
     * @return The resolved settings.
     */
    public static StableMirConfig load() {
        return from(ConfigFactory.load());
    }

    /**
     * Reads settings from an explicit config tree. Missing keys fall back to {@code reference.conf}.
     *
     * @param config The config tree, e.g. from {@link ConfigFactory#parseString(String)}.
     * @return The settings.
     * @throws ConfigException.BadValue if a value is not one of the accepted names.
     */
    public static StableMirConfig from(Config config) {
        Config merged = config.withFallback(ConfigFactory.defaultReference()).resolve();

        String strategyName = merged.getString(INTERNING_STRATEGY);
        InternStrategy strategy;
        try {
            strategy = InternStrategy.fromConfigName(strategyName);
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(INTERNING_STRATEGY, e.getMessage(), e);
        }

        // Both spellings of a lint name may be present; an explicitly given one beats the default.
        Set<String> explicit = config.hasPath(LINTS) ? config.getConfig(LINTS).root().keySet() : Set.of();
        Map<String, LintLevel> levels = new HashMap<>();
        Config lints = merged.getConfig(LINTS);
        for (String lintName : lints.root().keySet()) {
            LintLevel level;
            try {
                level = LintLevel.fromConfigName(lints.getString(lintName));
            } catch (IllegalArgumentException e) {
                throw new ConfigException.BadValue(LINTS + "." + lintName, e.getMessage(), e);
            }
            if (explicit.contains(lintName)) {
                levels.put(normalizeLintName(lintName), level);
            } else {
                levels.putIfAbsent(normalizeLintName(lintName), level);
            }
        }

        LOG.debug("Stable MIR configuration: interning={}, lints={}", strategy.configName(), levels);
        return new StableMirConfig(strategy, levels);
    }

    /**
     * @return Settings from {@code reference.conf} only.
     */
    public static StableMirConfig defaults() {
        return from(ConfigFactory.empty());
    }

    public InternStrategy internStrategy() {
        return internStrategy;
    }

    /**
     * @param lintName A lint name, e.g. {@code read_zero_byte_vec}.
     * @param fallback The lint's built-in level.
     * @return The configured level, or the fallback if the lint is not configured.
     */
    public LintLevel lintLevel(String lintName, LintLevel fallback) {
        return lintLevels.getOrDefault(normalizeLintName(lintName), fallback);
    }

    private static String normalizeLintName(String lintName) {
        return lintName.replace('-', '_');
    }
}
