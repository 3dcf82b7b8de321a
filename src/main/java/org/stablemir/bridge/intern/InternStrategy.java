package org.stablemir.bridge.intern;

import java.util.Locale;

/**
 * Selects the {@link InternTable} implementation a session uses.
 */
public enum InternStrategy {
    LINEAR("linear"),
    HASH_CONSING("hash-consing");

    private final String configName;

    InternStrategy(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public <T> InternTable<T> newTable() {
        return switch (this) {
            case LINEAR -> new LinearInternTable<>();
            case HASH_CONSING -> new HashConsingInternTable<>();
        };
    }

    /**
     * @param name A configuration value such as {@code hash-consing}.
     * @return The matching strategy.
     * @throws IllegalArgumentException if no strategy has that name.
     */
    public static InternStrategy fromConfigName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (InternStrategy strategy : values()) {
            if (strategy.configName.equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown interning strategy '" + name + "'");
    }
}
