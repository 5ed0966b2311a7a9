package com.confluencesentinel.core.config;

import java.util.Locale;
import java.util.Optional;

/**
 * Names of the operator-tunable detection rules.
 *
 * <p>
 * The {@link #key()} is the stable external name used by the rule store and by
 * text-based operator commands.
 * </p>
 *
 * @since 1.0.0
 */
public enum RuleKey {

    CONFLUENCE_COUNT("confluence_count"),
    TIME_WINDOW("time_window"),
    MIN_TRADE_VALUE("min_trade_value"),
    ENABLED("enabled"),
    THEME_CONFLUENCE_COUNT("theme_confluence_count"),
    THEME_TIME_WINDOW("theme_time_window"),
    THEME_ENABLED("theme_enabled");

    private final String key;

    RuleKey(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * @param name external rule name, case-insensitive
     * @return matching key, or empty if unknown
     */
    public static Optional<RuleKey> fromKey(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalised = name.trim().toLowerCase(Locale.ROOT);
        for (RuleKey k : values()) {
            if (k.key.equals(normalised)) {
                return Optional.of(k);
            }
        }
        return Optional.empty();
    }
}
