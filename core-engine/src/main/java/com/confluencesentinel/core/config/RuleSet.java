package com.confluencesentinel.core.config;

import com.confluencesentinel.core.model.ScopeType;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, validated set of detection rules.
 *
 * <p>
 * A {@code RuleSet} is the unit of publication in the {@link RuleRegistry}:
 * readers always get one complete instance, so a threshold and a window can
 * never be observed from two different commits.
 * </p>
 *
 * <h3>Constraints</h3>
 * <ul>
 * <li>{@code confluence_count} and {@code theme_confluence_count} &gt;= 2</li>
 * <li>{@code time_window} and {@code theme_time_window} &gt;= 60 seconds</li>
 * <li>{@code min_trade_value} &gt;= 0</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class RuleSet {

    public static final int MIN_CONFLUENCE_COUNT = 2;
    public static final Duration MIN_TIME_WINDOW = Duration.ofSeconds(60);

    /** Defaults matching the bundled {@code rules.yml}. */
    public static final RuleSet DEFAULTS = builder().build();

    private final int confluenceCount;
    private final Duration timeWindow;
    private final BigDecimal minTradeValue;
    private final boolean enabled;
    private final int themeConfluenceCount;
    private final Duration themeTimeWindow;
    private final boolean themeEnabled;

    private RuleSet(Builder b) {
        this.confluenceCount = b.confluenceCount;
        this.timeWindow = b.timeWindow;
        this.minTradeValue = b.minTradeValue.stripTrailingZeros();
        this.enabled = b.enabled;
        this.themeConfluenceCount = b.themeConfluenceCount;
        this.themeTimeWindow = b.themeTimeWindow;
        this.themeEnabled = b.themeEnabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .confluenceCount(confluenceCount)
                .timeWindow(timeWindow)
                .minTradeValue(minTradeValue)
                .enabled(enabled)
                .themeConfluenceCount(themeConfluenceCount)
                .themeTimeWindow(themeTimeWindow)
                .themeEnabled(themeEnabled);
    }

    // ---------------------------------------------------------------
    // Scope-aware accessors
    // ---------------------------------------------------------------

    /**
     * @param scope instrument or category
     * @return distinct-account threshold for that scope type
     */
    public int confluenceCount(ScopeType scope) {
        return scope == ScopeType.CATEGORY ? themeConfluenceCount : confluenceCount;
    }

    public Duration timeWindow(ScopeType scope) {
        return scope == ScopeType.CATEGORY ? themeTimeWindow : timeWindow;
    }

    public boolean isEnabled(ScopeType scope) {
        return scope == ScopeType.CATEGORY ? themeEnabled : enabled;
    }

    // ---------------------------------------------------------------
    // Plain getters
    // ---------------------------------------------------------------

    public int getConfluenceCount() {
        return confluenceCount;
    }

    public Duration getTimeWindow() {
        return timeWindow;
    }

    public BigDecimal getMinTradeValue() {
        return minTradeValue;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int getThemeConfluenceCount() {
        return themeConfluenceCount;
    }

    public Duration getThemeTimeWindow() {
        return themeTimeWindow;
    }

    public boolean isThemeEnabled() {
        return themeEnabled;
    }

    // ---------------------------------------------------------------
    // Text form
    // ---------------------------------------------------------------

    /**
     * Return a copy with one rule replaced, parsing the value from text.
     *
     * <p>
     * Windows accept plain seconds ({@code 300}), a unit suffix ({@code 300s},
     * {@code 5m}, {@code 1h}) or ISO-8601 ({@code PT5M}). Booleans accept
     * {@code true/false}, {@code on/off}, {@code yes/no}.
     * </p>
     *
     * @param key   rule to change
     * @param value text value
     * @return validated copy
     * @throws InvalidRuleException if the value cannot be parsed or is out of range
     */
    public RuleSet with(RuleKey key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        if (value == null || value.isBlank()) {
            throw new InvalidRuleException("Rule '" + key.key() + "' requires a value");
        }
        String v = value.trim();
        Builder b = toBuilder();
        switch (key) {
            case CONFLUENCE_COUNT -> b.confluenceCount(parseInt(key, v));
            case TIME_WINDOW -> b.timeWindow(parseDuration(key, v));
            case MIN_TRADE_VALUE -> b.minTradeValue(parseDecimal(key, v));
            case ENABLED -> b.enabled(parseBoolean(key, v));
            case THEME_CONFLUENCE_COUNT -> b.themeConfluenceCount(parseInt(key, v));
            case THEME_TIME_WINDOW -> b.themeTimeWindow(parseDuration(key, v));
            case THEME_ENABLED -> b.themeEnabled(parseBoolean(key, v));
            default -> throw new InvalidRuleException("Unsupported rule: " + key.key());
        }
        return b.build();
    }

    /**
     * @return every rule keyed by {@link RuleKey#key()}, windows in seconds
     */
    public Map<String, String> toMap() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put(RuleKey.CONFLUENCE_COUNT.key(), Integer.toString(confluenceCount));
        map.put(RuleKey.TIME_WINDOW.key(), Long.toString(timeWindow.getSeconds()));
        map.put(RuleKey.MIN_TRADE_VALUE.key(), minTradeValue.toPlainString());
        map.put(RuleKey.ENABLED.key(), Boolean.toString(enabled));
        map.put(RuleKey.THEME_CONFLUENCE_COUNT.key(), Integer.toString(themeConfluenceCount));
        map.put(RuleKey.THEME_TIME_WINDOW.key(), Long.toString(themeTimeWindow.getSeconds()));
        map.put(RuleKey.THEME_ENABLED.key(), Boolean.toString(themeEnabled));
        return map;
    }

    private static int parseInt(RuleKey key, String v) {
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new InvalidRuleException("Rule '" + key.key() + "' expects an integer, got: " + v, e);
        }
    }

    private static BigDecimal parseDecimal(RuleKey key, String v) {
        try {
            return new BigDecimal(v);
        } catch (NumberFormatException e) {
            throw new InvalidRuleException("Rule '" + key.key() + "' expects a decimal, got: " + v, e);
        }
    }

    private static boolean parseBoolean(RuleKey key, String v) {
        return switch (v.toLowerCase(Locale.ROOT)) {
            case "true", "on", "yes" -> true;
            case "false", "off", "no" -> false;
            default -> throw new InvalidRuleException(
                    "Rule '" + key.key() + "' expects true/false, got: " + v);
        };
    }

    static Duration parseDuration(RuleKey key, String v) {
        String lower = v.toLowerCase(Locale.ROOT);
        try {
            if (lower.startsWith("pt")) {
                return Duration.parse(v.toUpperCase(Locale.ROOT));
            }
            if (lower.endsWith("h")) {
                return Duration.ofHours(Long.parseLong(lower.substring(0, lower.length() - 1)));
            }
            if (lower.endsWith("m")) {
                return Duration.ofMinutes(Long.parseLong(lower.substring(0, lower.length() - 1)));
            }
            if (lower.endsWith("s")) {
                return Duration.ofSeconds(Long.parseLong(lower.substring(0, lower.length() - 1)));
            }
            return Duration.ofSeconds(Long.parseLong(lower));
        } catch (RuntimeException e) {
            throw new InvalidRuleException("Rule '" + key.key() + "' expects a duration, got: " + v, e);
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder; {@link #build()} validates every constraint and reports
     * all violations in one {@link InvalidRuleException}.
     */
    public static class Builder {
        private int confluenceCount = 2;
        private Duration timeWindow = Duration.ofSeconds(300);
        private BigDecimal minTradeValue = new BigDecimal("1000");
        private boolean enabled = true;
        private int themeConfluenceCount = 2;
        private Duration themeTimeWindow = Duration.ofSeconds(900);
        private boolean themeEnabled = true;

        public Builder confluenceCount(int v) {
            this.confluenceCount = v;
            return this;
        }

        public Builder timeWindow(Duration v) {
            this.timeWindow = v;
            return this;
        }

        public Builder minTradeValue(BigDecimal v) {
            this.minTradeValue = v;
            return this;
        }

        public Builder enabled(boolean v) {
            this.enabled = v;
            return this;
        }

        public Builder themeConfluenceCount(int v) {
            this.themeConfluenceCount = v;
            return this;
        }

        public Builder themeTimeWindow(Duration v) {
            this.themeTimeWindow = v;
            return this;
        }

        public Builder themeEnabled(boolean v) {
            this.themeEnabled = v;
            return this;
        }

        /**
         * @return validated rule set
         * @throws InvalidRuleException if any constraint is violated
         */
        public RuleSet build() {
            List<String> errors = new ArrayList<>();
            checkCount(RuleKey.CONFLUENCE_COUNT, confluenceCount, errors);
            checkCount(RuleKey.THEME_CONFLUENCE_COUNT, themeConfluenceCount, errors);
            checkWindow(RuleKey.TIME_WINDOW, timeWindow, errors);
            checkWindow(RuleKey.THEME_TIME_WINDOW, themeTimeWindow, errors);
            if (minTradeValue == null) {
                errors.add("'" + RuleKey.MIN_TRADE_VALUE.key() + "' is required");
            } else if (minTradeValue.signum() < 0) {
                errors.add("'" + RuleKey.MIN_TRADE_VALUE.key() + "' must be >= 0, got: "
                        + minTradeValue.toPlainString());
            }
            if (!errors.isEmpty()) {
                throw new InvalidRuleException("Invalid rules: " + String.join("; ", errors));
            }
            return new RuleSet(this);
        }

        private static void checkCount(RuleKey key, int value, List<String> errors) {
            if (value < MIN_CONFLUENCE_COUNT) {
                errors.add("'" + key.key() + "' must be >= " + MIN_CONFLUENCE_COUNT + ", got: " + value);
            }
        }

        private static void checkWindow(RuleKey key, Duration value, List<String> errors) {
            if (value == null) {
                errors.add("'" + key.key() + "' is required");
            } else if (value.compareTo(MIN_TIME_WINDOW) < 0) {
                errors.add("'" + key.key() + "' must be >= " + MIN_TIME_WINDOW.getSeconds()
                        + "s, got: " + value.getSeconds() + "s");
            } else if (value.getNano() != 0) {
                errors.add("'" + key.key() + "' must be a whole number of seconds, got: " + value);
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RuleSet that))
            return false;
        return toMap().equals(that.toMap());
    }

    @Override
    public int hashCode() {
        return toMap().hashCode();
    }

    @Override
    public String toString() {
        return "RuleSet" + toMap();
    }
}
