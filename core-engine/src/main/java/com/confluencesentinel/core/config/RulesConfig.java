package com.confluencesentinel.core.config;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Top-level POJO for the default rules YAML.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * confluenceCount: 2
 * timeWindowSeconds: 300
 * minTradeValue: 1000
 * enabled: true
 * themeConfluenceCount: 2
 * themeTimeWindowSeconds: 900
 * themeEnabled: true
 * </pre>
 *
 * <p>
 * Omitted keys keep the built-in defaults. Call {@link #validate()} (or
 * {@link #toRuleSet()}, which validates) after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class RulesConfig {

    private int confluenceCount = RuleSet.DEFAULTS.getConfluenceCount();
    private long timeWindowSeconds = RuleSet.DEFAULTS.getTimeWindow().getSeconds();
    private BigDecimal minTradeValue = RuleSet.DEFAULTS.getMinTradeValue();
    private boolean enabled = RuleSet.DEFAULTS.isEnabled();
    private int themeConfluenceCount = RuleSet.DEFAULTS.getThemeConfluenceCount();
    private long themeTimeWindowSeconds = RuleSet.DEFAULTS.getThemeTimeWindow().getSeconds();
    private boolean themeEnabled = RuleSet.DEFAULTS.isThemeEnabled();

    /**
     * Convert to a validated {@link RuleSet}.
     *
     * @return rule set built from this configuration
     * @throws IllegalStateException if any value violates a rule constraint
     */
    public RuleSet toRuleSet() {
        try {
            return RuleSet.builder()
                    .confluenceCount(confluenceCount)
                    .timeWindow(Duration.ofSeconds(timeWindowSeconds))
                    .minTradeValue(minTradeValue)
                    .enabled(enabled)
                    .themeConfluenceCount(themeConfluenceCount)
                    .themeTimeWindow(Duration.ofSeconds(themeTimeWindowSeconds))
                    .themeEnabled(themeEnabled)
                    .build();
        } catch (InvalidRuleException e) {
            throw new IllegalStateException(
                    "Rules configuration validation failed: " + e.getMessage(), e);
        }
    }

    /**
     * @throws IllegalStateException if any value violates a rule constraint
     */
    public void validate() {
        toRuleSet();
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public int getConfluenceCount() {
        return confluenceCount;
    }

    public void setConfluenceCount(int confluenceCount) {
        this.confluenceCount = confluenceCount;
    }

    public long getTimeWindowSeconds() {
        return timeWindowSeconds;
    }

    public void setTimeWindowSeconds(long timeWindowSeconds) {
        this.timeWindowSeconds = timeWindowSeconds;
    }

    public BigDecimal getMinTradeValue() {
        return minTradeValue;
    }

    public void setMinTradeValue(BigDecimal minTradeValue) {
        this.minTradeValue = minTradeValue;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getThemeConfluenceCount() {
        return themeConfluenceCount;
    }

    public void setThemeConfluenceCount(int themeConfluenceCount) {
        this.themeConfluenceCount = themeConfluenceCount;
    }

    public long getThemeTimeWindowSeconds() {
        return themeTimeWindowSeconds;
    }

    public void setThemeTimeWindowSeconds(long themeTimeWindowSeconds) {
        this.themeTimeWindowSeconds = themeTimeWindowSeconds;
    }

    public boolean isThemeEnabled() {
        return themeEnabled;
    }

    public void setThemeEnabled(boolean themeEnabled) {
        this.themeEnabled = themeEnabled;
    }

    @Override
    public String toString() {
        return "RulesConfig{" +
                "confluenceCount=" + confluenceCount +
                ", timeWindowSeconds=" + timeWindowSeconds +
                ", minTradeValue=" + minTradeValue +
                ", enabled=" + enabled +
                ", themeConfluenceCount=" + themeConfluenceCount +
                ", themeTimeWindowSeconds=" + themeTimeWindowSeconds +
                ", themeEnabled=" + themeEnabled +
                '}';
    }
}
