package com.confluencesentinel.core.config;

import com.confluencesentinel.core.model.ScopeType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RuleSet}.
 */
class RuleSetTest {

    @Test
    @DisplayName("Should expose instrument and theme rules per scope type")
    void shouldResolveRulesPerScope() {
        RuleSet rules = RuleSet.builder()
                .confluenceCount(3)
                .timeWindow(Duration.ofMinutes(5))
                .themeConfluenceCount(4)
                .themeTimeWindow(Duration.ofMinutes(15))
                .themeEnabled(false)
                .build();

        assertThat(rules.confluenceCount(ScopeType.INSTRUMENT)).isEqualTo(3);
        assertThat(rules.confluenceCount(ScopeType.CATEGORY)).isEqualTo(4);
        assertThat(rules.timeWindow(ScopeType.INSTRUMENT)).isEqualTo(Duration.ofMinutes(5));
        assertThat(rules.timeWindow(ScopeType.CATEGORY)).isEqualTo(Duration.ofMinutes(15));
        assertThat(rules.isEnabled(ScopeType.INSTRUMENT)).isTrue();
        assertThat(rules.isEnabled(ScopeType.CATEGORY)).isFalse();
    }

    @Test
    @DisplayName("Should accept the boundary values 2 and 60s")
    void shouldAcceptBoundaryValues() {
        RuleSet rules = RuleSet.DEFAULTS
                .with(RuleKey.CONFLUENCE_COUNT, "2")
                .with(RuleKey.TIME_WINDOW, "60");

        assertThat(rules.getConfluenceCount()).isEqualTo(2);
        assertThat(rules.getTimeWindow()).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    @DisplayName("Should reject values below their minimum")
    void shouldRejectOutOfRangeValues() {
        assertThatThrownBy(() -> RuleSet.DEFAULTS.with(RuleKey.CONFLUENCE_COUNT, "1"))
                .isInstanceOf(InvalidRuleException.class)
                .hasMessageContaining("confluence_count");
        assertThatThrownBy(() -> RuleSet.DEFAULTS.with(RuleKey.TIME_WINDOW, "59s"))
                .isInstanceOf(InvalidRuleException.class)
                .hasMessageContaining("time_window");
        assertThatThrownBy(() -> RuleSet.DEFAULTS.with(RuleKey.MIN_TRADE_VALUE, "-1"))
                .isInstanceOf(InvalidRuleException.class)
                .hasMessageContaining("min_trade_value");
    }

    @Test
    @DisplayName("Should parse the supported duration forms")
    void shouldParseDurations() {
        assertThat(RuleSet.parseDuration(RuleKey.TIME_WINDOW, "300")).isEqualTo(Duration.ofSeconds(300));
        assertThat(RuleSet.parseDuration(RuleKey.TIME_WINDOW, "90s")).isEqualTo(Duration.ofSeconds(90));
        assertThat(RuleSet.parseDuration(RuleKey.TIME_WINDOW, "5m")).isEqualTo(Duration.ofMinutes(5));
        assertThat(RuleSet.parseDuration(RuleKey.TIME_WINDOW, "1h")).isEqualTo(Duration.ofHours(1));
        assertThat(RuleSet.parseDuration(RuleKey.TIME_WINDOW, "PT15M")).isEqualTo(Duration.ofMinutes(15));
        assertThatThrownBy(() -> RuleSet.parseDuration(RuleKey.TIME_WINDOW, "soon"))
                .isInstanceOf(InvalidRuleException.class);
    }

    @Test
    @DisplayName("Should parse on/off style booleans")
    void shouldParseBooleans() {
        assertThat(RuleSet.DEFAULTS.with(RuleKey.ENABLED, "off").isEnabled()).isFalse();
        assertThat(RuleSet.DEFAULTS.with(RuleKey.ENABLED, "YES").isEnabled()).isTrue();
        assertThatThrownBy(() -> RuleSet.DEFAULTS.with(RuleKey.ENABLED, "maybe"))
                .isInstanceOf(InvalidRuleException.class);
    }

    @Test
    @DisplayName("Should render every rule in its text form")
    void shouldRenderAsMap() {
        assertThat(RuleSet.DEFAULTS.toMap())
                .containsEntry("confluence_count", "2")
                .containsEntry("time_window", "300")
                .containsEntry("min_trade_value", "1000")
                .containsEntry("enabled", "true")
                .containsEntry("theme_confluence_count", "2")
                .containsEntry("theme_time_window", "900")
                .containsEntry("theme_enabled", "true");
    }

    @Test
    @DisplayName("Should treat equal decimals with different scale as the same rules")
    void shouldCompareDecimalsByValue() {
        RuleSet a = RuleSet.builder().minTradeValue(new BigDecimal("1000")).build();
        RuleSet b = RuleSet.builder().minTradeValue(new BigDecimal("1000.00")).build();

        assertThat(a).isEqualTo(b);
    }
}
