package com.confluencesentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Thread-safe holder of the detection rules in force.
 *
 * <h3>Reads</h3>
 * <p>
 * {@link #current()} is lock-free and returns one immutable {@link RuleSet};
 * callers that need several values read them from that single instance.
 * </p>
 *
 * <h3>Writes</h3>
 * <p>
 * Writes are serialised. Each write builds a candidate rule set (validation
 * happens here), saves it to the {@link RuleStore} and only then publishes
 * it. If validation or saving fails, the previous rules stay in force and
 * the exception propagates to the caller.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(RuleRegistry.class);

    private final AtomicReference<RuleSet> current;
    private final RuleStore store;

    /**
     * @param initial rules in force until the first write
     * @param store   persistence for validated changes
     */
    public RuleRegistry(RuleSet initial, RuleStore store) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial rules must not be null"));
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    /**
     * Create a registry from configured defaults overlaid with the values
     * previously persisted in {@code store}.
     *
     * <p>
     * Persisted entries that are unknown or no longer valid are logged and
     * skipped; the default for that rule is used instead.
     * </p>
     *
     * @param defaults defaults from {@code rules.yml}
     * @param store    rule store to restore from
     * @return registry holding the restored rules
     * @throws RuleStoreException if the store cannot be read
     */
    public static RuleRegistry restore(RuleSet defaults, RuleStore store) {
        Objects.requireNonNull(defaults, "defaults must not be null");
        Objects.requireNonNull(store, "store must not be null");

        RuleSet rules = defaults;
        Map<String, String> persisted = store.load();
        for (Map.Entry<String, String> entry : persisted.entrySet()) {
            RuleKey key = RuleKey.fromKey(entry.getKey()).orElse(null);
            if (key == null) {
                LOG.warn("Ignoring unknown persisted rule '{}'", entry.getKey());
                continue;
            }
            try {
                rules = rules.with(key, entry.getValue());
            } catch (InvalidRuleException e) {
                LOG.warn("Ignoring persisted rule {}={}: {}", entry.getKey(), entry.getValue(), e.getMessage());
            }
        }
        LOG.info("Rules in force: {}", rules);
        return new RuleRegistry(rules, store);
    }

    /**
     * @return the latest committed rules
     */
    public RuleSet current() {
        return current.get();
    }

    // ---------------------------------------------------------------
    // Typed setters
    // ---------------------------------------------------------------

    public RuleSet setConfluenceCount(int count) {
        return update(RuleKey.CONFLUENCE_COUNT, r -> r.toBuilder().confluenceCount(count).build());
    }

    public RuleSet setTimeWindow(Duration window) {
        return update(RuleKey.TIME_WINDOW, r -> r.toBuilder().timeWindow(window).build());
    }

    public RuleSet setMinTradeValue(BigDecimal value) {
        return update(RuleKey.MIN_TRADE_VALUE, r -> r.toBuilder().minTradeValue(value).build());
    }

    public RuleSet setEnabled(boolean enabled) {
        return update(RuleKey.ENABLED, r -> r.toBuilder().enabled(enabled).build());
    }

    public RuleSet setThemeConfluenceCount(int count) {
        return update(RuleKey.THEME_CONFLUENCE_COUNT, r -> r.toBuilder().themeConfluenceCount(count).build());
    }

    public RuleSet setThemeTimeWindow(Duration window) {
        return update(RuleKey.THEME_TIME_WINDOW, r -> r.toBuilder().themeTimeWindow(window).build());
    }

    public RuleSet setThemeEnabled(boolean enabled) {
        return update(RuleKey.THEME_ENABLED, r -> r.toBuilder().themeEnabled(enabled).build());
    }

    /**
     * Change one rule from its text form, e.g. {@code set("time_window", "10m")}.
     *
     * @param name  external rule name
     * @param value text value
     * @return the newly committed rules
     * @throws InvalidRuleException if the name is unknown or the value invalid
     * @throws RuleStoreException   if the change cannot be persisted
     */
    public RuleSet set(String name, String value) {
        RuleKey key = RuleKey.fromKey(name)
                .orElseThrow(() -> new InvalidRuleException("Unknown rule: '" + name + "'"));
        return update(key, r -> r.with(key, value));
    }

    private synchronized RuleSet update(RuleKey key, UnaryOperator<RuleSet> change) {
        RuleSet before = current.get();
        RuleSet after = change.apply(before);
        if (after.equals(before)) {
            return before;
        }
        store.save(after.toMap());
        current.set(after);
        LOG.info("Rule {} changed: {} -> {}", key.key(),
                before.toMap().get(key.key()), after.toMap().get(key.key()));
        return after;
    }
}
