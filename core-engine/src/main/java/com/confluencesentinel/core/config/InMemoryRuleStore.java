package com.confluencesentinel.core.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Non-durable {@link RuleStore} kept in memory.
 *
 * <p>
 * Used when no rule file is configured and in tests.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryRuleStore implements RuleStore {

    private volatile Map<String, String> rules = Map.of();
    private volatile int saveCount;

    public InMemoryRuleStore() {
    }

    /**
     * @param initial values returned by the first {@link #load()}
     */
    public InMemoryRuleStore(Map<String, String> initial) {
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(initial));
    }

    @Override
    public Map<String, String> load() {
        return rules;
    }

    @Override
    public synchronized void save(Map<String, String> rules) {
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
        saveCount++;
    }

    /**
     * @return number of successful saves since construction
     */
    public int getSaveCount() {
        return saveCount;
    }
}
