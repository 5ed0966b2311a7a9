package com.confluencesentinel.core.config;

import java.util.Map;

/**
 * Durable key/value persistence for rule values.
 *
 * <p>
 * Keys are {@link RuleKey#key()} names, values their text form as produced by
 * {@link RuleSet#toMap()}. The registry loads the store once at startup and
 * saves the complete rule map after every validated change.
 * </p>
 */
public interface RuleStore {

    /**
     * @return persisted rule values; empty if nothing was saved yet
     * @throws RuleStoreException if the store exists but cannot be read
     */
    Map<String, String> load();

    /**
     * Replace the persisted rule values.
     *
     * @param rules complete rule map
     * @throws RuleStoreException if the values cannot be written
     */
    void save(Map<String, String> rules);
}
