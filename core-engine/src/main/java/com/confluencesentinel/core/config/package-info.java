/**
 * Detection rule configuration.
 *
 * <p>
 * Defaults come from YAML via
 * {@link com.confluencesentinel.core.config.RulesLoader}; the live, operator
 * tunable values are held by
 * {@link com.confluencesentinel.core.config.RuleRegistry} and persisted through
 * a {@link com.confluencesentinel.core.config.RuleStore}.
 * </p>
 *
 * @since 1.0.0
 */
package com.confluencesentinel.core.config;
