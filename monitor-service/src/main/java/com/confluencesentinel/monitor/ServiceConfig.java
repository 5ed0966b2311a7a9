package com.confluencesentinel.monitor;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.function.UnaryOperator;

/**
 * Typed, immutable configuration of the monitor service.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the service is configured through container env vars or a shell
 * environment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    /** Where alerts go. */
    public enum SinkType {
        LOG,
        KAFKA
    }

    // ---------------------------------------------------------------
    // Polling
    // ---------------------------------------------------------------
    private final Duration pollInterval;
    private final int maxConcurrentFetches;
    private final Duration fetchTimeout;
    private final int baselineResetAfterFailures;

    // ---------------------------------------------------------------
    // Exchange API
    // ---------------------------------------------------------------
    private final String apiUrl;
    private final int rateLimitPerMinute;

    // ---------------------------------------------------------------
    // Rules, categories, accounts
    // ---------------------------------------------------------------
    private final String rulesConfigPath;
    private final String ruleStorePath;
    private final String categoriesPath;
    private final Duration categoryReloadInterval;
    private final String accountsPath;

    // ---------------------------------------------------------------
    // Alerts
    // ---------------------------------------------------------------
    private final SinkType alertSink;
    private final String kafkaBootstrapServers;
    private final String kafkaAlertTopic;

    // ---------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------
    private final int healthPort;

    private ServiceConfig(Builder b) {
        this.pollInterval = b.pollInterval;
        this.maxConcurrentFetches = b.maxConcurrentFetches;
        this.fetchTimeout = b.fetchTimeout;
        this.baselineResetAfterFailures = b.baselineResetAfterFailures;
        this.apiUrl = b.apiUrl;
        this.rateLimitPerMinute = b.rateLimitPerMinute;
        this.rulesConfigPath = b.rulesConfigPath;
        this.ruleStorePath = b.ruleStorePath;
        this.categoriesPath = b.categoriesPath;
        this.categoryReloadInterval = b.categoryReloadInterval;
        this.accountsPath = b.accountsPath;
        this.alertSink = b.alertSink;
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaAlertTopic = b.kafkaAlertTopic;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory - resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServiceConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * @param env variable lookup, returns {@code null} for unset names
     */
    static ServiceConfig fromEnvironment(UnaryOperator<String> env) {
        Env e = new Env(env);
        try {
            return new Builder()
                    .pollInterval(Duration.ofSeconds(e.parseLong("POLL_INTERVAL_SECONDS", "60")))
                    .maxConcurrentFetches(e.parseInt("MAX_CONCURRENT_FETCHES", "4"))
                    .fetchTimeout(Duration.ofMillis(e.parseLong("FETCH_TIMEOUT_MS", "10000")))
                    .baselineResetAfterFailures(e.parseInt("BASELINE_RESET_AFTER_FAILURES", "3"))
                    .apiUrl(e.get("HYPERLIQUID_API_URL", "https://api.hyperliquid.xyz"))
                    .rateLimitPerMinute(e.parseInt("RATE_LIMIT_PER_MINUTE", "60"))
                    .rulesConfigPath(e.get("RULES_CONFIG_PATH", ""))
                    .ruleStorePath(e.get("RULE_STORE_PATH", "data/rules.json"))
                    .categoriesPath(e.get("CATEGORIES_PATH", ""))
                    .categoryReloadInterval(Duration.ofSeconds(e.parseLong("CATEGORY_RELOAD_SECONDS", "60")))
                    .accountsPath(e.get("ACCOUNTS_PATH", ""))
                    .alertSink(parseSink(e.get("ALERT_SINK", "log")))
                    .kafkaBootstrapServers(e.get("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaAlertTopic(e.get("KAFKA_ALERT_TOPIC", "confluence-alerts"))
                    .healthPort(e.parseInt("HEALTH_PORT", "8080"))
                    .build();
        } catch (NumberFormatException ex) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + ex.getMessage(), ex);
        }
    }

    private static SinkType parseSink(String value) {
        try {
            return SinkType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("ALERT_SINK must be 'log' or 'kafka', got: " + value, ex);
        }
    }

    // ---------------------------------------------------------------
    // Kafka properties helpers
    // ---------------------------------------------------------------

    /**
     * Build Kafka producer {@link Properties} for the alert sink.
     *
     * <p>
     * Idempotent, acks from all in-sync replicas, retries left to the client.
     * </p>
     *
     * @return new Properties instance configured for production
     */
    public Properties kafkaProducerProperties() {
        Properties props = new Properties();
        props.setProperty("bootstrap.servers", kafkaBootstrapServers);
        props.setProperty("acks", "all");
        props.setProperty("enable.idempotence", "true");
        props.setProperty("delivery.timeout.ms", "120000");
        props.setProperty("client.id", "confluence-sentinel");
        return props;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Duration getPollInterval() {
        return pollInterval;
    }

    public int getMaxConcurrentFetches() {
        return maxConcurrentFetches;
    }

    public Duration getFetchTimeout() {
        return fetchTimeout;
    }

    public int getBaselineResetAfterFailures() {
        return baselineResetAfterFailures;
    }

    public String getApiUrl() {
        return apiUrl;
    }

    public int getRateLimitPerMinute() {
        return rateLimitPerMinute;
    }

    /**
     * @return rules file path, blank for the bundled {@code rules.yml}
     */
    public String getRulesConfigPath() {
        return rulesConfigPath;
    }

    public String getRuleStorePath() {
        return ruleStorePath;
    }

    /**
     * @return category table path, blank for the bundled {@code categories.yml}
     */
    public String getCategoriesPath() {
        return categoriesPath;
    }

    public Duration getCategoryReloadInterval() {
        return categoryReloadInterval;
    }

    /**
     * @return accounts file path, blank for the bundled {@code accounts.yml}
     */
    public String getAccountsPath() {
        return accountsPath;
    }

    public SinkType getAlertSink() {
        return alertSink;
    }

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaAlertTopic() {
        return kafkaAlertTopic;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (positive intervals and counts, port in [1, 65535], non-blank
     * URL and topic).
     * </p>
     */
    public static class Builder {
        private Duration pollInterval = Duration.ofSeconds(60);
        private int maxConcurrentFetches = 4;
        private Duration fetchTimeout = Duration.ofSeconds(10);
        private int baselineResetAfterFailures = 3;
        private String apiUrl = "https://api.hyperliquid.xyz";
        private int rateLimitPerMinute = 60;
        private String rulesConfigPath = "";
        private String ruleStorePath = "data/rules.json";
        private String categoriesPath = "";
        private Duration categoryReloadInterval = Duration.ofSeconds(60);
        private String accountsPath = "";
        private SinkType alertSink = SinkType.LOG;
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaAlertTopic = "confluence-alerts";
        private int healthPort = 8080;

        public Builder pollInterval(Duration v) {
            this.pollInterval = v;
            return this;
        }

        public Builder maxConcurrentFetches(int v) {
            this.maxConcurrentFetches = v;
            return this;
        }

        public Builder fetchTimeout(Duration v) {
            this.fetchTimeout = v;
            return this;
        }

        public Builder baselineResetAfterFailures(int v) {
            this.baselineResetAfterFailures = v;
            return this;
        }

        public Builder apiUrl(String v) {
            this.apiUrl = v;
            return this;
        }

        public Builder rateLimitPerMinute(int v) {
            this.rateLimitPerMinute = v;
            return this;
        }

        public Builder rulesConfigPath(String v) {
            this.rulesConfigPath = v;
            return this;
        }

        public Builder ruleStorePath(String v) {
            this.ruleStorePath = v;
            return this;
        }

        public Builder categoriesPath(String v) {
            this.categoriesPath = v;
            return this;
        }

        public Builder categoryReloadInterval(Duration v) {
            this.categoryReloadInterval = v;
            return this;
        }

        public Builder accountsPath(String v) {
            this.accountsPath = v;
            return this;
        }

        public Builder alertSink(SinkType v) {
            this.alertSink = v;
            return this;
        }

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaAlertTopic(String v) {
            this.kafkaAlertTopic = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            Objects.requireNonNull(pollInterval, "pollInterval required");
            Objects.requireNonNull(fetchTimeout, "fetchTimeout required");
            Objects.requireNonNull(categoryReloadInterval, "categoryReloadInterval required");
            Objects.requireNonNull(alertSink, "alertSink required");
            Objects.requireNonNull(rulesConfigPath, "rulesConfigPath required");
            Objects.requireNonNull(categoriesPath, "categoriesPath required");
            Objects.requireNonNull(accountsPath, "accountsPath required");
            requireNonBlank(apiUrl, "apiUrl");
            requireNonBlank(ruleStorePath, "ruleStorePath");
            requireNonBlank(kafkaBootstrapServers, "kafkaBootstrapServers");
            requireNonBlank(kafkaAlertTopic, "kafkaAlertTopic");

            requirePositive(pollInterval, "pollInterval");
            requirePositive(fetchTimeout, "fetchTimeout");
            requirePositive(categoryReloadInterval, "categoryReloadInterval");
            if (maxConcurrentFetches < 1) {
                throw new IllegalArgumentException(
                        "maxConcurrentFetches must be >= 1, got: " + maxConcurrentFetches);
            }
            if (baselineResetAfterFailures < 1) {
                throw new IllegalArgumentException(
                        "baselineResetAfterFailures must be >= 1, got: " + baselineResetAfterFailures);
            }
            if (rateLimitPerMinute < 1) {
                throw new IllegalArgumentException(
                        "rateLimitPerMinute must be >= 1, got: " + rateLimitPerMinute);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }

            return new ServiceConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }

        private static void requirePositive(Duration value, String name) {
            if (value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be > 0, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static final class Env {
        private final UnaryOperator<String> lookup;

        Env(UnaryOperator<String> lookup) {
            this.lookup = lookup;
        }

        String get(String name, String defaultValue) {
            String value = lookup.apply(name);
            return (value != null && !value.isBlank()) ? value : defaultValue;
        }

        int parseInt(String name, String defaultValue) {
            return Integer.parseInt(get(name, defaultValue).trim());
        }

        long parseLong(String name, String defaultValue) {
            return Long.parseLong(get(name, defaultValue).trim());
        }
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "pollInterval=" + pollInterval +
                ", maxConcurrentFetches=" + maxConcurrentFetches +
                ", fetchTimeout=" + fetchTimeout +
                ", baselineResetAfterFailures=" + baselineResetAfterFailures +
                ", apiUrl='" + apiUrl + '\'' +
                ", rateLimitPerMinute=" + rateLimitPerMinute +
                ", ruleStorePath='" + ruleStorePath + '\'' +
                ", alertSink=" + alertSink +
                ", kafkaAlertTopic='" + kafkaAlertTopic + '\'' +
                ", healthPort=" + healthPort +
                '}';
    }
}
