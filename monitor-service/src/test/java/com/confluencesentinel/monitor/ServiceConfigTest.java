package com.confluencesentinel.monitor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ServiceConfig}.
 */
class ServiceConfigTest {

    @Test
    @DisplayName("Should fall back to defaults when no variable is set")
    void shouldUseDefaults() {
        ServiceConfig config = ServiceConfig.fromEnvironment(name -> null);

        assertThat(config.getPollInterval()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.getMaxConcurrentFetches()).isEqualTo(4);
        assertThat(config.getFetchTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.getBaselineResetAfterFailures()).isEqualTo(3);
        assertThat(config.getApiUrl()).isEqualTo("https://api.hyperliquid.xyz");
        assertThat(config.getRateLimitPerMinute()).isEqualTo(60);
        assertThat(config.getRulesConfigPath()).isEmpty();
        assertThat(config.getRuleStorePath()).isEqualTo("data/rules.json");
        assertThat(config.getCategoriesPath()).isEmpty();
        assertThat(config.getCategoryReloadInterval()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.getAccountsPath()).isEmpty();
        assertThat(config.getAlertSink()).isEqualTo(ServiceConfig.SinkType.LOG);
        assertThat(config.getKafkaBootstrapServers()).isEqualTo("localhost:9092");
        assertThat(config.getKafkaAlertTopic()).isEqualTo("confluence-alerts");
        assertThat(config.getHealthPort()).isEqualTo(8080);
    }

    @Test
    @DisplayName("Should read overrides from the environment")
    void shouldReadOverrides() {
        Map<String, String> env = Map.of(
                "POLL_INTERVAL_SECONDS", "30",
                "MAX_CONCURRENT_FETCHES", "8",
                "FETCH_TIMEOUT_MS", "2500",
                "ALERT_SINK", "Kafka",
                "KAFKA_ALERT_TOPIC", "alerts-v2",
                "CATEGORIES_PATH", "/etc/sentinel/categories.yml",
                "HEALTH_PORT", "9090");

        ServiceConfig config = ServiceConfig.fromEnvironment(env::get);

        assertThat(config.getPollInterval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getMaxConcurrentFetches()).isEqualTo(8);
        assertThat(config.getFetchTimeout()).isEqualTo(Duration.ofMillis(2500));
        assertThat(config.getAlertSink()).isEqualTo(ServiceConfig.SinkType.KAFKA);
        assertThat(config.getKafkaAlertTopic()).isEqualTo("alerts-v2");
        assertThat(config.getCategoriesPath()).isEqualTo("/etc/sentinel/categories.yml");
        assertThat(config.getHealthPort()).isEqualTo(9090);
    }

    @Test
    @DisplayName("Should treat blank variables as unset")
    void shouldIgnoreBlankValues() {
        ServiceConfig config = ServiceConfig.fromEnvironment(Map.of("HEALTH_PORT", "  ")::get);

        assertThat(config.getHealthPort()).isEqualTo(8080);
    }

    @Test
    @DisplayName("Should fail on a non-numeric value")
    void shouldFailOnNonNumeric() {
        assertThatThrownBy(() -> ServiceConfig.fromEnvironment(Map.of("POLL_INTERVAL_SECONDS", "soon")::get))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Failed to parse numeric environment variable");
    }

    @Test
    @DisplayName("Should fail on an unknown alert sink")
    void shouldFailOnUnknownSink() {
        assertThatThrownBy(() -> ServiceConfig.fromEnvironment(Map.of("ALERT_SINK", "telegram")::get))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ALERT_SINK");
    }

    @Test
    @DisplayName("Should reject out-of-range values at build time")
    void shouldValidateRanges() {
        assertThatThrownBy(() -> new ServiceConfig.Builder().maxConcurrentFetches(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxConcurrentFetches");
        assertThatThrownBy(() -> new ServiceConfig.Builder().pollInterval(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("pollInterval");
        assertThatThrownBy(() -> new ServiceConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
        assertThatThrownBy(() -> new ServiceConfig.Builder().kafkaAlertTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaAlertTopic");
    }

    @Test
    @DisplayName("Should build idempotent producer properties")
    void shouldBuildProducerProperties() {
        ServiceConfig config = new ServiceConfig.Builder()
                .kafkaBootstrapServers("broker-1:9092,broker-2:9092")
                .build();

        Properties props = config.kafkaProducerProperties();

        assertThat(props.getProperty("bootstrap.servers")).isEqualTo("broker-1:9092,broker-2:9092");
        assertThat(props.getProperty("acks")).isEqualTo("all");
        assertThat(props.getProperty("enable.idempotence")).isEqualTo("true");
    }
}
