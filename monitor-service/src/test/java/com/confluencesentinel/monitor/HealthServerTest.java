package com.confluencesentinel.monitor;

import com.confluencesentinel.core.alert.AlertDispatcher;
import com.confluencesentinel.core.alert.AlertFormatter;
import com.confluencesentinel.core.classify.CategoryTableLoader;
import com.confluencesentinel.core.classify.InstrumentClassifier;
import com.confluencesentinel.core.config.InMemoryRuleStore;
import com.confluencesentinel.core.config.RuleRegistry;
import com.confluencesentinel.core.config.RuleSet;
import com.confluencesentinel.core.diff.PositionSnapshotDiffer;
import com.confluencesentinel.core.engine.ConfluenceEngine;
import com.confluencesentinel.core.engine.EngineMetrics;
import com.confluencesentinel.core.model.AccountKind;
import com.confluencesentinel.core.model.PositionSnapshot;
import com.confluencesentinel.core.model.TrackedAccount;
import com.confluencesentinel.core.poller.AccountRegistry;
import com.confluencesentinel.core.poller.PollerCoordinator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the HTTP endpoints of {@link HealthServer}.
 */
class HealthServerTest {

    private static final String A = "0xaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa";

    private final HttpClient client = HttpClient.newHttpClient();
    private AlertDispatcher dispatcher;
    private PollerCoordinator poller;
    private RuleRegistry rules;
    private HealthServer server;

    @BeforeEach
    void setUp() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        InstrumentClassifier classifier =
                new InstrumentClassifier(CategoryTableLoader.fromClasspath("test-categories.yml"));
        rules = new RuleRegistry(RuleSet.DEFAULTS, new InMemoryRuleStore());
        dispatcher = new AlertDispatcher(new LoggingAlertSink(), registry);
        ConfluenceEngine engine = ConfluenceEngine.builder()
                .rules(rules)
                .classifier(classifier)
                .formatter(new AlertFormatter(classifier))
                .dispatcher(dispatcher)
                .metrics(new EngineMetrics(registry))
                .build();
        poller = PollerCoordinator.builder()
                .accounts(new AccountRegistry(List.of(new TrackedAccount(A, "Alpha", AccountKind.VAULT, true))))
                .source(id -> new PositionSnapshot(id, Instant.parse("2024-05-01T12:00:00Z"), List.of()))
                .differ(new PositionSnapshotDiffer())
                .engine(engine)
                .pollInterval(Duration.ofHours(1))
                .build();
        server = new HealthServer(poller, rules, classifier);
        server.start(0);
    }

    @AfterEach
    void tearDown() {
        server.stop();
        poller.stop();
        dispatcher.close();
    }

    @Test
    @DisplayName("Should answer /health with UP")
    void shouldReportHealth() throws Exception {
        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("{\"status\":\"UP\"}");
    }

    @Test
    @DisplayName("Should report not ready until the poller runs")
    void shouldTrackReadiness() throws Exception {
        assertThat(get("/readiness").statusCode()).isEqualTo(503);

        poller.start();

        HttpResponse<String> response = get("/readiness");
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("\"poller\":\"RUNNING\"");
    }

    @Test
    @DisplayName("Should expose rules, table version and account health in /status")
    void shouldExposeStatus() throws Exception {
        poller.runCycle();
        rules.setConfluenceCount(4);

        JsonNode status = new ObjectMapper().readTree(get("/status").body());

        assertThat(status.get("poller").asText()).isEqualTo("IDLE");
        assertThat(status.get("completedCycles").asInt()).isEqualTo(1);
        assertThat(status.get("categoryTableVersion").asText()).isEqualTo("test-1");
        assertThat(status.get("rules").get("confluence_count").asText()).isEqualTo("4");

        JsonNode account = status.get("accounts").get(0);
        assertThat(account.get("address").asText()).isEqualTo(A);
        assertThat(account.get("name").asText()).isEqualTo("Alpha");
        assertThat(account.get("totalPolls").asLong()).isEqualTo(1);
        assertThat(account.get("consecutiveFailures").asInt()).isZero();
        assertThat(account.has("lastSuccess")).isTrue();
    }

    @Test
    @DisplayName("Should bind an ephemeral port when asked for port 0")
    void shouldBindEphemeralPort() {
        assertThat(server.isRunning()).isTrue();
        assertThat(server.getPort()).isPositive();
    }

    @Test
    @DisplayName("Should reject ports outside the valid range")
    void shouldRejectInvalidPort() {
        assertThatThrownBy(() -> server.start(70_000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Health port");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(
                URI.create("http://localhost:" + server.getPort() + path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
