package com.confluencesentinel.monitor;

import com.confluencesentinel.core.classify.InstrumentClassifier;
import com.confluencesentinel.core.config.RuleRegistry;
import com.confluencesentinel.core.poller.AccountHealth;
import com.confluencesentinel.core.poller.PollerCoordinator;
import com.confluencesentinel.core.poller.PollerState;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server that exposes health, readiness and status endpoints.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} – {@code 200 OK} with body {@code {"status":"UP"}}
 * while the process is alive</li>
 * <li>{@code GET /readiness} – {@code 200} while the poller is running,
 * {@code 503} otherwise</li>
 * <li>{@code GET /status} – poller state, completed cycles, rules in force,
 * category table version and per-account health as JSON</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer} so no external dependencies
 * (Jetty, Netty, etc.) are required.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);

    private final PollerCoordinator poller;
    private final RuleRegistry rules;
    private final InstrumentClassifier classifier;
    private final ObjectMapper mapper = JsonMappers.create();

    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public HealthServer(PollerCoordinator poller, RuleRegistry rules, InstrumentClassifier classifier) {
        this.poller = Objects.requireNonNull(poller, "poller must not be null");
        this.rules = Objects.requireNonNull(rules, "rules must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    /**
     * Start the health server on the given port.
     *
     * @param port TCP port to bind to; {@code 0} picks a free port
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", HealthServer::handleHealthCheck);
            server.createContext("/readiness", this::handleReadiness);
            server.createContext("/status", this::handleStatus);

            server.setExecutor(Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "health-server");
                t.setDaemon(true);
                return t;
            }));

            server.start();
            running.set(true);
            LOG.info("Health server started on port {}", getPort());
        } catch (IOException e) {
            LOG.error("Failed to start health server on port {}: {}", port, e.getMessage(), e);
        }
    }

    /**
     * Stop the health server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Health server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return bound port, or {@code -1} if not started
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private static void handleHealthCheck(HttpExchange exchange) throws IOException {
        respond(exchange, 200, HEALTH_RESPONSE);
    }

    private void handleReadiness(HttpExchange exchange) throws IOException {
        PollerState state = poller.getState();
        ObjectNode body = mapper.createObjectNode();
        body.put("status", state == PollerState.RUNNING ? "UP" : "DOWN");
        body.put("poller", state.name());
        respond(exchange, state == PollerState.RUNNING ? 200 : 503, mapper.writeValueAsBytes(body));
    }

    private void handleStatus(HttpExchange exchange) throws IOException {
        respond(exchange, 200, mapper.writeValueAsBytes(status()));
    }

    ObjectNode status() {
        ObjectNode root = mapper.createObjectNode();
        root.put("poller", poller.getState().name());
        root.put("completedCycles", poller.getCompletedCycles());
        root.put("categoryTableVersion", classifier.version());

        ObjectNode ruleNode = root.putObject("rules");
        rules.current().toMap().forEach(ruleNode::put);

        ArrayNode accounts = root.putArray("accounts");
        Map<String, AccountHealth> health = new TreeMap<>(poller.getHealth());
        poller.getAccounts().all().forEach(account -> {
            ObjectNode node = accounts.addObject();
            node.put("address", account.getAddress());
            node.put("name", account.getDisplayName());
            node.put("kind", account.getKind().name());
            node.put("active", account.isActive());
            AccountHealth h = health.get(account.getAddress());
            if (h != null) {
                node.put("consecutiveFailures", h.getConsecutiveFailures());
                node.put("totalPolls", h.getTotalPolls());
                node.put("totalFailures", h.getTotalFailures());
                node.put("totalEvents", h.getTotalEvents());
                h.getLastSuccess().ifPresent(t -> node.put("lastSuccess", t.toString()));
                h.getLastFailure().ifPresent(t -> node.put("lastFailure", t.toString()));
                h.getLastError().ifPresent(e -> node.put("lastError", e));
            }
        });
        return root;
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
