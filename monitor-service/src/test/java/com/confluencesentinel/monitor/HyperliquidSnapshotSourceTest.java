package com.confluencesentinel.monitor;

import com.confluencesentinel.core.diff.MalformedSnapshotException;
import com.confluencesentinel.core.model.PositionSnapshot;
import com.confluencesentinel.core.poller.SnapshotFetchException;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests {@link HyperliquidSnapshotSource} against a local stand-in for the
 * info endpoint.
 */
class HyperliquidSnapshotSourceTest {

    private static final String ACCOUNT = "0xaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa";

    private HttpServer server;
    private final AtomicInteger status = new AtomicInteger(200);
    private final AtomicReference<String> responseBody = new AtomicReference<>();
    private final AtomicReference<String> lastRequest = new AtomicReference<>();
    private HyperliquidSnapshotSource source;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/info", exchange -> {
            lastRequest.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] body = responseBody.get().getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status.get(), body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        server.start();
        source = new HyperliquidSnapshotSource(
                "http://127.0.0.1:" + server.getAddress().getPort() + "/", Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    @DisplayName("Should POST a clearinghouseState request for the account")
    void shouldPostClearinghouseRequest() throws SnapshotFetchException {
        responseBody.set("{\"assetPositions\":[],\"time\":1714564800000}");

        PositionSnapshot snapshot = source.fetchSnapshot(ACCOUNT);

        assertThat(snapshot.getAccountId()).isEqualTo(ACCOUNT);
        assertThat(lastRequest.get())
                .contains("\"type\":\"clearinghouseState\"")
                .contains("\"user\":\"" + ACCOUNT + "\"");
    }

    @Test
    @DisplayName("Should append /info to the base URL exactly once")
    void shouldBuildInfoUri() {
        assertThat(source.getInfoUri().getPath()).isEqualTo("/info");
    }

    @Test
    @DisplayName("Should classify 5xx and 429 as transient")
    void shouldClassifyServerErrorsAsTransient() {
        responseBody.set("{}");
        status.set(503);
        assertThatThrownBy(() -> source.fetchSnapshot(ACCOUNT))
                .isInstanceOfSatisfying(SnapshotFetchException.class,
                        e -> assertThat(e.isTransient()).isTrue());

        status.set(429);
        assertThatThrownBy(() -> source.fetchSnapshot(ACCOUNT))
                .isInstanceOfSatisfying(SnapshotFetchException.class,
                        e -> assertThat(e.isTransient()).isTrue());
    }

    @Test
    @DisplayName("Should classify other 4xx as permanent")
    void shouldClassifyClientErrorsAsPermanent() {
        responseBody.set("{\"error\":\"bad user\"}");
        status.set(422);

        assertThatThrownBy(() -> source.fetchSnapshot(ACCOUNT))
                .isInstanceOfSatisfying(SnapshotFetchException.class,
                        e -> assertThat(e.isTransient()).isFalse())
                .hasMessageContaining("HTTP 422");
    }

    @Test
    @DisplayName("Should surface an unparseable body as a malformed snapshot")
    void shouldReportMalformedBody() {
        responseBody.set("<html>maintenance</html>");

        assertThatThrownBy(() -> source.fetchSnapshot(ACCOUNT))
                .isInstanceOf(MalformedSnapshotException.class);
    }

    @Test
    @DisplayName("Should report a refused connection as transient")
    void shouldReportConnectionFailureAsTransient() throws IOException {
        int port;
        try (ServerSocket unused = new ServerSocket(0)) {
            port = unused.getLocalPort();
        }
        HyperliquidSnapshotSource offline =
                new HyperliquidSnapshotSource("http://127.0.0.1:" + port, Duration.ofSeconds(2));

        assertThatThrownBy(() -> offline.fetchSnapshot(ACCOUNT))
                .isInstanceOfSatisfying(SnapshotFetchException.class,
                        e -> assertThat(e.isTransient()).isTrue());
    }
}
