package com.confluencesentinel.monitor;

import com.confluencesentinel.core.model.PositionSnapshot;
import com.confluencesentinel.core.poller.SnapshotFetchException;
import com.confluencesentinel.core.poller.SnapshotSource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link SnapshotSource} backed by the Hyperliquid info API.
 *
 * <p>
 * Each fetch POSTs {@code {"type":"clearinghouseState","user":<address>}} to
 * {@code <apiUrl>/info} and parses the response with
 * {@link ClearinghouseStateParser}.
 * </p>
 *
 * <h3>Failure classification</h3>
 * <ul>
 * <li>I/O errors, HTTP 429 and 5xx are transient</li>
 * <li>other non-2xx statuses are permanent</li>
 * <li>an unparseable body surfaces as a malformed snapshot</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class HyperliquidSnapshotSource implements SnapshotSource {

    private static final Logger LOG = LoggerFactory.getLogger(HyperliquidSnapshotSource.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

    private final HttpClient httpClient;
    private final URI infoUri;
    private final Duration requestTimeout;
    private final ObjectMapper mapper;
    private final ClearinghouseStateParser parser;

    /**
     * @param apiUrl         API base URL, e.g. {@code https://api.hyperliquid.xyz}
     * @param requestTimeout per-request timeout
     */
    public HyperliquidSnapshotSource(String apiUrl, Duration requestTimeout) {
        this(HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build(), apiUrl, requestTimeout);
    }

    HyperliquidSnapshotSource(HttpClient httpClient, String apiUrl, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.infoUri = infoUri(Objects.requireNonNull(apiUrl, "apiUrl must not be null"));
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
        this.mapper = JsonMappers.create();
        this.parser = new ClearinghouseStateParser(mapper);
        LOG.info("Hyperliquid snapshot source targeting {}", infoUri);
    }

    @Override
    public PositionSnapshot fetchSnapshot(String accountId) throws SnapshotFetchException {
        HttpRequest request = HttpRequest.newBuilder(infoUri)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody(accountId), StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new SnapshotFetchException("I/O error fetching " + accountId + ": " + e.getMessage(), e, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SnapshotFetchException("Interrupted fetching " + accountId, e, false);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            boolean retryable = status == 429 || status >= 500;
            throw new SnapshotFetchException("HTTP " + status + " fetching " + accountId, retryable);
        }
        LOG.debug("Fetched clearinghouse state for {} ({} bytes)", accountId, response.body().length());
        return parser.parse(accountId, response.body());
    }

    String requestBody(String accountId) {
        ObjectNode body = mapper.createObjectNode();
        body.put("type", "clearinghouseState");
        body.put("user", accountId);
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode request for " + accountId, e);
        }
    }

    URI getInfoUri() {
        return infoUri;
    }

    private static URI infoUri(String apiUrl) {
        String base = apiUrl.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + "/info");
    }
}
