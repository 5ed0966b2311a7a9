package com.confluencesentinel.monitor;

import com.confluencesentinel.core.diff.MalformedSnapshotException;
import com.confluencesentinel.core.model.Position;
import com.confluencesentinel.core.model.PositionSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts a Hyperliquid {@code clearinghouseState} response into a
 * {@link PositionSnapshot}.
 *
 * <h3>Mapping</h3>
 * <ul>
 * <li>{@code time} (epoch millis) &rarr; snapshot timestamp</li>
 * <li>{@code assetPositions[].position.coin} &rarr; instrument id</li>
 * <li>{@code szi} &rarr; signed size</li>
 * <li>{@code positionValue} &rarr; notional value (absolute)</li>
 * <li>{@code entryPx} &rarr; entry price, optional</li>
 * </ul>
 *
 * <p>
 * Amounts arrive as decimal strings and are parsed as {@link BigDecimal}
 * without going through {@code double}. Structural problems are reported as
 * {@link MalformedSnapshotException}; missing per-position amounts are left
 * {@code null} for the snapshot validator to report.
 * </p>
 */
public class ClearinghouseStateParser {

    private final ObjectMapper mapper;

    public ClearinghouseStateParser() {
        this(JsonMappers.create());
    }

    ClearinghouseStateParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @param accountId account the response was requested for
     * @param body      raw JSON response body
     * @return parsed snapshot
     * @throws MalformedSnapshotException if the body is not a usable clearinghouse state
     */
    public PositionSnapshot parse(String accountId, String body) {
        JsonNode root;
        try {
            root = mapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new MalformedSnapshotException(accountId, "Response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedSnapshotException(accountId, "Response is not a JSON object");
        }

        JsonNode time = root.get("time");
        if (time == null || !time.canConvertToLong()) {
            throw new MalformedSnapshotException(accountId, "Response has no numeric 'time'");
        }
        Instant timestamp = Instant.ofEpochMilli(time.asLong());

        JsonNode assetPositions = root.get("assetPositions");
        List<Position> positions = new ArrayList<>();
        if (assetPositions == null || assetPositions.isNull()) {
            return new PositionSnapshot(accountId, timestamp, positions);
        }
        if (!assetPositions.isArray()) {
            throw new MalformedSnapshotException(accountId, "'assetPositions' is not an array");
        }
        for (int i = 0; i < assetPositions.size(); i++) {
            JsonNode position = assetPositions.get(i).get("position");
            if (position == null || !position.isObject()) {
                throw new MalformedSnapshotException(accountId, "assetPositions[" + i + "] has no 'position'");
            }
            BigDecimal value = decimal(accountId, position, "positionValue");
            positions.add(new Position(
                    text(position, "coin"),
                    decimal(accountId, position, "szi"),
                    value == null ? null : value.abs(),
                    decimal(accountId, position, "entryPx")));
        }
        return new PositionSnapshot(accountId, timestamp, positions);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static BigDecimal decimal(String accountId, JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        try {
            return new BigDecimal(value.asText().trim());
        } catch (NumberFormatException e) {
            throw new MalformedSnapshotException(accountId,
                    "Field '" + field + "' is not a decimal: '" + value.asText() + "'", e);
        }
    }
}
