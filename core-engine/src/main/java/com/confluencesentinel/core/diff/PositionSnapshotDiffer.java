package com.confluencesentinel.core.diff;

import com.confluencesentinel.core.model.Position;
import com.confluencesentinel.core.model.PositionSide;
import com.confluencesentinel.core.model.PositionSnapshot;
import com.confluencesentinel.core.model.TradeAction;
import com.confluencesentinel.core.model.TradeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Default {@link SnapshotDiffer} comparing positions by instrument.
 *
 * <h3>Rules</h3>
 * <ul>
 * <li>No previous snapshot: no events, the current snapshot becomes the
 * baseline.</li>
 * <li>Zero-size positions count as absent.</li>
 * <li>New instrument: {@code OPEN}, delta = size, value = notional.</li>
 * <li>Same side, larger magnitude: {@code INCREASE}; smaller:
 * {@code DECREASE}; delta = new - old, value = new notional.</li>
 * <li>Side flip (long to short or back): a single {@code OPEN} for the new
 * side, delta = new - old, value = new notional.</li>
 * <li>Instrument gone: {@code CLOSE}, delta = -old size, value = 0.</li>
 * </ul>
 *
 * <p>
 * Sizes are compared with {@link BigDecimal#compareTo}, so {@code 1.0} and
 * {@code 1.00} are equal. Event timestamps come from the injected
 * {@link Clock}; the exchange time is kept as the snapshot timestamp.
 * </p>
 *
 * @since 1.0.0
 */
public class PositionSnapshotDiffer implements SnapshotDiffer {

    private static final Logger LOG = LoggerFactory.getLogger(PositionSnapshotDiffer.class);

    private final Clock clock;

    public PositionSnapshotDiffer() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock source of observation timestamps
     */
    public PositionSnapshotDiffer(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public List<TradeEvent> diff(String accountId, PositionSnapshot previous, PositionSnapshot current) {
        Objects.requireNonNull(accountId, "accountId must not be null");
        Objects.requireNonNull(current, "current snapshot must not be null");

        if (previous == null) {
            LOG.debug("[{}] First snapshot recorded as baseline ({} positions)",
                    accountId, current.getPositions().size());
            return List.of();
        }

        Map<String, Position> before = openPositions(accountId, previous);
        Map<String, Position> after = openPositions(accountId, current);
        Instant observedAt = clock.instant();
        Map<String, TradeEvent> events = new LinkedHashMap<>();

        for (Position now : after.values()) {
            Position old = before.get(now.getInstrumentId());
            TradeEvent.Builder event = baseEvent(accountId, now.getInstrumentId(), observedAt, current);

            if (old == null) {
                event.action(TradeAction.OPEN)
                        .sizeDelta(now.getSize())
                        .resultingValue(now.getNotionalValue())
                        .side(PositionSide.of(now.getSize()));
            } else if (now.getSize().compareTo(old.getSize()) == 0) {
                continue;
            } else {
                event.action(classifyChange(old.getSize(), now.getSize()))
                        .sizeDelta(now.getSize().subtract(old.getSize()))
                        .resultingValue(now.getNotionalValue())
                        .side(PositionSide.of(now.getSize()));
            }
            record(events, accountId, event.build());
        }

        for (Position old : before.values()) {
            if (after.containsKey(old.getInstrumentId())) {
                continue;
            }
            record(events, accountId, baseEvent(accountId, old.getInstrumentId(), observedAt, current)
                    .action(TradeAction.CLOSE)
                    .sizeDelta(old.getSize().negate())
                    .resultingValue(BigDecimal.ZERO)
                    .side(PositionSide.of(old.getSize()))
                    .build());
        }

        if (!events.isEmpty()) {
            LOG.debug("[{}] {} position change(s) detected", accountId, events.size());
        }
        return new ArrayList<>(events.values());
    }

    /**
     * Both sizes are non-zero and different.
     */
    static TradeAction classifyChange(BigDecimal oldSize, BigDecimal newSize) {
        if (oldSize.signum() != newSize.signum()) {
            return TradeAction.OPEN;
        }
        return newSize.abs().compareTo(oldSize.abs()) > 0 ? TradeAction.INCREASE : TradeAction.DECREASE;
    }

    private static TradeEvent.Builder baseEvent(String accountId, String instrumentId,
            Instant observedAt, PositionSnapshot current) {
        return TradeEvent.builder()
                .accountId(accountId)
                .instrumentId(instrumentId)
                .timestamp(observedAt)
                .snapshotTimestamp(current.getTimestamp());
    }

    private static void record(Map<String, TradeEvent> events, String accountId, TradeEvent event) {
        TradeEvent clash = events.putIfAbsent(event.getInstrumentId(), event);
        if (clash != null) {
            throw new InvariantViolationException("Differ produced two events for account "
                    + accountId + " and instrument " + event.getInstrumentId());
        }
    }

    private static Map<String, Position> openPositions(String accountId, PositionSnapshot snapshot) {
        Map<String, Position> open = new LinkedHashMap<>();
        for (Position p : snapshot.getPositions()) {
            if (p.isFlat()) {
                continue;
            }
            if (open.putIfAbsent(p.getInstrumentId(), p) != null) {
                throw new MalformedSnapshotException(accountId,
                        "Instrument " + p.getInstrumentId() + " appears twice in snapshot of " + accountId);
            }
        }
        return open;
    }
}
