package com.confluencesentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Point-in-time view of all open positions of one account.
 *
 * <p>
 * Snapshots are produced by a snapshot source and never modified afterwards;
 * the position list is copied and exposed read-only.
 * </p>
 *
 * @since 1.0.0
 */
public final class PositionSnapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String accountId;
    private final Instant timestamp;
    private final List<Position> positions;

    /**
     * @param accountId account address the snapshot belongs to
     * @param timestamp exchange-reported snapshot time
     * @param positions open positions, in exchange order
     */
    public PositionSnapshot(String accountId, Instant timestamp, List<Position> positions) {
        this.accountId = Objects.requireNonNull(accountId, "accountId must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.positions = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(positions, "positions must not be null")));
    }

    public String getAccountId() {
        return accountId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return unmodifiable list of positions
     */
    public List<Position> getPositions() {
        return positions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PositionSnapshot that))
            return false;
        return accountId.equals(that.accountId)
                && timestamp.equals(that.timestamp)
                && positions.equals(that.positions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accountId, timestamp, positions);
    }

    @Override
    public String toString() {
        return "PositionSnapshot{" +
                "accountId='" + accountId + '\'' +
                ", timestamp=" + timestamp +
                ", positions=" + positions.size() +
                '}';
    }
}
