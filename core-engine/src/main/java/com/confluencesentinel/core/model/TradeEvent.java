package com.confluencesentinel.core.model;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A normalised position change of one account on one instrument.
 *
 * <p>
 * Produced by the snapshot differ, one per (account, instrument) per diff run.
 * Instances are immutable. The category id is empty when the event leaves the
 * differ; {@link #withCategoryId(String)} derives the category-tagged copy that
 * is fed to theme-level correlation.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code accountId}, {@code action} and
 * {@code timestamp} are required; instrument id and value are deliberately
 * not checked so that malformed upstream data can be recognised and dropped
 * by the engine with a diagnostic.
 * </p>
 *
 * @since 1.0.0
 */
public final class TradeEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String accountId;
    private final String instrumentId;
    private final String categoryId;
    private final TradeAction action;
    private final BigDecimal sizeDelta;
    private final BigDecimal resultingValue;
    private final PositionSide side;
    private final Instant timestamp;
    private final Instant snapshotTimestamp;

    private TradeEvent(Builder b) {
        this.accountId = Objects.requireNonNull(b.accountId, "accountId must not be null");
        this.action = Objects.requireNonNull(b.action, "action must not be null");
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.instrumentId = b.instrumentId;
        this.categoryId = b.categoryId;
        this.sizeDelta = b.sizeDelta;
        this.resultingValue = b.resultingValue;
        this.side = b.side;
        this.snapshotTimestamp = b.snapshotTimestamp != null ? b.snapshotTimestamp : b.timestamp;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param categoryId category the instrument belongs to
     * @return a copy of this event tagged with the category
     */
    public TradeEvent withCategoryId(String categoryId) {
        return toBuilder().categoryId(categoryId).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .accountId(accountId)
                .instrumentId(instrumentId)
                .categoryId(categoryId)
                .action(action)
                .sizeDelta(sizeDelta)
                .resultingValue(resultingValue)
                .side(side)
                .timestamp(timestamp)
                .snapshotTimestamp(snapshotTimestamp);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getAccountId() {
        return accountId;
    }

    public String getInstrumentId() {
        return instrumentId;
    }

    public Optional<String> getCategoryId() {
        return Optional.ofNullable(categoryId);
    }

    public TradeAction getAction() {
        return action;
    }

    /**
     * @return signed size change ({@code new - old})
     */
    public BigDecimal getSizeDelta() {
        return sizeDelta;
    }

    /**
     * @return notional value of the position after the change; zero for a close
     */
    public BigDecimal getResultingValue() {
        return resultingValue;
    }

    public PositionSide getSide() {
        return side;
    }

    /**
     * @return time the change was observed; drives window membership
     */
    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return exchange-reported time of the snapshot the event was derived from
     */
    public Instant getSnapshotTimestamp() {
        return snapshotTimestamp;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private String accountId;
        private String instrumentId;
        private String categoryId;
        private TradeAction action;
        private BigDecimal sizeDelta;
        private BigDecimal resultingValue;
        private PositionSide side;
        private Instant timestamp;
        private Instant snapshotTimestamp;

        public Builder accountId(String accountId) {
            this.accountId = accountId;
            return this;
        }

        public Builder instrumentId(String instrumentId) {
            this.instrumentId = instrumentId;
            return this;
        }

        public Builder categoryId(String categoryId) {
            this.categoryId = categoryId;
            return this;
        }

        public Builder action(TradeAction action) {
            this.action = action;
            return this;
        }

        public Builder sizeDelta(BigDecimal sizeDelta) {
            this.sizeDelta = sizeDelta;
            return this;
        }

        public Builder resultingValue(BigDecimal resultingValue) {
            this.resultingValue = resultingValue;
            return this;
        }

        public Builder side(PositionSide side) {
            this.side = side;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder snapshotTimestamp(Instant snapshotTimestamp) {
            this.snapshotTimestamp = snapshotTimestamp;
            return this;
        }

        /**
         * @return a new {@link TradeEvent}
         * @throws NullPointerException if account id, action or timestamp is missing
         */
        public TradeEvent build() {
            return new TradeEvent(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TradeEvent that))
            return false;
        return accountId.equals(that.accountId)
                && Objects.equals(instrumentId, that.instrumentId)
                && Objects.equals(categoryId, that.categoryId)
                && action == that.action
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accountId, instrumentId, categoryId, action, timestamp);
    }

    @Override
    public String toString() {
        return "TradeEvent{" +
                "account='" + accountId + '\'' +
                ", instrument='" + instrumentId + '\'' +
                (categoryId != null ? ", category='" + categoryId + '\'' : "") +
                ", action=" + action +
                ", delta=" + sizeDelta +
                ", value=" + resultingValue +
                ", timestamp=" + timestamp +
                '}';
    }
}
