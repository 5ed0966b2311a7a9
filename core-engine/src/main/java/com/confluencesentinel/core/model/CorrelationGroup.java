package com.confluencesentinel.core.model;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * A confluence: enough distinct accounts traded the same scope inside one window.
 *
 * <p>
 * Created by the correlation detector at the moment the threshold is met and
 * never changed afterwards. A later crossing of the same scope produces a new
 * group. The contributions hold exactly one event per participating account
 * (the account's most recent one), ordered oldest first.
 * </p>
 *
 * @since 1.0.0
 */
public final class CorrelationGroup implements Serializable {

    private static final long serialVersionUID = 1L;

    private final ScopeType scopeType;
    private final String scopeKey;
    private final List<TradeEvent> contributions;
    private final TradeEvent trigger;
    private final Instant windowStart;
    private final Instant windowEnd;
    private final int requiredCount;
    private final BigDecimal totalValue;

    private CorrelationGroup(Builder b) {
        this.scopeType = Objects.requireNonNull(b.scopeType, "scopeType must not be null");
        this.scopeKey = Objects.requireNonNull(b.scopeKey, "scopeKey must not be null");
        this.trigger = Objects.requireNonNull(b.trigger, "trigger must not be null");
        this.windowStart = Objects.requireNonNull(b.windowStart, "windowStart must not be null");
        this.windowEnd = Objects.requireNonNull(b.windowEnd, "windowEnd must not be null");
        if (b.contributions.isEmpty()) {
            throw new IllegalArgumentException("A correlation group needs at least one contribution");
        }
        this.contributions = Collections.unmodifiableList(new ArrayList<>(b.contributions));
        this.requiredCount = b.requiredCount;
        this.totalValue = contributions.stream()
                .map(TradeEvent::getResultingValue)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public static Builder builder() {
        return new Builder();
    }

    public ScopeType getScopeType() {
        return scopeType;
    }

    public String getScopeKey() {
        return scopeKey;
    }

    /**
     * @return one event per participating account, oldest first
     */
    public List<TradeEvent> getContributions() {
        return contributions;
    }

    /**
     * @return the event whose insertion met the threshold
     */
    public TradeEvent getTrigger() {
        return trigger;
    }

    public Instant getWindowStart() {
        return windowStart;
    }

    public Instant getWindowEnd() {
        return windowEnd;
    }

    public Duration getWindow() {
        return Duration.between(windowStart, windowEnd);
    }

    public int getParticipantCount() {
        return contributions.size();
    }

    /**
     * @return the confluence threshold that was in force at detection time
     */
    public int getRequiredCount() {
        return requiredCount;
    }

    /**
     * @return sum of the resulting values of all contributions
     */
    public BigDecimal getTotalValue() {
        return totalValue;
    }

    /**
     * @return participating account ids in contribution order
     */
    public Set<String> getAccountIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (TradeEvent e : contributions) {
            ids.add(e.getAccountId());
        }
        return Collections.unmodifiableSet(ids);
    }

    /**
     * @return distinct instruments involved, sorted alphabetically
     */
    public Set<String> getInstruments() {
        Set<String> instruments = new TreeSet<>();
        for (TradeEvent e : contributions) {
            instruments.add(e.getInstrumentId());
        }
        return Collections.unmodifiableSet(instruments);
    }

    public static class Builder {
        private ScopeType scopeType;
        private String scopeKey;
        private List<TradeEvent> contributions = List.of();
        private TradeEvent trigger;
        private Instant windowStart;
        private Instant windowEnd;
        private int requiredCount;

        public Builder scopeType(ScopeType scopeType) {
            this.scopeType = scopeType;
            return this;
        }

        public Builder scopeKey(String scopeKey) {
            this.scopeKey = scopeKey;
            return this;
        }

        public Builder contributions(List<TradeEvent> contributions) {
            this.contributions = contributions != null ? contributions : List.of();
            return this;
        }

        public Builder trigger(TradeEvent trigger) {
            this.trigger = trigger;
            return this;
        }

        public Builder windowStart(Instant windowStart) {
            this.windowStart = windowStart;
            return this;
        }

        public Builder windowEnd(Instant windowEnd) {
            this.windowEnd = windowEnd;
            return this;
        }

        public Builder requiredCount(int requiredCount) {
            this.requiredCount = requiredCount;
            return this;
        }

        public CorrelationGroup build() {
            return new CorrelationGroup(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CorrelationGroup that))
            return false;
        return scopeType == that.scopeType
                && scopeKey.equals(that.scopeKey)
                && trigger.equals(that.trigger)
                && contributions.equals(that.contributions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scopeType, scopeKey, trigger);
    }

    @Override
    public String toString() {
        return "CorrelationGroup{" +
                scopeType + " '" + scopeKey + '\'' +
                ", participants=" + getAccountIds() +
                ", totalValue=" + totalValue +
                ", window=[" + windowStart + ", " + windowEnd + ']' +
                '}';
    }
}
