package com.confluencesentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * A {@link TradeEvent} as stored in a correlation window.
 *
 * <p>
 * The sequence number is assigned by the window store on insertion and is
 * strictly increasing across all scopes of that store. It breaks ties between
 * events carrying the same timestamp, so arrival order decides.
 * </p>
 *
 * @since 1.0.0
 */
public final class WindowEntry implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Orders entries by event timestamp, then by insertion sequence. */
    public static final Comparator<WindowEntry> RECENCY = Comparator
            .comparing(WindowEntry::getTimestamp)
            .thenComparingLong(WindowEntry::getSequence);

    private final String scopeKey;
    private final TradeEvent event;
    private final long sequence;

    public WindowEntry(String scopeKey, TradeEvent event, long sequence) {
        this.scopeKey = Objects.requireNonNull(scopeKey, "scopeKey must not be null");
        this.event = Objects.requireNonNull(event, "event must not be null");
        this.sequence = sequence;
    }

    public String getScopeKey() {
        return scopeKey;
    }

    public TradeEvent getEvent() {
        return event;
    }

    public long getSequence() {
        return sequence;
    }

    public Instant getTimestamp() {
        return event.getTimestamp();
    }

    public String getAccountId() {
        return event.getAccountId();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof WindowEntry that))
            return false;
        return sequence == that.sequence && scopeKey.equals(that.scopeKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scopeKey, sequence);
    }

    @Override
    public String toString() {
        return "WindowEntry{#" + sequence + " " + scopeKey + " " + event + '}';
    }
}
