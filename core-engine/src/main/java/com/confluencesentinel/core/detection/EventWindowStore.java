package com.confluencesentinel.core.detection;

import com.confluencesentinel.core.model.TradeEvent;
import com.confluencesentinel.core.model.WindowEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Sliding time windows of {@link WindowEntry} keyed by scope key.
 *
 * <p>
 * Each scope has its own monitor; inserts into different scopes never
 * contend. There is no global lock. A scope emptied by {@link #sweep} is
 * retired and removed from the index; a writer that raced with the removal
 * retries against a fresh scope.
 * </p>
 *
 * <h3>Eviction</h3>
 * <p>
 * An entry is evicted when {@code timestamp <= now - window}. On insert,
 * {@code now} is the timestamp of the inserted event, so only entries
 * strictly younger than the window survive. Out-of-order events are kept in
 * arrival (sequence) order.
 * </p>
 *
 * @since 1.0.0
 */
public class EventWindowStore {

    private static final Logger LOG = LoggerFactory.getLogger(EventWindowStore.class);

    private final String name;
    private final Map<String, ScopeWindow> scopes = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    /**
     * @param name label used in log output, e.g. {@code "instrument"}
     */
    public EventWindowStore(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Evicts expired entries of the scope, appends the event and returns the
     * live entries.
     *
     * @return immutable copy of the live entries, in insertion order
     */
    public List<WindowEntry> insert(String scopeKey, TradeEvent event, Duration window) {
        return insert(scopeKey, event, window, live -> live);
    }

    /**
     * Same as {@link #insert(String, TradeEvent, Duration)}, but runs
     * {@code evaluation} on the live entries while the scope is still
     * locked. Concurrent inserts for the same scope key are therefore
     * evaluated one after the other, each seeing the previous one's entry.
     *
     * @param evaluation callback applied to the live entries under the scope lock
     * @param <R>        result type of the callback
     * @return the callback's result
     */
    public <R> R insert(String scopeKey, TradeEvent event, Duration window,
            Function<List<WindowEntry>, R> evaluation) {
        Objects.requireNonNull(scopeKey, "scopeKey must not be null");
        Objects.requireNonNull(event, "event must not be null");
        Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(evaluation, "evaluation must not be null");

        Instant cutoff = event.getTimestamp().minus(window);
        while (true) {
            ScopeWindow scope = scopes.computeIfAbsent(scopeKey, ScopeWindow::new);
            synchronized (scope) {
                if (scope.retired) {
                    // removed by a concurrent sweep after our lookup
                    continue;
                }
                int evicted = scope.evict(cutoff);
                if (evicted > 0) {
                    LOG.debug("[{}:{}] evicted {} expired entries", name, scopeKey, evicted);
                }
                scope.entries.add(new WindowEntry(scopeKey, event, sequence.incrementAndGet()));
                return evaluation.apply(List.copyOf(scope.entries));
            }
        }
    }

    /**
     * Evicts expired entries from every scope and removes scopes left empty.
     *
     * @param now    reference time for eviction
     * @param window window length
     * @return number of scopes removed from the index
     */
    public int sweep(Instant now, Duration window) {
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(window, "window must not be null");

        Instant cutoff = now.minus(window);
        int evicted = 0;
        int removed = 0;
        for (Map.Entry<String, ScopeWindow> e : scopes.entrySet()) {
            ScopeWindow scope = e.getValue();
            synchronized (scope) {
                if (scope.retired) {
                    continue;
                }
                evicted += scope.evict(cutoff);
                if (scope.entries.isEmpty()) {
                    scope.retired = true;
                    scopes.remove(e.getKey(), scope);
                    removed++;
                }
            }
        }
        if (evicted > 0 || removed > 0) {
            LOG.debug("[{}] sweep at {}: {} entries evicted, {} scope(s) removed, {} active",
                    name, now, evicted, removed, scopes.size());
        }
        return removed;
    }

    /**
     * @return number of scopes currently in the index
     */
    public int scopeCount() {
        return scopes.size();
    }

    public boolean contains(String scopeKey) {
        return scopes.containsKey(scopeKey);
    }

    /**
     * @return immutable copy of the scope's entries, empty if the scope is unknown
     */
    public List<WindowEntry> liveEntries(String scopeKey) {
        ScopeWindow scope = scopes.get(scopeKey);
        if (scope == null) {
            return List.of();
        }
        synchronized (scope) {
            return List.copyOf(scope.entries);
        }
    }

    public String getName() {
        return name;
    }

    // ---------------------------------------------------------------
    // Per-scope state, guarded by its own monitor
    // ---------------------------------------------------------------

    private static final class ScopeWindow {

        private final String scopeKey;
        private final List<WindowEntry> entries = new ArrayList<>();
        private boolean retired;

        ScopeWindow(String scopeKey) {
            this.scopeKey = scopeKey;
        }

        int evict(Instant cutoff) {
            int before = entries.size();
            entries.removeIf(entry -> !entry.getTimestamp().isAfter(cutoff));
            return before - entries.size();
        }

        @Override
        public String toString() {
            return "ScopeWindow{" + scopeKey + ", entries=" + entries.size() + '}';
        }
    }
}
