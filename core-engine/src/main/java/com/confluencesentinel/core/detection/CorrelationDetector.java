package com.confluencesentinel.core.detection;

import com.confluencesentinel.core.config.RuleRegistry;
import com.confluencesentinel.core.config.RuleSet;
import com.confluencesentinel.core.model.CorrelationGroup;
import com.confluencesentinel.core.model.ScopeType;
import com.confluencesentinel.core.model.TradeEvent;
import com.confluencesentinel.core.model.WindowEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Confluence detector for one {@link ScopeType}.
 *
 * <p>
 * Fires when at least {@code confluence_count} distinct accounts have a live
 * event in the same scope window. Owns its {@link EventWindowStore}; insert
 * and evaluation of an event happen atomically per scope key.
 * </p>
 *
 * <h3>Evaluation</h3>
 * <ol>
 * <li>Reduce live entries to the latest per account (timestamp, then
 * sequence).</li>
 * <li>Fewer distinct accounts than the threshold: nothing.</li>
 * <li>Cooldown: a group emitted for the same scope key less than one window
 * before the trigger suppresses the new one, unless an account absent from
 * that group has joined.</li>
 * <li>Otherwise build the group.</li>
 * </ol>
 *
 * <p>
 * Rules are read once per evaluation from a single {@link RuleSet}. When
 * detection is disabled for the scope, events are still inserted so windows
 * stay accurate, but no group is emitted.
 * </p>
 *
 * @since 1.0.0
 */
public class CorrelationDetector {

    private static final Logger LOG = LoggerFactory.getLogger(CorrelationDetector.class);

    private final ScopeType scopeType;
    private final RuleRegistry rules;
    private final EventWindowStore store;
    private final Map<String, Emission> lastEmissions = new ConcurrentHashMap<>();

    /**
     * @param scopeType scope handled by this detector
     * @param rules     source of the rule values in force
     */
    public CorrelationDetector(ScopeType scopeType, RuleRegistry rules) {
        this.scopeType = Objects.requireNonNull(scopeType, "scopeType must not be null");
        this.rules = Objects.requireNonNull(rules, "rules must not be null");
        this.store = new EventWindowStore(scopeType.name().toLowerCase());
    }

    /**
     * Inserts the event into the scope window and evaluates the result.
     *
     * @return a new group when the event completes a confluence
     */
    public Optional<CorrelationGroup> onEvent(String scopeKey, TradeEvent event) {
        Objects.requireNonNull(scopeKey, "scopeKey must not be null");
        Objects.requireNonNull(event, "event must not be null");

        RuleSet ruleSet = rules.current();
        return store.insert(scopeKey, event, ruleSet.timeWindow(scopeType),
                live -> evaluate(scopeKey, event, live, ruleSet));
    }

    /**
     * Evaluates a set of live entries against the current rules. Records the
     * emission for cooldown purposes when a group is returned.
     */
    public Optional<CorrelationGroup> evaluate(String scopeKey, TradeEvent trigger, List<WindowEntry> live) {
        return evaluate(scopeKey, trigger, live, rules.current());
    }

    /**
     * Evicts expired window entries and cooldown records.
     *
     * @return number of scope keys removed from the window index
     */
    public int sweep(Instant now) {
        Duration window = rules.current().timeWindow(scopeType);
        int removed = store.sweep(now, window);
        lastEmissions.entrySet().removeIf(e -> !e.getValue().timestamp.isAfter(now.minus(window)));
        return removed;
    }

    public ScopeType getScopeType() {
        return scopeType;
    }

    public EventWindowStore getWindowStore() {
        return store;
    }

    // ---------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------

    private Optional<CorrelationGroup> evaluate(String scopeKey, TradeEvent trigger,
            List<WindowEntry> live, RuleSet ruleSet) {
        Objects.requireNonNull(trigger, "trigger must not be null");
        if (!ruleSet.isEnabled(scopeType)) {
            return Optional.empty();
        }

        Map<String, WindowEntry> latest = latestPerAccount(live);
        int threshold = ruleSet.confluenceCount(scopeType);
        if (latest.size() < threshold) {
            return Optional.empty();
        }

        Duration window = ruleSet.timeWindow(scopeType);
        Emission last = lastEmissions.get(scopeKey);
        if (last != null
                && Duration.between(last.timestamp, trigger.getTimestamp()).compareTo(window) < 0
                && last.accounts.containsAll(latest.keySet())) {
            LOG.debug("[{}:{}] {} participant(s) already alerted at {}, suppressed",
                    scopeType, scopeKey, latest.size(), last.timestamp);
            return Optional.empty();
        }

        List<TradeEvent> contributions = latest.values().stream()
                .sorted(WindowEntry.RECENCY)
                .map(WindowEntry::getEvent)
                .collect(Collectors.toList());

        CorrelationGroup group = CorrelationGroup.builder()
                .scopeType(scopeType)
                .scopeKey(scopeKey)
                .contributions(contributions)
                .trigger(trigger)
                .windowStart(trigger.getTimestamp().minus(window))
                .windowEnd(trigger.getTimestamp())
                .requiredCount(threshold)
                .build();

        lastEmissions.put(scopeKey, new Emission(trigger.getTimestamp(), Set.copyOf(latest.keySet())));
        LOG.debug("[{}:{}] fired: {} participant(s) >= threshold {}",
                scopeType, scopeKey, latest.size(), threshold);
        return Optional.of(group);
    }

    static Map<String, WindowEntry> latestPerAccount(List<WindowEntry> live) {
        Map<String, WindowEntry> latest = new LinkedHashMap<>();
        for (WindowEntry entry : live) {
            latest.merge(entry.getAccountId(), entry,
                    (a, b) -> WindowEntry.RECENCY.compare(a, b) >= 0 ? a : b);
        }
        return latest;
    }

    List<String> cooldownKeys() {
        return new ArrayList<>(lastEmissions.keySet());
    }

    private static final class Emission {
        private final Instant timestamp;
        private final Set<String> accounts;

        Emission(Instant timestamp, Set<String> accounts) {
            this.timestamp = timestamp;
            this.accounts = accounts;
        }
    }
}
