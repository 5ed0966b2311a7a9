package com.confluencesentinel.core.engine;

import com.confluencesentinel.core.alert.AlertDispatcher;
import com.confluencesentinel.core.alert.AlertFormatter;
import com.confluencesentinel.core.classify.InstrumentClassifier;
import com.confluencesentinel.core.config.RuleRegistry;
import com.confluencesentinel.core.detection.CorrelationDetector;
import com.confluencesentinel.core.model.CorrelationGroup;
import com.confluencesentinel.core.model.ScopeType;
import com.confluencesentinel.core.model.TradeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Pipeline from trade events to dispatched alerts.
 *
 * <p>
 * For each event: drop it if malformed or below {@code min_trade_value},
 * feed it to the instrument detector, then, if the instrument belongs to a
 * category, feed the category-tagged copy to the theme detector. Every group
 * emitted is formatted and handed to the {@link AlertDispatcher}.
 * </p>
 *
 * <p>
 * Thread-safe: the detectors synchronise per scope key and rule reads are
 * lock-free, so several pollers may call {@link #process} concurrently.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfluenceEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ConfluenceEngine.class);

    private final RuleRegistry rules;
    private final InstrumentClassifier classifier;
    private final CorrelationDetector instrumentDetector;
    private final CorrelationDetector themeDetector;
    private final AlertFormatter formatter;
    private final AlertDispatcher dispatcher;
    private final EngineMetrics metrics;

    private ConfluenceEngine(Builder b) {
        this.rules = Objects.requireNonNull(b.rules, "rules must not be null");
        this.classifier = Objects.requireNonNull(b.classifier, "classifier must not be null");
        this.formatter = Objects.requireNonNull(b.formatter, "formatter must not be null");
        this.dispatcher = Objects.requireNonNull(b.dispatcher, "dispatcher must not be null");
        this.metrics = Objects.requireNonNull(b.metrics, "metrics must not be null");
        this.instrumentDetector = new CorrelationDetector(ScopeType.INSTRUMENT, rules);
        this.themeDetector = new CorrelationDetector(ScopeType.CATEGORY, rules);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs the events through both detectors.
     *
     * @param events events of one differ run, in emission order
     * @return groups emitted, in detection order
     */
    public List<CorrelationGroup> process(List<TradeEvent> events) {
        Objects.requireNonNull(events, "events must not be null");
        long started = System.nanoTime();
        List<CorrelationGroup> groups = new ArrayList<>();

        for (TradeEvent event : events) {
            metrics.incrementEventsReceived();

            String problem = malformedReason(event);
            if (problem != null) {
                metrics.incrementDroppedMalformed();
                LOG.warn("Dropping malformed event ({}): {}", problem, event);
                continue;
            }

            BigDecimal minimum = rules.current().getMinTradeValue();
            if (event.getResultingValue().compareTo(minimum) < 0) {
                metrics.incrementDroppedBelowMinimum();
                LOG.debug("Dropping {} {} of {}: value {} below minimum {}",
                        event.getAction(), event.getInstrumentId(), event.getAccountId(),
                        event.getResultingValue().toPlainString(), minimum.toPlainString());
                continue;
            }

            instrumentDetector.onEvent(event.getInstrumentId(), event).ifPresent(groups::add);

            Optional<String> category = classifier.classify(event.getInstrumentId());
            if (category.isPresent()) {
                String categoryId = category.get();
                themeDetector.onEvent(categoryId, event.withCategoryId(categoryId)).ifPresent(groups::add);
            }
        }

        for (CorrelationGroup group : groups) {
            metrics.incrementGroupsEmitted(group.getScopeType());
            LOG.info("{} confluence on [{}]: {} account(s), total value {}",
                    group.getScopeType(), group.getScopeKey(), group.getParticipantCount(),
                    group.getTotalValue().toPlainString());
            dispatcher.dispatch(formatter.format(group));
        }

        metrics.recordBatchLatency(Duration.ofNanos(System.nanoTime() - started));
        return groups;
    }

    /**
     * Evicts expired window entries of both detectors.
     *
     * @return number of scope keys removed
     */
    public int sweep(Instant now) {
        int removed = instrumentDetector.sweep(now) + themeDetector.sweep(now);
        if (removed > 0) {
            LOG.debug("Sweep at {} removed {} idle scope(s)", now, removed);
        }
        return removed;
    }

    public CorrelationDetector getInstrumentDetector() {
        return instrumentDetector;
    }

    public CorrelationDetector getThemeDetector() {
        return themeDetector;
    }

    public EngineMetrics getMetrics() {
        return metrics;
    }

    /**
     * @return {@code null} when the event is usable, otherwise a short reason
     */
    static String malformedReason(TradeEvent event) {
        if (event == null) {
            return "null event";
        }
        if (event.getAccountId().isBlank()) {
            return "blank account id";
        }
        if (event.getInstrumentId() == null || event.getInstrumentId().isBlank()) {
            return "blank instrument id";
        }
        if (event.getResultingValue() == null) {
            return "missing value";
        }
        if (event.getResultingValue().signum() < 0) {
            return "negative value";
        }
        return null;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private RuleRegistry rules;
        private InstrumentClassifier classifier;
        private AlertFormatter formatter;
        private AlertDispatcher dispatcher;
        private EngineMetrics metrics;

        public Builder rules(RuleRegistry rules) {
            this.rules = rules;
            return this;
        }

        public Builder classifier(InstrumentClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder formatter(AlertFormatter formatter) {
            this.formatter = formatter;
            return this;
        }

        public Builder dispatcher(AlertDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        public Builder metrics(EngineMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * @throws NullPointerException if a collaborator is missing
         */
        public ConfluenceEngine build() {
            return new ConfluenceEngine(this);
        }
    }
}
