package com.confluencesentinel.core.engine;

import com.confluencesentinel.core.model.ScopeType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Micrometer meters for the confluence pipeline.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code confluence.events.received} – events handed to the engine</li>
 * <li>{@code confluence.events.dropped} – tagged {@code reason=malformed|below_minimum}</li>
 * <li>{@code confluence.groups.emitted} – tagged {@code scope=instrument|category}</li>
 * <li>{@code confluence.batch.latency} – time to process one account's events</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class EngineMetrics {

    public static final String DROP_MALFORMED = "malformed";
    public static final String DROP_BELOW_MINIMUM = "below_minimum";

    private final Counter eventsReceived;
    private final Counter droppedMalformed;
    private final Counter droppedBelowMinimum;
    private final Map<ScopeType, Counter> groupsEmitted = new EnumMap<>(ScopeType.class);
    private final Timer batchLatency;

    public EngineMetrics(MeterRegistry registry) {
        Objects.requireNonNull(registry, "registry must not be null");
        this.eventsReceived = registry.counter("confluence.events.received");
        this.droppedMalformed = registry.counter("confluence.events.dropped", "reason", DROP_MALFORMED);
        this.droppedBelowMinimum = registry.counter("confluence.events.dropped", "reason", DROP_BELOW_MINIMUM);
        for (ScopeType scope : ScopeType.values()) {
            groupsEmitted.put(scope,
                    registry.counter("confluence.groups.emitted", "scope", scope.name().toLowerCase()));
        }
        this.batchLatency = registry.timer("confluence.batch.latency");
    }

    public void incrementEventsReceived() {
        eventsReceived.increment();
    }

    public void incrementDroppedMalformed() {
        droppedMalformed.increment();
    }

    public void incrementDroppedBelowMinimum() {
        droppedBelowMinimum.increment();
    }

    public void incrementGroupsEmitted(ScopeType scope) {
        groupsEmitted.get(scope).increment();
    }

    public void recordBatchLatency(Duration duration) {
        batchLatency.record(duration);
    }

    public long getEventsReceived() {
        return (long) eventsReceived.count();
    }

    public long getDroppedMalformed() {
        return (long) droppedMalformed.count();
    }

    public long getDroppedBelowMinimum() {
        return (long) droppedBelowMinimum.count();
    }

    public long getGroupsEmitted(ScopeType scope) {
        return (long) groupsEmitted.get(scope).count();
    }
}
