package com.confluencesentinel.core.alert;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Fire-and-forget delivery of alerts on a single background thread.
 *
 * <p>
 * {@link #dispatch} never blocks the caller on the sink. Payloads are
 * delivered in dispatch order. A failed delivery is logged and counted; it
 * is not retried here (sinks retry transient errors themselves).
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code confluence.alerts.delivered} – payloads accepted by the sink</li>
 * <li>{@code confluence.alerts.failed} – payloads the sink rejected</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class AlertDispatcher implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AlertDispatcher.class);

    private static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(10);

    private final AlertSink sink;
    private final ExecutorService executor;
    private final Counter delivered;
    private final Counter failed;
    private final Duration drainTimeout;

    public AlertDispatcher(AlertSink sink, MeterRegistry registry) {
        this(sink, registry, DEFAULT_DRAIN_TIMEOUT);
    }

    /**
     * @param sink         delivery target, closed together with the dispatcher
     * @param registry     meter registry for delivery counters
     * @param drainTimeout how long {@link #close()} waits for queued payloads
     */
    public AlertDispatcher(AlertSink sink, MeterRegistry registry, Duration drainTimeout) {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        Objects.requireNonNull(registry, "registry must not be null");
        this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout must not be null");
        this.delivered = registry.counter("confluence.alerts.delivered");
        this.failed = registry.counter("confluence.alerts.failed");
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "alert-dispatcher");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Queues the payload for delivery and returns immediately.
     */
    public void dispatch(AlertPayload payload) {
        Objects.requireNonNull(payload, "payload must not be null");
        try {
            executor.execute(() -> deliver(payload));
        } catch (RejectedExecutionException e) {
            failed.increment();
            LOG.warn("Dispatcher closed, alert for [{}] dropped", payload.getScopeKey());
        }
    }

    private void deliver(AlertPayload payload) {
        try {
            sink.deliver(payload);
            delivered.increment();
            LOG.info("Alert delivered: {}", payload.getTitle());
        } catch (AlertDeliveryException e) {
            failed.increment();
            LOG.error("Alert delivery failed for [{}]: {}", payload.getScopeKey(), e.getMessage(), e);
        } catch (RuntimeException e) {
            failed.increment();
            LOG.error("Alert sink threw unexpectedly for [{}]", payload.getScopeKey(), e);
        }
    }

    public long getDeliveredCount() {
        return (long) delivered.count();
    }

    public long getFailedCount() {
        return (long) failed.count();
    }

    /**
     * Stops accepting payloads, waits for queued ones and closes the sink.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Alert queue not drained within {}, {} task(s) abandoned",
                        drainTimeout, executor.shutdownNow().size());
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            sink.close();
        }
        LOG.info("Alert dispatcher stopped: delivered={}, failed={}", getDeliveredCount(), getFailedCount());
    }
}
