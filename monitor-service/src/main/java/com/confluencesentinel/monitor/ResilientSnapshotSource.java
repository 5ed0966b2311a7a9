package com.confluencesentinel.monitor;

import com.confluencesentinel.core.model.PositionSnapshot;
import com.confluencesentinel.core.poller.SnapshotFetchException;
import com.confluencesentinel.core.poller.SnapshotSource;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Decorates a {@link SnapshotSource} with rate limiting, retries and metrics.
 *
 * <p>
 * Chain: Retry &rarr; RateLimiter &rarr; delegate. Every attempt, including a
 * retry, takes a rate-limiter permit. Only transient
 * {@link SnapshotFetchException}s are retried; permanent failures and
 * malformed responses pass straight through.
 * </p>
 *
 * <h3>Metrics</h3>
 * <ul>
 * <li>{@code snapshot.fetch} timer, tagged {@code outcome=success|failure}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class ResilientSnapshotSource implements SnapshotSource {

    private static final Logger LOG = LoggerFactory.getLogger(ResilientSnapshotSource.class);

    static final String TIMER_NAME = "snapshot.fetch";

    static final int MAX_ATTEMPTS = 3;
    static final Duration RETRY_WAIT = Duration.ofMillis(500);
    static final Duration PERMIT_TIMEOUT = Duration.ofSeconds(5);

    private final SnapshotSource delegate;
    private final Retry retry;
    private final RateLimiter rateLimiter;
    private final MeterRegistry meterRegistry;

    /**
     * Production settings: 3 attempts 500ms apart, {@code requestsPerMinute}
     * permits refreshed every minute, up to 5s waiting for a permit.
     */
    public ResilientSnapshotSource(SnapshotSource delegate, int requestsPerMinute, MeterRegistry meterRegistry) {
        this(delegate,
                RetryConfig.custom()
                        .maxAttempts(MAX_ATTEMPTS)
                        .waitDuration(RETRY_WAIT)
                        .retryOnException(ResilientSnapshotSource::isRetryable)
                        .build(),
                RateLimiterConfig.custom()
                        .limitForPeriod(requestsPerMinute)
                        .limitRefreshPeriod(Duration.ofMinutes(1))
                        .timeoutDuration(PERMIT_TIMEOUT)
                        .build(),
                meterRegistry);
    }

    ResilientSnapshotSource(SnapshotSource delegate,
            RetryConfig retryConfig,
            RateLimiterConfig rateLimiterConfig,
            MeterRegistry meterRegistry) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
        this.retry = Retry.of("hyperliquid-api", retryConfig);
        this.rateLimiter = RateLimiter.of("hyperliquid-api", rateLimiterConfig);

        retry.getEventPublisher().onRetry(event -> LOG.warn("Retrying snapshot fetch (attempt {}): {}",
                event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));

        LOG.info("ResilientSnapshotSource initialized: {} attempt(s), {} request(s) per {}",
                retryConfig.getMaxAttempts(),
                rateLimiterConfig.getLimitForPeriod(),
                rateLimiterConfig.getLimitRefreshPeriod());
    }

    /**
     * Longest a call can take with the production settings: every attempt
     * waits for a permit and runs up to {@code requestTimeout}, with the retry
     * wait between attempts. A caller deadline shorter than this cuts retries off.
     *
     * @param requestTimeout timeout of a single delegate request
     * @return upper bound of one {@link #fetchSnapshot(String)} call
     */
    public static Duration callBudget(Duration requestTimeout) {
        Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
        return requestTimeout.plus(PERMIT_TIMEOUT)
                .multipliedBy(MAX_ATTEMPTS)
                .plus(RETRY_WAIT.multipliedBy(MAX_ATTEMPTS - 1));
    }

    /**
     * Retry predicate: transient fetch failures only.
     */
    static boolean isRetryable(Throwable t) {
        return t instanceof SnapshotFetchException fetch && fetch.isTransient();
    }

    @Override
    public PositionSnapshot fetchSnapshot(String accountId) throws SnapshotFetchException {
        Callable<PositionSnapshot> call = Retry.decorateCallable(retry,
                RateLimiter.decorateCallable(rateLimiter, () -> delegate.fetchSnapshot(accountId)));

        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "failure";
        try {
            PositionSnapshot snapshot = call.call();
            outcome = "success";
            return snapshot;
        } catch (SnapshotFetchException | RuntimeException e) {
            if (e instanceof RequestNotPermitted) {
                throw new SnapshotFetchException("Rate limit exhausted for " + accountId, e, true);
            }
            throw e;
        } catch (Exception e) {
            throw new SnapshotFetchException("Fetch failed for " + accountId + ": " + e.getMessage(), e, false);
        } finally {
            sample.stop(Timer.builder(TIMER_NAME)
                    .tag("outcome", outcome)
                    .register(meterRegistry));
        }
    }

    Retry getRetry() {
        return retry;
    }
}
