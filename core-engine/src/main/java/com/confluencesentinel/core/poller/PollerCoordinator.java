package com.confluencesentinel.core.poller;

import com.confluencesentinel.core.diff.InvariantViolationException;
import com.confluencesentinel.core.diff.MalformedSnapshotException;
import com.confluencesentinel.core.diff.SnapshotDiffer;
import com.confluencesentinel.core.diff.SnapshotValidator;
import com.confluencesentinel.core.engine.ConfluenceEngine;
import com.confluencesentinel.core.model.PositionSnapshot;
import com.confluencesentinel.core.model.TrackedAccount;
import com.confluencesentinel.core.model.TradeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Drives the poll cycles: fetch, validate, diff, process, advance baseline.
 *
 * <p>
 * A cycle runs on a single scheduler thread with a fixed delay between
 * cycles. Each active account is polled by a task on a bounded worker pool;
 * the fetch itself runs under a per-fetch timeout. The baseline of an
 * account only advances after its events were processed, so a failed fetch,
 * a timeout or a malformed snapshot leaves it untouched.
 * </p>
 *
 * <h3>Gap policy</h3>
 * <p>
 * After {@code baselineResetAfterFailures} consecutive failures the next
 * successful snapshot becomes a fresh baseline and produces no events. The
 * positions seen after a long outage are not reported as trades. The same
 * holds for a deactivated account: its baseline is dropped at the start of
 * the next cycle, so its first poll after reactivation is a fresh baseline.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * See {@link PollerState}. {@link #stop()} lets the in-flight cycle finish.
 * An {@link InvariantViolationException} moves the coordinator to
 * {@link PollerState#FAILED} and no further cycles are scheduled.
 * </p>
 *
 * @since 1.0.0
 */
public class PollerCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(PollerCoordinator.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final AccountRegistry accounts;
    private final SnapshotSource source;
    private final SnapshotDiffer differ;
    private final ConfluenceEngine engine;
    private final Clock clock;
    private final Duration pollInterval;
    private final int maxConcurrentFetches;
    private final Duration fetchTimeout;
    private final int baselineResetAfterFailures;

    private final AtomicReference<PollerState> state = new AtomicReference<>(PollerState.IDLE);
    private final Map<String, PositionSnapshot> baselines = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> accountLocks = new ConcurrentHashMap<>();
    private final Map<String, AccountHealth> health = new ConcurrentHashMap<>();
    private final AtomicInteger completedCycles = new AtomicInteger();

    private final Object lifecycleLock = new Object();
    private ScheduledExecutorService scheduler;
    private ExecutorService workers;
    private ExecutorService fetchers;
    private ScheduledFuture<?> cycles;

    private PollerCoordinator(Builder b) {
        this.accounts = Objects.requireNonNull(b.accounts, "accounts must not be null");
        this.source = Objects.requireNonNull(b.source, "source must not be null");
        this.differ = Objects.requireNonNull(b.differ, "differ must not be null");
        this.engine = Objects.requireNonNull(b.engine, "engine must not be null");
        this.clock = Objects.requireNonNull(b.clock, "clock must not be null");
        this.pollInterval = Objects.requireNonNull(b.pollInterval, "pollInterval must not be null");
        this.fetchTimeout = Objects.requireNonNull(b.fetchTimeout, "fetchTimeout must not be null");
        this.maxConcurrentFetches = b.maxConcurrentFetches;
        this.baselineResetAfterFailures = b.baselineResetAfterFailures;

        List<String> errors = new ArrayList<>();
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            errors.add("pollInterval must be > 0, got: " + pollInterval);
        }
        if (fetchTimeout.isNegative() || fetchTimeout.isZero()) {
            errors.add("fetchTimeout must be > 0, got: " + fetchTimeout);
        }
        if (maxConcurrentFetches < 1) {
            errors.add("maxConcurrentFetches must be >= 1, got: " + maxConcurrentFetches);
        }
        if (baselineResetAfterFailures < 1) {
            errors.add("baselineResetAfterFailures must be >= 1, got: " + baselineResetAfterFailures);
        }
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid poller configuration: " + String.join("; ", errors));
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Starts scheduling cycles. The first cycle runs immediately. No-op when
     * already running.
     *
     * @throws IllegalStateException if the coordinator is stopping or failed
     */
    public void start() {
        synchronized (lifecycleLock) {
            PollerState current = state.get();
            if (current == PollerState.RUNNING) {
                return;
            }
            if (current != PollerState.IDLE) {
                throw new IllegalStateException("Cannot start poller in state " + current);
            }
            openPools();
            scheduler = Executors.newSingleThreadScheduledExecutor(named("poller-cycle"));
            state.set(PollerState.RUNNING);
            cycles = scheduler.scheduleWithFixedDelay(this::scheduledCycle,
                    0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
            LOG.info("Poller started: interval={}, maxConcurrentFetches={}, fetchTimeout={}",
                    pollInterval, maxConcurrentFetches, fetchTimeout);
        }
    }

    /**
     * Cancels future cycles and waits for the in-flight one. No-op when idle.
     * A failed coordinator releases its threads and stays {@link PollerState#FAILED}.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            PollerState current = state.get();
            if (current == PollerState.IDLE) {
                return;
            }
            if (current == PollerState.RUNNING) {
                state.set(PollerState.STOPPING);
                LOG.info("Poller stopping, waiting for in-flight cycle");
            }
            if (cycles != null) {
                cycles.cancel(false);
            }
            closeExecutors();
            if (state.compareAndSet(PollerState.STOPPING, PollerState.IDLE)) {
                LOG.info("Poller stopped after {} cycle(s)", completedCycles.get());
            }
        }
    }

    public PollerState getState() {
        return state.get();
    }

    // ---------------------------------------------------------------
    // Cycle
    // ---------------------------------------------------------------

    private void scheduledCycle() {
        if (state.get() != PollerState.RUNNING) {
            return;
        }
        try {
            runCycle();
        } catch (InvariantViolationException e) {
            fail(e);
        } catch (RuntimeException e) {
            // keep the schedule alive: an escaping exception would cancel it
            LOG.error("Poll cycle aborted", e);
        }
    }

    /**
     * Polls every active account once, then sweeps expired window entries.
     * Called by the scheduler; public so a single cycle can be driven directly.
     *
     * @throws InvariantViolationException if the differ detected a programming error
     */
    public void runCycle() {
        ExecutorService pool = workers;
        boolean ownPools = pool == null;
        if (ownPools) {
            openPools();
            pool = workers;
        }
        try {
            List<TrackedAccount> active = accounts.active();
            forgetInactive(active);
            List<Future<?>> tasks = new ArrayList<>(active.size());
            for (TrackedAccount account : active) {
                tasks.add(pool.submit(() -> pollAccount(account)));
            }
            for (Future<?> task : tasks) {
                awaitTask(task);
            }
            engine.sweep(clock.instant());
            int n = completedCycles.incrementAndGet();
            LOG.debug("Cycle {} complete: {} account(s) polled", n, active.size());
        } finally {
            if (ownPools) {
                closeExecutors();
            }
        }
    }

    private void forgetInactive(List<TrackedAccount> active) {
        Set<String> activeIds = active.stream()
                .map(TrackedAccount::getAddress)
                .collect(Collectors.toSet());
        baselines.keySet().removeIf(id -> {
            if (activeIds.contains(id)) {
                return false;
            }
            LOG.info("[{}] inactive, baseline dropped", accounts.displayNameOf(id));
            return true;
        });
    }

    private static void awaitTask(Future<?> task) {
        try {
            task.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for poll tasks", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Poll task failed", cause);
        }
    }

    /**
     * One account: fetch, validate, diff, process, advance the baseline.
     */
    void pollAccount(TrackedAccount account) {
        String id = account.getAddress();
        ReentrantLock lock = accountLocks.computeIfAbsent(id, k -> new ReentrantLock());
        if (!lock.tryLock()) {
            LOG.debug("[{}] still being polled, skipped this cycle", account.getDisplayName());
            return;
        }
        try {
            Optional<PositionSnapshot> fetched = fetch(account);
            if (fetched.isEmpty()) {
                return;
            }
            PositionSnapshot snapshot = fetched.get();
            try {
                SnapshotValidator.validate(id, snapshot);
            } catch (MalformedSnapshotException e) {
                recordFailure(account, "malformed snapshot: " + e.getMessage());
                return;
            }

            AccountHealth h = healthOf(id);
            PositionSnapshot previous = baselines.get(id);
            if (previous != null && h.getConsecutiveFailures() >= baselineResetAfterFailures) {
                LOG.info("[{}] recovered after {} consecutive failures, taking a fresh baseline",
                        account.getDisplayName(), h.getConsecutiveFailures());
                previous = null;
            }

            List<TradeEvent> events = differ.diff(id, previous, snapshot);
            if (!events.isEmpty()) {
                LOG.info("[{}] {} position change(s)", account.getDisplayName(), events.size());
                engine.process(events);
            }
            baselines.put(id, snapshot);
            h.recordSuccess(clock.instant(), events.size());
        } catch (InvariantViolationException e) {
            LOG.error("[{}] invariant violated while diffing", account.getDisplayName(), e);
            throw e;
        } catch (RuntimeException e) {
            LOG.error("[{}] processing failed, baseline kept", account.getDisplayName(), e);
            healthOf(id).recordFailure(clock.instant(), "processing failed: " + e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    private Optional<PositionSnapshot> fetch(TrackedAccount account) {
        String id = account.getAddress();
        Future<PositionSnapshot> call = fetchers.submit(() -> source.fetchSnapshot(id));
        try {
            return Optional.of(call.get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            call.cancel(true);
            recordFailure(account, "fetch timed out after " + fetchTimeout.toMillis() + "ms");
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            recordFailure(account, "interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof MalformedSnapshotException) {
                recordFailure(account, "malformed snapshot: " + cause.getMessage());
            } else {
                recordFailure(account, "fetch failed: " + cause.getMessage());
            }
        }
        return Optional.empty();
    }

    private void recordFailure(TrackedAccount account, String reason) {
        int consecutive = healthOf(account.getAddress()).recordFailure(clock.instant(), reason);
        LOG.warn("[{}] {} ({} consecutive failure(s)), baseline kept",
                account.getDisplayName(), reason, consecutive);
    }

    private void fail(InvariantViolationException e) {
        state.set(PollerState.FAILED);
        if (cycles != null) {
            cycles.cancel(false);
        }
        LOG.error("Poller FAILED, no further cycles will run: {}", e.getMessage());
    }

    // ---------------------------------------------------------------
    // Executors
    // ---------------------------------------------------------------

    private void openPools() {
        workers = Executors.newFixedThreadPool(maxConcurrentFetches, named("poller-worker"));
        fetchers = Executors.newFixedThreadPool(maxConcurrentFetches, named("poller-fetch"));
    }

    private void closeExecutors() {
        shutdown(scheduler);
        shutdown(workers);
        shutdown(fetchers);
        scheduler = null;
        workers = null;
        fetchers = null;
    }

    private static void shutdown(ExecutorService executor) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Executor did not terminate within {}s, forcing", SHUTDOWN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // ---------------------------------------------------------------
    // Inspection
    // ---------------------------------------------------------------

    private AccountHealth healthOf(String accountId) {
        return health.computeIfAbsent(accountId, AccountHealth::new);
    }

    public Map<String, AccountHealth> getHealth() {
        return Collections.unmodifiableMap(health);
    }

    public Optional<PositionSnapshot> baselineOf(String accountId) {
        return Optional.ofNullable(baselines.get(accountId));
    }

    public int getCompletedCycles() {
        return completedCycles.get();
    }

    public AccountRegistry getAccounts() {
        return accounts;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private AccountRegistry accounts;
        private SnapshotSource source;
        private SnapshotDiffer differ;
        private ConfluenceEngine engine;
        private Clock clock = Clock.systemUTC();
        private Duration pollInterval = Duration.ofSeconds(60);
        private int maxConcurrentFetches = 4;
        private Duration fetchTimeout = Duration.ofSeconds(10);
        private int baselineResetAfterFailures = 3;

        public Builder accounts(AccountRegistry accounts) {
            this.accounts = accounts;
            return this;
        }

        public Builder source(SnapshotSource source) {
            this.source = source;
            return this;
        }

        public Builder differ(SnapshotDiffer differ) {
            this.differ = differ;
            return this;
        }

        public Builder engine(ConfluenceEngine engine) {
            this.engine = engine;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder maxConcurrentFetches(int maxConcurrentFetches) {
            this.maxConcurrentFetches = maxConcurrentFetches;
            return this;
        }

        public Builder fetchTimeout(Duration fetchTimeout) {
            this.fetchTimeout = fetchTimeout;
            return this;
        }

        public Builder baselineResetAfterFailures(int baselineResetAfterFailures) {
            this.baselineResetAfterFailures = baselineResetAfterFailures;
            return this;
        }

        /**
         * @throws NullPointerException     if a collaborator is missing
         * @throws IllegalArgumentException if a setting is out of range
         */
        public PollerCoordinator build() {
            return new PollerCoordinator(this);
        }
    }
}
