package com.confluencesentinel.core.poller;

import com.confluencesentinel.core.alert.AlertDispatcher;
import com.confluencesentinel.core.alert.AlertFormatter;
import com.confluencesentinel.core.classify.CategoryTableLoader;
import com.confluencesentinel.core.classify.InstrumentClassifier;
import com.confluencesentinel.core.config.InMemoryRuleStore;
import com.confluencesentinel.core.config.RuleRegistry;
import com.confluencesentinel.core.config.RuleSet;
import com.confluencesentinel.core.diff.InvariantViolationException;
import com.confluencesentinel.core.diff.PositionSnapshotDiffer;
import com.confluencesentinel.core.diff.SnapshotDiffer;
import com.confluencesentinel.core.engine.ConfluenceEngine;
import com.confluencesentinel.core.engine.EngineMetrics;
import com.confluencesentinel.core.model.AccountKind;
import com.confluencesentinel.core.model.Position;
import com.confluencesentinel.core.model.PositionSnapshot;
import com.confluencesentinel.core.model.TrackedAccount;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PollerCoordinator}.
 */
class PollerCoordinatorTest {

    private static final String A = "0xaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa";
    private static final String B = "0xbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbb";

    private ScriptedSource source;
    private AlertDispatcher dispatcher;
    private ConfluenceEngine engine;
    private AccountRegistry accounts;
    private PollerCoordinator poller;

    @BeforeEach
    void setUp() {
        source = new ScriptedSource();
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        InstrumentClassifier classifier =
                new InstrumentClassifier(CategoryTableLoader.fromClasspath("test-categories.yml"));
        dispatcher = new AlertDispatcher(p -> { }, registry);
        engine = ConfluenceEngine.builder()
                .rules(new RuleRegistry(RuleSet.DEFAULTS, new InMemoryRuleStore()))
                .classifier(classifier)
                .formatter(new AlertFormatter(classifier))
                .dispatcher(dispatcher)
                .metrics(new EngineMetrics(registry))
                .build();
        accounts = new AccountRegistry(List.of(new TrackedAccount(A, "Alpha", AccountKind.VAULT, true)));
        poller = newPoller(new PositionSnapshotDiffer(), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        poller.stop();
        dispatcher.close();
    }

    @Test
    @DisplayName("Should take the first snapshot as baseline and report later changes")
    void shouldDiffAgainstBaseline() {
        source.respond(A, snapshot("ETH", "1", "3000"));
        source.respond(A, snapshot("ETH", "2", "6000"));

        poller.runCycle();
        assertThat(engine.getMetrics().getEventsReceived()).isZero();
        assertThat(poller.baselineOf(A)).isPresent();

        poller.runCycle();
        assertThat(engine.getMetrics().getEventsReceived()).isEqualTo(1);
        assertThat(poller.getHealth().get(A).getTotalEvents()).isEqualTo(1);
        assertThat(poller.getCompletedCycles()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should keep the baseline when a fetch fails")
    void shouldKeepBaselineOnFetchFailure() {
        PositionSnapshot baseline = snapshot("ETH", "1", "3000");
        source.respond(A, baseline);
        source.fail(A, new SnapshotFetchException("HTTP 502", true));

        poller.runCycle();
        poller.runCycle();

        assertThat(poller.baselineOf(A)).contains(baseline);
        AccountHealth health = poller.getHealth().get(A);
        assertThat(health.getConsecutiveFailures()).isEqualTo(1);
        assertThat(health.getLastError()).hasValueSatisfying(e -> assertThat(e).contains("HTTP 502"));
    }

    @Test
    @DisplayName("Should keep the baseline when a fetch times out")
    void shouldKeepBaselineOnTimeout() {
        poller = newPoller(new PositionSnapshotDiffer(), Duration.ofMillis(100));
        PositionSnapshot baseline = snapshot("ETH", "1", "3000");
        source.respond(A, baseline);
        source.delay(A, Duration.ofSeconds(2), snapshot("ETH", "5", "15000"));

        poller.runCycle();
        poller.runCycle();

        assertThat(poller.baselineOf(A)).contains(baseline);
        assertThat(poller.getHealth().get(A).getLastError())
                .hasValueSatisfying(e -> assertThat(e).contains("timed out"));
    }

    @Test
    @DisplayName("Should keep the baseline when the snapshot is malformed")
    void shouldKeepBaselineOnMalformedSnapshot() {
        PositionSnapshot baseline = snapshot("ETH", "1", "3000");
        source.respond(A, baseline);
        source.respond(A, new PositionSnapshot(A, Instant.now(), List.of(
                new Position("ETH", BigDecimal.ONE, new BigDecimal("-3"), null))));

        poller.runCycle();
        poller.runCycle();

        assertThat(poller.baselineOf(A)).contains(baseline);
        assertThat(poller.getHealth().get(A).getLastError())
                .hasValueSatisfying(e -> assertThat(e).contains("malformed"));
        assertThat(engine.getMetrics().getEventsReceived()).isZero();
    }

    @Test
    @DisplayName("Should take a fresh baseline after too many consecutive failures")
    void shouldResetBaselineAfterGap() {
        source.respond(A, snapshot("ETH", "1", "3000"));
        for (int i = 0; i < 3; i++) {
            source.fail(A, new SnapshotFetchException("down", true));
        }
        PositionSnapshot recovered = snapshot("ETH", "4", "12000");
        source.respond(A, recovered);

        for (int i = 0; i < 5; i++) {
            poller.runCycle();
        }

        assertThat(engine.getMetrics().getEventsReceived()).isZero();
        assertThat(poller.baselineOf(A)).contains(recovered);
        assertThat(poller.getHealth().get(A).getConsecutiveFailures()).isZero();
    }

    @Test
    @DisplayName("Should take a fresh baseline when an account is reactivated")
    void shouldResetBaselineOnReactivation() {
        source.respond(A, snapshot("ETH", "1", "3000"));
        PositionSnapshot afterReactivation = snapshot("BTC", "2", "120000");
        source.respond(A, afterReactivation);

        poller.runCycle();
        accounts.deactivate(A);
        poller.runCycle();
        assertThat(poller.baselineOf(A)).isEmpty();

        accounts.activate(A);
        poller.runCycle();

        assertThat(engine.getMetrics().getEventsReceived()).isZero();
        assertThat(poller.baselineOf(A)).contains(afterReactivation);
    }

    @Test
    @DisplayName("Should finish the cycle for other accounts when one fetch hangs")
    void shouldNotBlockOtherAccountsOnTimeout() {
        accounts.add(new TrackedAccount(B, "Beta", AccountKind.WALLET, true));
        CountDownLatch never = new CountDownLatch(1);
        AtomicInteger aCalls = new AtomicInteger();
        SnapshotSource hanging = id -> {
            if (id.equals(B)) {
                try {
                    never.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                throw new SnapshotFetchException("released", true);
            }
            return aCalls.incrementAndGet() == 1
                    ? snapshot(A, "ETH", "1", "3000")
                    : snapshot(A, "ETH", "2", "6000");
        };
        poller = newPoller(hanging, new PositionSnapshotDiffer(), Duration.ofMillis(200), 2);

        long started = System.nanoTime();
        poller.runCycle();
        poller.runCycle();
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        never.countDown();

        assertThat(elapsed).isLessThan(Duration.ofSeconds(5));
        assertThat(engine.getMetrics().getEventsReceived()).isEqualTo(1);
        assertThat(poller.getHealth().get(A).getConsecutiveFailures()).isZero();
        assertThat(poller.getHealth().get(B).getConsecutiveFailures()).isEqualTo(2);
        assertThat(poller.getHealth().get(B).getLastError())
                .hasValueSatisfying(e -> assertThat(e).contains("timed out"));
        assertThat(poller.getCompletedCycles()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should never run more fetches at once than the configured bound")
    void shouldBoundConcurrentFetches() {
        for (int i = 1; i <= 5; i++) {
            accounts.add(new TrackedAccount(address(i), "Account " + i, AccountKind.WALLET, true));
        }
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        AtomicInteger calls = new AtomicInteger();
        SnapshotSource slow = id -> {
            int now = inFlight.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            calls.incrementAndGet();
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                inFlight.decrementAndGet();
            }
            return new PositionSnapshot(id, Instant.now(), List.of());
        };
        poller = newPoller(slow, new PositionSnapshotDiffer(), Duration.ofSeconds(5), 2);

        poller.runCycle();

        assertThat(calls.get()).isEqualTo(6);
        assertThat(peak.get()).isBetween(1, 2);
    }

    @Test
    @DisplayName("Should skip an account that is still being polled by an earlier cycle")
    void shouldSkipAccountHeldByOverlappingCycle() throws InterruptedException {
        CountDownLatch fetching = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        SnapshotSource blocking = id -> {
            if (calls.incrementAndGet() == 1) {
                fetching.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return snapshot(A, "ETH", "1", "3000");
        };
        poller = newPoller(blocking, new PositionSnapshotDiffer(), Duration.ofSeconds(5), 2);

        poller.start();
        assertThat(fetching.await(5, TimeUnit.SECONDS)).isTrue();

        poller.runCycle();
        assertThat(calls.get()).isEqualTo(1);
        assertThat(poller.baselineOf(A)).isEmpty();

        release.countDown();
        assertThat(waitFor(() -> poller.baselineOf(A).isPresent())).isTrue();
        assertThat(poller.getHealth().get(A).getConsecutiveFailures()).isZero();
    }

    @Test
    @DisplayName("Should move through the lifecycle states and tolerate repeated calls")
    void shouldFollowLifecycle() throws InterruptedException {
        source.respondAlways(A, snapshot("ETH", "1", "3000"));
        assertThat(poller.getState()).isEqualTo(PollerState.IDLE);

        poller.start();
        poller.start();
        assertThat(poller.getState()).isEqualTo(PollerState.RUNNING);
        assertThat(waitFor(() -> poller.getCompletedCycles() >= 1)).isTrue();

        poller.stop();
        poller.stop();
        assertThat(poller.getState()).isEqualTo(PollerState.IDLE);

        poller.start();
        assertThat(poller.getState()).isEqualTo(PollerState.RUNNING);
    }

    @Test
    @DisplayName("Should wait for the in-flight cycle when stopping")
    void shouldWaitForInFlightCycle() throws InterruptedException {
        CountDownLatch fetching = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        source.block(A, fetching, release, snapshot("ETH", "1", "3000"));

        poller.start();
        assertThat(fetching.await(5, TimeUnit.SECONDS)).isTrue();

        Thread stopper = new Thread(poller::stop);
        stopper.start();
        stopper.join(300);
        assertThat(stopper.isAlive()).isTrue();
        assertThat(poller.getState()).isEqualTo(PollerState.STOPPING);

        release.countDown();
        stopper.join(5000);

        assertThat(stopper.isAlive()).isFalse();
        assertThat(poller.getState()).isEqualTo(PollerState.IDLE);
        assertThat(poller.baselineOf(A)).isPresent();
    }

    @Test
    @DisplayName("Should enter FAILED on an invariant violation")
    void shouldFailOnInvariantViolation() throws InterruptedException {
        SnapshotDiffer broken = (id, previous, current) -> {
            throw new InvariantViolationException("two events for ETH");
        };
        poller = newPoller(broken, Duration.ofSeconds(5));
        source.respondAlways(A, snapshot("ETH", "1", "3000"));

        poller.start();

        assertThat(waitFor(() -> poller.getState() == PollerState.FAILED)).isTrue();
        assertThatThrownBy(poller::start).isInstanceOf(IllegalStateException.class);
        assertThat(poller.baselineOf(A)).isEmpty();
    }

    @Test
    @DisplayName("Should reject invalid settings")
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> PollerCoordinator.builder()
                .accounts(accounts)
                .source(source)
                .differ(new PositionSnapshotDiffer())
                .engine(engine)
                .maxConcurrentFetches(0)
                .pollInterval(Duration.ZERO)
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxConcurrentFetches")
                .hasMessageContaining("pollInterval");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private PollerCoordinator newPoller(SnapshotDiffer differ, Duration fetchTimeout) {
        return newPoller(source, differ, fetchTimeout, 2);
    }

    private PollerCoordinator newPoller(SnapshotSource snapshots, SnapshotDiffer differ,
                                        Duration fetchTimeout, int maxConcurrentFetches) {
        if (poller != null) {
            poller.stop();
        }
        return PollerCoordinator.builder()
                .accounts(accounts)
                .source(snapshots)
                .differ(differ)
                .engine(engine)
                .pollInterval(Duration.ofMillis(50))
                .maxConcurrentFetches(maxConcurrentFetches)
                .fetchTimeout(fetchTimeout)
                .baselineResetAfterFailures(3)
                .build();
    }

    private static PositionSnapshot snapshot(String instrument, String size, String value) {
        return snapshot(A, instrument, size, value);
    }

    private static PositionSnapshot snapshot(String account, String instrument, String size, String value) {
        return new PositionSnapshot(account, Instant.now(),
                List.of(new Position(instrument, new BigDecimal(size), new BigDecimal(value), null)));
    }

    private static String address(int n) {
        return "0x" + String.valueOf(n).repeat(40);
    }

    private static boolean waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20);
        }
        return condition.getAsBoolean();
    }

    /**
     * Replays scripted responses per account; the last "always" response
     * repeats once the script is exhausted.
     */
    private static final class ScriptedSource implements SnapshotSource {

        private interface Step {
            PositionSnapshot run() throws Exception;
        }

        private final Map<String, Deque<Step>> scripts = new ConcurrentHashMap<>();
        private final Map<String, PositionSnapshot> always = new ConcurrentHashMap<>();

        void respond(String account, PositionSnapshot snapshot) {
            script(account).add(() -> snapshot);
        }

        void respondAlways(String account, PositionSnapshot snapshot) {
            always.put(account, snapshot);
        }

        void fail(String account, SnapshotFetchException failure) {
            script(account).add(() -> {
                throw failure;
            });
        }

        void delay(String account, Duration delay, PositionSnapshot snapshot) {
            script(account).add(() -> {
                Thread.sleep(delay.toMillis());
                return snapshot;
            });
        }

        void block(String account, CountDownLatch started, CountDownLatch release, PositionSnapshot snapshot) {
            script(account).add(() -> {
                started.countDown();
                release.await(10, TimeUnit.SECONDS);
                return snapshot;
            });
        }

        private Deque<Step> script(String account) {
            return scripts.computeIfAbsent(account, k -> new ArrayDeque<>());
        }

        @Override
        public synchronized PositionSnapshot fetchSnapshot(String accountId) throws SnapshotFetchException {
            Step step = script(accountId).poll();
            if (step == null) {
                PositionSnapshot fallback = always.get(accountId);
                if (fallback == null) {
                    throw new SnapshotFetchException("no scripted response", false);
                }
                return fallback;
            }
            try {
                return step.run();
            } catch (SnapshotFetchException e) {
                throw e;
            } catch (Exception e) {
                throw new SnapshotFetchException(e.getMessage(), e, true);
            }
        }
    }
}
