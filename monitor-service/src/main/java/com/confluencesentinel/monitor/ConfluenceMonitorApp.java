package com.confluencesentinel.monitor;

import com.confluencesentinel.core.alert.AlertDispatcher;
import com.confluencesentinel.core.alert.AlertFormatter;
import com.confluencesentinel.core.alert.AlertSink;
import com.confluencesentinel.core.classify.CategoryTable;
import com.confluencesentinel.core.classify.CategoryTableLoader;
import com.confluencesentinel.core.classify.InstrumentClassifier;
import com.confluencesentinel.core.config.RuleRegistry;
import com.confluencesentinel.core.config.RuleSet;
import com.confluencesentinel.core.config.RulesConfig;
import com.confluencesentinel.core.config.RulesLoader;
import com.confluencesentinel.core.diff.PositionSnapshotDiffer;
import com.confluencesentinel.core.engine.ConfluenceEngine;
import com.confluencesentinel.core.engine.EngineMetrics;
import com.confluencesentinel.core.model.TrackedAccount;
import com.confluencesentinel.core.poller.AccountRegistry;
import com.confluencesentinel.core.poller.PollerCoordinator;
import com.confluencesentinel.core.poller.SnapshotSource;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the Confluence Sentinel monitor.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Hyperliquid info API (one poll per tracked account per cycle)
 *     → PositionSnapshotDiffer (baseline vs. new snapshot → trade events)
 *     → ConfluenceEngine (instrument + theme correlation)
 *     → AlertFormatter → AlertDispatcher
 *     → Kafka (alerts topic) or the log
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * All configuration is resolved from environment variables via
 * {@link ServiceConfig}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfluenceMonitorApp {

    private static final Logger LOG = LoggerFactory.getLogger(ConfluenceMonitorApp.class);

    private ConfluenceMonitorApp() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting Confluence Sentinel with config: {}", config);

        // 2. Restore rules: rules.yml defaults overlaid with persisted changes
        RuleSet defaults = loadRules(config).toRuleSet();
        RuleRegistry rules = RuleRegistry.restore(defaults,
                new JsonFileRuleStore(Path.of(config.getRuleStorePath())));

        // 3. Category table, hot-reloaded when it comes from a file
        InstrumentClassifier classifier = new InstrumentClassifier(loadCategories(config));
        CategoryTableReloader reloader = null;
        if (!config.getCategoriesPath().isBlank()) {
            reloader = new CategoryTableReloader(Path.of(config.getCategoriesPath()),
                    classifier, config.getCategoryReloadInterval());
            reloader.start();
        }

        // 4. Tracked accounts
        AccountRegistry accounts = new AccountRegistry(loadAccounts(config));
        if (accounts.active().isEmpty()) {
            LOG.warn("No active accounts configured via ACCOUNTS_PATH or a classpath {}; "
                    + "the poller will idle", AccountsLoader.DEFAULT_RESOURCE);
        }

        // 5. Alert delivery and the correlation engine
        MeterRegistry meterRegistry = new SimpleMeterRegistry();
        AlertDispatcher dispatcher = new AlertDispatcher(createSink(config), meterRegistry);
        ConfluenceEngine engine = ConfluenceEngine.builder()
                .rules(rules)
                .classifier(classifier)
                .formatter(new AlertFormatter(accounts::displayNameOf, classifier))
                .dispatcher(dispatcher)
                .metrics(new EngineMetrics(meterRegistry))
                .build();

        // 6. Poller over the resilient Hyperliquid source. FETCH_TIMEOUT_MS bounds one
        //    HTTP request; the poller deadline covers every retry of it.
        SnapshotSource source = new ResilientSnapshotSource(
                new HyperliquidSnapshotSource(config.getApiUrl(), config.getFetchTimeout()),
                config.getRateLimitPerMinute(),
                meterRegistry);
        PollerCoordinator poller = PollerCoordinator.builder()
                .accounts(accounts)
                .source(source)
                .differ(new PositionSnapshotDiffer(Clock.systemUTC()))
                .engine(engine)
                .pollInterval(config.getPollInterval())
                .maxConcurrentFetches(config.getMaxConcurrentFetches())
                .fetchTimeout(ResilientSnapshotSource.callBudget(config.getFetchTimeout()))
                .baselineResetAfterFailures(config.getBaselineResetAfterFailures())
                .build();

        // 7. Health server (for K8s probes)
        HealthServer healthServer = new HealthServer(poller, rules, classifier);
        healthServer.start(config.getHealthPort());

        // 8. Shutdown hook: stop polling first so no alert is dispatched after the sink closes
        CountDownLatch stopped = new CountDownLatch(1);
        CategoryTableReloader watcher = reloader;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutdown requested");
            poller.stop();
            if (watcher != null) {
                watcher.close();
            }
            dispatcher.close();
            healthServer.stop();
            stopped.countDown();
        }, "confluence-shutdown"));

        // 9. Run until the JVM is asked to exit
        poller.start();
        stopped.await();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static RulesConfig loadRules(ServiceConfig config) {
        String path = config.getRulesConfigPath();
        if (!path.isBlank()) {
            return RulesLoader.fromFile(path);
        }
        return RulesLoader.fromClasspath(RulesLoader.DEFAULT_RESOURCE);
    }

    private static CategoryTable loadCategories(ServiceConfig config) {
        String path = config.getCategoriesPath();
        if (!path.isBlank()) {
            return CategoryTableLoader.fromFile(path);
        }
        return CategoryTableLoader.fromClasspath(CategoryTableLoader.DEFAULT_RESOURCE);
    }

    private static List<TrackedAccount> loadAccounts(ServiceConfig config) {
        String path = config.getAccountsPath();
        if (!path.isBlank()) {
            return AccountsLoader.fromFile(path);
        }
        return AccountsLoader.fromClasspath(AccountsLoader.DEFAULT_RESOURCE);
    }

    static AlertSink createSink(ServiceConfig config) {
        switch (config.getAlertSink()) {
            case KAFKA:
                LOG.info("Publishing alerts to Kafka topic {} at {}",
                        config.getKafkaAlertTopic(), config.getKafkaBootstrapServers());
                return new KafkaAlertSink(config.kafkaProducerProperties(), config.getKafkaAlertTopic());
            case LOG:
            default:
                LOG.info("Writing alerts to the log");
                return new LoggingAlertSink();
        }
    }
}
