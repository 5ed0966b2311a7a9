package com.confluencesentinel.monitor;

import com.confluencesentinel.core.classify.CategoryTable;
import com.confluencesentinel.core.classify.CategoryTableLoader;
import com.confluencesentinel.core.classify.InstrumentClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Hot-reloads a file-based category table into an {@link InstrumentClassifier}.
 *
 * <p>
 * The file's last-modified time is checked at a fixed interval. A changed
 * file is parsed and validated; a valid table replaces the active one, an
 * invalid one is logged and the previous table stays in force.
 * </p>
 *
 * @since 1.0.0
 */
public class CategoryTableReloader implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CategoryTableReloader.class);

    private final Path file;
    private final InstrumentClassifier classifier;
    private final Duration interval;

    private ScheduledExecutorService scheduler;
    private FileTime lastModified;

    /**
     * @param file       category table file the classifier was loaded from
     * @param classifier classifier to update
     * @param interval   how often to check the file
     */
    public CategoryTableReloader(Path file, InstrumentClassifier classifier, Duration interval) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        this.lastModified = modifiedTime().orElse(null);
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "category-reloader");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::checkQuietly,
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        LOG.info("Watching category table {} every {}", file, interval);
    }

    /**
     * Reload the table if the file changed since the last check.
     *
     * @return {@code true} if a new table was installed
     */
    public synchronized boolean checkNow() {
        FileTime current = modifiedTime().orElse(null);
        if (current == null || current.equals(lastModified)) {
            return false;
        }
        lastModified = current;
        CategoryTable table;
        try {
            table = CategoryTableLoader.fromFile(file.toString());
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOG.warn("Category table {} changed but was rejected, keeping version {}: {}",
                    file, classifier.version(), e.getMessage());
            return false;
        }
        classifier.reload(table);
        return true;
    }

    private void checkQuietly() {
        try {
            checkNow();
        } catch (RuntimeException e) {
            LOG.error("Category table check failed", e);
        }
    }

    private Optional<FileTime> modifiedTime() {
        try {
            return Optional.of(Files.getLastModifiedTime(file));
        } catch (IOException e) {
            LOG.warn("Cannot stat category table {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        scheduler = null;
        LOG.info("Category table watcher stopped");
    }
}
