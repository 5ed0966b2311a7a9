package com.confluencesentinel.monitor;

import com.confluencesentinel.core.config.RuleStore;
import com.confluencesentinel.core.config.RuleStoreException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link RuleStore} persisted as a small JSON document.
 *
 * <pre>
 * {
 *   "rules"   : { "confluence_count": "3", "time_window": "300", ... },
 *   "savedAt" : "2024-05-01T12:00:00Z"
 * }
 * </pre>
 *
 * <h3>Durability</h3>
 * <p>
 * {@link #save(Map)} writes a temp file next to the target and moves it into
 * place atomically where the file system allows it. The previous file is
 * kept as {@code <name>.bak}; {@link #load()} falls back to it when the
 * primary file is unreadable.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonFileRuleStore implements RuleStore {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileRuleStore.class);

    private final Path file;
    private final Path backup;
    private final Clock clock;
    private final ObjectMapper mapper;

    public JsonFileRuleStore(Path file) {
        this(file, Clock.systemUTC());
    }

    JsonFileRuleStore(Path file, Clock clock) {
        this.file = Objects.requireNonNull(file, "file must not be null").toAbsolutePath();
        this.backup = this.file.resolveSibling(this.file.getFileName() + ".bak");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = JsonMappers.create();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Map<String, String> load() {
        if (!Files.exists(file) && !Files.exists(backup)) {
            LOG.info("No persisted rules at {}, using defaults", file);
            return Map.of();
        }
        try {
            return read(file);
        } catch (IOException primaryFailure) {
            if (!Files.exists(backup)) {
                throw new RuleStoreException("Failed to read rule store " + file
                        + ": " + primaryFailure.getMessage(), primaryFailure);
            }
            LOG.warn("Rule store {} unreadable ({}), falling back to {}",
                    file, primaryFailure.getMessage(), backup);
            try {
                return read(backup);
            } catch (IOException backupFailure) {
                backupFailure.addSuppressed(primaryFailure);
                throw new RuleStoreException("Failed to read rule store " + file
                        + " and its backup: " + backupFailure.getMessage(), backupFailure);
            }
        }
    }

    @Override
    public synchronized void save(Map<String, String> rules) {
        Objects.requireNonNull(rules, "rules must not be null");
        RulesDocument doc = new RulesDocument();
        doc.setRules(new LinkedHashMap<>(rules));
        doc.setSavedAt(clock.instant());

        Path temp = null;
        try {
            Path dir = file.getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            temp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            mapper.writeValue(temp.toFile(), doc);
            if (Files.exists(file)) {
                Files.copy(file, backup, StandardCopyOption.REPLACE_EXISTING);
            }
            move(temp, file);
            LOG.debug("Persisted {} rule(s) to {}", rules.size(), file);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new RuleStoreException("Failed to write rule store " + file + ": " + e.getMessage(), e);
        }
    }

    public Path getFile() {
        return file;
    }

    Path getBackup() {
        return backup;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private Map<String, String> read(Path path) throws IOException {
        RulesDocument doc = mapper.readValue(path.toFile(), RulesDocument.class);
        if (doc == null || doc.getRules() == null) {
            throw new IOException("'rules' object missing in " + path);
        }
        LOG.info("Loaded {} persisted rule(s) from {} (saved at {})",
                doc.getRules().size(), path, doc.getSavedAt());
        return Collections.unmodifiableMap(new LinkedHashMap<>(doc.getRules()));
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move not supported for {}, replacing in place", to);
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.warn("Could not delete temp file {}: {}", temp, e.getMessage());
        }
    }

    // ---------------------------------------------------------------
    // JSON document
    // ---------------------------------------------------------------

    /** On-disk form. Bean accessors for Jackson. */
    public static class RulesDocument {
        private Map<String, String> rules;
        private Instant savedAt;

        public Map<String, String> getRules() {
            return rules;
        }

        public void setRules(Map<String, String> rules) {
            this.rules = rules;
        }

        public Instant getSavedAt() {
            return savedAt;
        }

        public void setSavedAt(Instant savedAt) {
            this.savedAt = savedAt;
        }
    }
}
