package com.confluencesentinel.monitor;

import com.confluencesentinel.core.config.RuleRegistry;
import com.confluencesentinel.core.config.RuleSet;
import com.confluencesentinel.core.config.RuleStoreException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsonFileRuleStore}.
 */
class JsonFileRuleStoreTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should return no rules when nothing was saved yet")
    void shouldLoadEmptyWhenMissing() {
        JsonFileRuleStore store = new JsonFileRuleStore(dir.resolve("rules.json"), CLOCK);

        assertThat(store.load()).isEmpty();
    }

    @Test
    @DisplayName("Should write rules with a save time and read them back")
    void shouldRoundTripThroughFile() throws IOException {
        Path file = dir.resolve("data").resolve("rules.json");
        JsonFileRuleStore store = new JsonFileRuleStore(file, CLOCK);

        store.save(Map.of("confluence_count", "3", "time_window", "600"));

        String json = Files.readString(file, StandardCharsets.UTF_8);
        assertThat(json).contains("\"savedAt\" : \"2024-05-01T12:00:00Z\"");
        assertThat(new JsonFileRuleStore(file, CLOCK).load())
                .containsEntry("confluence_count", "3")
                .containsEntry("time_window", "600");
    }

    @Test
    @DisplayName("Should keep the previous file as a backup")
    void shouldKeepBackup() {
        JsonFileRuleStore store = new JsonFileRuleStore(dir.resolve("rules.json"), CLOCK);

        store.save(Map.of("confluence_count", "3"));
        store.save(Map.of("confluence_count", "4"));

        assertThat(Files.exists(store.getBackup())).isTrue();
        assertThat(store.load()).containsEntry("confluence_count", "4");
    }

    @Test
    @DisplayName("Should fall back to the backup when the primary file is corrupt")
    void shouldFallBackToBackup() throws IOException {
        JsonFileRuleStore store = new JsonFileRuleStore(dir.resolve("rules.json"), CLOCK);
        store.save(Map.of("confluence_count", "3"));
        store.save(Map.of("confluence_count", "4"));

        Files.writeString(store.getFile(), "{\"rules\": {\"confluence_count\": ", StandardCharsets.UTF_8);

        assertThat(store.load()).containsEntry("confluence_count", "3");
    }

    @Test
    @DisplayName("Should fail when the file is corrupt and no backup exists")
    void shouldFailWithoutBackup() throws IOException {
        Path file = dir.resolve("rules.json");
        Files.writeString(file, "not json", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> new JsonFileRuleStore(file, CLOCK).load())
                .isInstanceOf(RuleStoreException.class)
                .hasMessageContaining("rules.json");
    }

    @Test
    @DisplayName("Should restore persisted rule changes into a new registry")
    void shouldRestoreRegistryAfterRestart() {
        Path file = dir.resolve("rules.json");
        RuleRegistry before = RuleRegistry.restore(RuleSet.DEFAULTS, new JsonFileRuleStore(file, CLOCK));
        before.set("time_window", "10m");
        before.setConfluenceCount(4);

        RuleRegistry after = RuleRegistry.restore(RuleSet.DEFAULTS, new JsonFileRuleStore(file, CLOCK));

        assertThat(after.current().getTimeWindow()).isEqualTo(Duration.ofMinutes(10));
        assertThat(after.current().getConfluenceCount()).isEqualTo(4);
        assertThat(after.current()).isEqualTo(before.current());
    }
}
