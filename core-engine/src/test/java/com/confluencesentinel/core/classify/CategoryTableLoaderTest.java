package com.confluencesentinel.core.classify;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CategoryTableLoader} and {@link CategoryTable}.
 */
class CategoryTableLoaderTest {

    @Test
    @DisplayName("Should load the bundled table with ten categories")
    void shouldLoadBundledTable() {
        CategoryTable table = CategoryTableLoader.fromClasspath(CategoryTableLoader.DEFAULT_RESOURCE);

        assertThat(table.categoryIds()).hasSize(10).contains("AI", "LAYER1", "LAYER2", "MEME");
        assertThat(table.instrumentCount()).isGreaterThanOrEqualTo(80);
        assertThat(table.categoryOf("MATIC")).contains("LAYER2");
        assertThat(table.categoryOf("ARKM")).contains("AI");
    }

    @Test
    @DisplayName("Should normalise ids and instruments to upper case")
    void shouldNormaliseCase() {
        CategoryTable table = CategoryTableLoader.fromClasspath("test-categories.yml");

        assertThat(table.getVersion()).isEqualTo("test-1");
        assertThat(table.categoryOf("pepe")).contains("MEME");
        assertThat(table.categoryOf("Eth")).contains("LAYER1");
        assertThat(table.iconOf("ai")).contains("🤖");
        assertThat(table.iconOf("MEME")).isEmpty();
    }

    @Test
    @DisplayName("Should reject an instrument listed in two categories")
    void shouldRejectDuplicateInstrument() {
        assertThatThrownBy(() -> CategoryTableLoader.fromClasspath("duplicate-instrument-categories.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("MATIC")
                .hasMessageContaining("LAYER2")
                .hasMessageContaining("GAMING");
    }

    @Test
    @DisplayName("Should report an instrument repeated inside one category")
    void shouldRejectInstrumentRepeatedInCategory(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("categories.yml");
        Files.writeString(file, "categories:\n  - id: AI\n    instruments: [FET, TAO, fet]\n");

        assertThatThrownBy(() -> CategoryTableLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Instrument 'FET' is listed twice in 'AI'")
                .satisfies(e -> assertThat(e.getMessage()).doesNotContain("listed in both"));
    }

    @Test
    @DisplayName("Should reject a category without id")
    void shouldRejectBlankId(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("categories.yml");
        Files.writeString(file, "categories:\n  - id: \" \"\n    instruments: [BTC]\n");

        assertThatThrownBy(() -> CategoryTableLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("validation failed");
    }

    @Test
    @DisplayName("Should throw when the file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> CategoryTableLoader.fromFile(dir.resolve("nope.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
