package com.seriessentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SettingsLoader}.
 */
class SettingsLoaderTest {

    @Test
    @DisplayName("Should load test settings from classpath")
    void shouldLoadFromClasspath() {
        DetectionSettings settings = SettingsLoader.fromClasspath("test-detection.yml");

        assertThat(settings.getContamination()).isEqualTo(0.1);
        assertThat(settings.getRandomState()).isEqualTo(7);
        assertThat(settings.getRatioThreshold()).isEqualTo(0.05);
        assertThat(settings.getStreakThreshold()).isEqualTo(3);
        assertThat(settings.getEstimators()).isEqualTo(50);
        assertThat(settings.getMaxSamples()).isEqualTo(64);
    }

    @Test
    @DisplayName("Should ship defaults matching the documented request defaults")
    void shouldLoadBundledDefaults() {
        DetectionSettings settings = SettingsLoader.fromClasspath(SettingsLoader.DEFAULT_RESOURCE);

        assertThat(settings.getContamination()).isEqualTo(0.05);
        assertThat(settings.getRandomState()).isEqualTo(42);
        assertThat(settings.getRatioThreshold()).isEqualTo(0.20);
        assertThat(settings.getStreakThreshold()).isEqualTo(20);
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> SettingsLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should fail fast on out-of-range values, listing every problem")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> SettingsLoader.fromClasspath("invalid-detection.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("contamination")
                .hasMessageContaining("streakThreshold");
    }

    @Test
    @DisplayName("Should load settings from a file and keep defaults for omitted keys")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("detection.yml");
        Files.writeString(file, "contamination: 0.2\n");

        DetectionSettings settings = SettingsLoader.fromFile(file.toString());

        assertThat(settings.getContamination()).isEqualTo(0.2);
        assertThat(settings.getStreakThreshold()).isEqualTo(20);
    }

    @Test
    @DisplayName("Should use defaults for an empty file")
    void shouldUseDefaultsForEmptyFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("empty.yml");
        Files.writeString(file, "");

        assertThat(SettingsLoader.fromFile(file.toString()).getContamination()).isEqualTo(0.05);
    }

    @Test
    @DisplayName("Should reject unknown keys")
    void shouldRejectUnknownKeys(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("typo.yml");
        Files.writeString(file, "contaminaton: 0.2\n");

        assertThatThrownBy(() -> SettingsLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("Should refuse a settings file that repeats a key")
    void shouldRejectDuplicateKeys(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("dup.yml");
        Files.writeString(file, "contamination: 0.1\ncontamination: 0.2\n");

        assertThatThrownBy(() -> SettingsLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed detection settings")
                .hasMessageContaining("dup.yml");
    }

    @Test
    @DisplayName("Should throw when the file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> SettingsLoader.fromFile(dir.resolve("nope.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Detection settings file not found")
                .hasMessageContaining("nope.yml");
    }

    @Test
    @DisplayName("Should copy settings independently")
    void shouldCopyIndependently() {
        DetectionSettings original = new DetectionSettings();
        DetectionSettings copy = original.copy();
        copy.setContamination(0.3);

        assertThat(original.getContamination()).isEqualTo(0.05);
        assertThat(copy.getStreakThreshold()).isEqualTo(original.getStreakThreshold());
    }
}
