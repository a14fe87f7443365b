package com.vibrationsentinel.core.config;

import com.vibrationsentinel.core.ensemble.FallbackPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PipelineConfigLoader}.
 */
class PipelineConfigLoaderTest {

    @Test
    @DisplayName("Should load test configuration from classpath and keep defaults for omitted sections")
    void shouldLoadFromClasspath() {
        PipelineConfig config = PipelineConfigLoader.fromClasspath("test-pipeline.yml");

        assertThat(config.getWindowing().getWindowSize()).isEqualTo(256);
        assertThat(config.getWindowing().getHopSize()).isEqualTo(128);
        assertThat(config.getEnsemble().weightMap())
                .containsEntry("reconstruction", 2.0)
                .containsEntry("isolation", 1.0)
                .containsEntry("temporal", 1.0);
        assertThat(config.getEnsemble().getDetectorFallback()).isEqualTo(FallbackPolicy.REUSE_STALE);
        assertThat(config.getEnsemble().getUnavailableFallback()).isEqualTo(FallbackPolicy.SKIP);
        assertThat(config.getThreshold().getMinFeedback()).isEqualTo(10);
        assertThat(config.getThreshold().getGridSteps()).isEqualTo(50);
        assertThat(config.getRul().getTrendModel()).isEqualTo("EXPONENTIAL");
        assertThat(config.getFeatures().bandEdges()).containsExactly(0, 1000, 2000, 5000, 10000);
    }

    @Test
    @DisplayName("Bundled pipeline.yml should match the built-in defaults")
    void bundledConfigurationMatchesDefaults() {
        PipelineConfig bundled = PipelineConfigLoader.fromClasspath(PipelineConfigLoader.DEFAULT_RESOURCE);
        PipelineConfig defaults = new PipelineConfig();

        assertThat(bundled.getWindowing().getWindowSize()).isEqualTo(defaults.getWindowing().getWindowSize());
        assertThat(bundled.getEnsemble().weightMap()).isEqualTo(defaults.getEnsemble().weightMap());
        assertThat(bundled.getDrift().getCheckInterval()).isEqualTo(defaults.getDrift().getCheckInterval());
        assertThat(bundled.getRul().getConfidenceZ()).isEqualTo(defaults.getRul().getConfidenceZ());
    }

    @Test
    @DisplayName("Should report every invalid value at once")
    void shouldCollectValidationErrors() {
        assertThatThrownBy(() -> PipelineConfigLoader.fromClasspath("invalid-pipeline.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("windowing.hopSize")
                .hasMessageContaining("ensemble.detectorTimeoutMs");
    }

    @Test
    @DisplayName("A zero weight is accepted as long as some weight is positive")
    void zeroWeightAccepted(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("pipeline.yml");
        Files.writeString(file, "ensemble:\n  weights:\n    reconstruction: 1.0\n    isolation: 0\n    temporal: 0.5\n");

        PipelineConfig config = PipelineConfigLoader.fromFile(file.toString());

        assertThat(config.getEnsemble().weightMap()).containsEntry("isolation", 0.0);
    }

    @Test
    @DisplayName("Negative weights and an all-zero weight set are rejected")
    void invalidWeightsRejected(@TempDir Path dir) throws IOException {
        Path negative = dir.resolve("negative.yml");
        Files.writeString(negative, "ensemble:\n  weights:\n    reconstruction: -1.0\n    isolation: 1.0\n");
        Path zero = dir.resolve("zero.yml");
        Files.writeString(zero, "ensemble:\n  weights:\n    reconstruction: 0\n    isolation: 0.0\n");

        assertThatThrownBy(() -> PipelineConfigLoader.fromFile(negative.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ensemble.weights['reconstruction']");
        assertThatThrownBy(() -> PipelineConfigLoader.fromFile(zero.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("must not all be zero");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> PipelineConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should load from a file and reject a missing file")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("pipeline.yml");
        Files.writeString(file, "drift:\n  checkInterval: 50\n  consecutiveChecks: 3\n");

        PipelineConfig config = PipelineConfigLoader.fromFile(file.toString());

        assertThat(config.getDrift().getCheckInterval()).isEqualTo(50);
        assertThat(config.getDrift().getConsecutiveChecks()).isEqualTo(3);
        assertThatThrownBy(() -> PipelineConfigLoader.fromFile(dir.resolve("missing.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should treat an empty file as built-in defaults")
    void shouldTreatEmptyFileAsDefaults(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("empty.yml");
        Files.writeString(file, "");

        PipelineConfig config = PipelineConfigLoader.fromFile(file.toString());

        assertThat(config.getWindowing().getWindowSize()).isEqualTo(1024);
        assertThat(config.getThreshold().getBootstrapCriticalCut()).isEqualTo(0.7);
    }
}
