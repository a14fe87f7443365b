package com.vibrationsentinel.core.state;

import com.vibrationsentinel.core.calibration.AdaptiveThreshold;
import com.vibrationsentinel.core.calibration.ThresholdState;
import com.vibrationsentinel.core.config.PipelineConfig;
import com.vibrationsentinel.core.drift.DriftState;
import com.vibrationsentinel.core.drift.DistributionSummary;
import com.vibrationsentinel.core.error.StateCorruptionException;
import com.vibrationsentinel.core.model.AlertLevel;
import com.vibrationsentinel.core.model.EnsembleResult;
import com.vibrationsentinel.core.model.Feedback;
import com.vibrationsentinel.core.model.FeatureSchema;
import com.vibrationsentinel.core.normalization.NormalizationStats;
import com.vibrationsentinel.core.support.MutableClock;
import com.vibrationsentinel.core.support.Signals;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ArtifactCodec}.
 */
class ArtifactCodecTest {

    private final ArtifactCodec codec = new ArtifactCodec();

    @Test
    @DisplayName("Restored threshold state should make the same decisions as the original")
    void thresholdStateRoundTrip() {
        PipelineConfig.Threshold config = new PipelineConfig.Threshold();
        config.setMinFeedback(4);
        config.setGridSteps(11);
        MutableClock clock = new MutableClock(Signals.T0);
        AdaptiveThreshold original = new AdaptiveThreshold("pump-1", config, null, clock);
        double[] scores = {0.1, 0.15, 0.6, 0.2};
        boolean[] labels = {false, false, true, false};
        for (int i = 0; i < scores.length; i++) {
            confirm(original, "r-" + i, scores[i], labels[i], clock);
        }

        String json = codec.encode(ArtifactKind.THRESHOLD_STATE, original.snapshot());
        AdaptiveThreshold restored = new AdaptiveThreshold("pump-1", config,
                codec.decode(json, ArtifactKind.THRESHOLD_STATE, ThresholdState.class), clock);

        assertThat(restored.currentCuts()).isEqualTo(original.currentCuts());
        boolean changedOriginal = confirm(original, "r-9", 0.45, true, clock);
        boolean changedRestored = confirm(restored, "r-9", 0.45, true, clock);
        assertThat(changedRestored).isEqualTo(changedOriginal);
        assertThat(restored.currentCuts()).isEqualTo(original.currentCuts());
    }

    @Test
    @DisplayName("Normalization statistics survive a file round trip")
    void statsFileRoundTrip(@TempDir Path dir) {
        NormalizationStats stats = new NormalizationStats(List.of("rms", "peak"),
                new double[] {0.5, 1.5}, new double[] {0.1, 0.2});
        Path file = dir.resolve("stats.json");

        codec.write(file, ArtifactKind.NORMALIZATION_STATS, stats);

        assertThat(codec.read(file, ArtifactKind.NORMALIZATION_STATS, NormalizationStats.class)).isEqualTo(stats);
    }

    @Test
    @DisplayName("Drift state survives a round trip")
    void driftStateRoundTrip() {
        DriftState state = new DriftState(FeatureSchema.DEFAULT.names(),
                DistributionSummary.standardNormalReference(FeatureSchema.DEFAULT.size()));
        state.getCurrentCounts()[0][3] = 17;
        state.setConsecutiveOverThreshold(1);

        DriftState decoded = codec.decode(codec.encode(ArtifactKind.DRIFT_STATE, state),
                ArtifactKind.DRIFT_STATE, DriftState.class);

        decoded.checkInvariants();
        assertThat(decoded.getCurrentCounts()[0][3]).isEqualTo(17);
        assertThat(decoded.getConsecutiveOverThreshold()).isEqualTo(1);
        assertThat(decoded.getReference()[5]).containsExactly(state.getReference()[5]);
    }

    @Test
    @DisplayName("Should reject an artifact of another kind")
    void wrongKind() {
        String json = codec.encode(ArtifactKind.DRIFT_STATE, new ThresholdState(0.3, 0.7));

        assertThatThrownBy(() -> codec.decode(json, ArtifactKind.THRESHOLD_STATE, ThresholdState.class))
                .isInstanceOf(StateCorruptionException.class)
                .hasMessageContaining("drift-state");
    }

    @Test
    @DisplayName("Should reject an unsupported schema version")
    void unsupportedVersion() {
        String json = "{\"schemaVersion\":99,\"kind\":\"threshold-state\",\"payload\":{}}";

        assertThatThrownBy(() -> codec.decode(json, ArtifactKind.THRESHOLD_STATE, ThresholdState.class))
                .isInstanceOf(StateCorruptionException.class)
                .hasMessageContaining("99");
    }

    @Test
    @DisplayName("Should reject malformed JSON and missing payloads")
    void malformed() {
        assertThatThrownBy(() -> codec.decode("{not json", ArtifactKind.THRESHOLD_STATE, ThresholdState.class))
                .isInstanceOf(StateCorruptionException.class);
        assertThatThrownBy(() -> codec.decode("{\"schemaVersion\":1,\"kind\":\"threshold-state\"}",
                ArtifactKind.THRESHOLD_STATE, ThresholdState.class))
                .isInstanceOf(StateCorruptionException.class)
                .hasMessageContaining("no payload");
    }

    @Test
    @DisplayName("Payload that fails its own invariants is corrupt")
    void invariantFailure() {
        String json = "{\"schemaVersion\":1,\"kind\":\"normalization-stats\",\"payload\":"
                + "{\"featureNames\":[\"rms\",\"peak\"],\"mean\":[0.0],\"std\":[1.0,1.0]}}";

        assertThatThrownBy(() -> codec.decode(json, ArtifactKind.NORMALIZATION_STATS, NormalizationStats.class))
                .isInstanceOf(StateCorruptionException.class);
    }

    @Test
    @DisplayName("Threshold state with inverted cuts is refused on restore")
    void invertedCutsRefused() {
        ThresholdState decoded = codec.decode(codec.encode(ArtifactKind.THRESHOLD_STATE, new ThresholdState(0.9, 0.1)),
                ArtifactKind.THRESHOLD_STATE, ThresholdState.class);

        assertThatThrownBy(() -> new AdaptiveThreshold("pump-1", new PipelineConfig.Threshold(), decoded,
                new MutableClock(Signals.T0)))
                .isInstanceOf(StateCorruptionException.class);
    }

    @Test
    @DisplayName("Unreadable file is an I/O failure, not corruption")
    void missingFile(@TempDir Path dir) {
        Path missing = dir.resolve("absent.json");

        assertThat(Files.exists(missing)).isFalse();
        assertThatThrownBy(() -> codec.read(missing, ArtifactKind.THRESHOLD_STATE, ThresholdState.class))
                .isInstanceOf(IllegalStateException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static boolean confirm(AdaptiveThreshold threshold, String resultId, double score, boolean anomaly,
            MutableClock clock) {
        threshold.recordPrediction(EnsembleResult.builder()
                .resultId(resultId)
                .assetId("pump-1")
                .timestamp(clock.instant())
                .compositeScore(score)
                .alertLevel(AlertLevel.NORMAL)
                .build());
        return threshold.onFeedback(new Feedback("fb-" + resultId, "pump-1", resultId, anomaly, clock.instant()));
    }
}
