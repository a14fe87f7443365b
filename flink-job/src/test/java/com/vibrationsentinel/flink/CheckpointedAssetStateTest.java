package com.vibrationsentinel.flink;

import com.vibrationsentinel.core.calibration.ThresholdState;
import com.vibrationsentinel.core.drift.DistributionSummary;
import com.vibrationsentinel.core.drift.DriftState;
import com.vibrationsentinel.core.error.StateCorruptionException;
import com.vibrationsentinel.core.model.FeatureSchema;
import com.vibrationsentinel.core.pipeline.AssetState;
import com.vibrationsentinel.core.state.ArtifactCodec;
import com.vibrationsentinel.core.state.ArtifactKind;
import com.vibrationsentinel.core.state.VersionedArtifact;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CheckpointedAssetState}.
 */
class CheckpointedAssetStateTest {

    private final ArtifactCodec codec = new ArtifactCodec();

    @Test
    @DisplayName("Cuts and drift reference are stored as versioned envelopes")
    void storesVersionedEnvelopes() throws Exception {
        CheckpointedAssetState stored = CheckpointedAssetState.of(sampleState(), codec);

        VersionedArtifact threshold = codec.mapper().readValue(stored.getThresholdArtifact(), VersionedArtifact.class);
        VersionedArtifact drift = codec.mapper().readValue(stored.getDriftArtifact(), VersionedArtifact.class);
        assertThat(threshold.getKind()).isEqualTo(ArtifactKind.THRESHOLD_STATE);
        assertThat(threshold.getSchemaVersion()).isEqualTo(ArtifactCodec.CURRENT_SCHEMA_VERSION);
        assertThat(drift.getKind()).isEqualTo(ArtifactKind.DRIFT_STATE);
    }

    @Test
    @DisplayName("Restored snapshot carries cuts, drift run and scores but no partial window")
    void restoresSnapshot() {
        AssetState restored = CheckpointedAssetState.of(sampleState(), codec).toAssetState(codec);

        assertThat(restored.getAssetId()).isEqualTo("pump-1");
        assertThat(restored.getThreshold().getWarningCut()).isEqualTo(0.35);
        assertThat(restored.getDrift().getConsecutiveOverThreshold()).isEqualTo(1);
        assertThat(restored.getLastGoodScores()).containsEntry("isolation", 0.2);
        assertThat(restored.getAssembler()).isNull();
    }

    @Test
    @DisplayName("An envelope from an unsupported release is rejected")
    void rejectsUnsupportedVersion() {
        CheckpointedAssetState stored = CheckpointedAssetState.of(sampleState(), codec);
        stored.setDriftArtifact("{\"schemaVersion\":99,\"kind\":\"drift-state\",\"payload\":{}}");

        assertThatThrownBy(() -> stored.toAssetState(codec))
                .isInstanceOf(StateCorruptionException.class)
                .hasMessageContaining("99");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static AssetState sampleState() {
        AssetState state = new AssetState();
        state.setAssetId("pump-1");
        state.setThreshold(new ThresholdState(0.35, 0.75));
        DriftState drift = new DriftState(FeatureSchema.DEFAULT.names(),
                DistributionSummary.standardNormalReference(FeatureSchema.DEFAULT.size()));
        drift.setConsecutiveOverThreshold(1);
        state.setDrift(drift);
        state.getLastGoodScores().put("isolation", 0.2);
        return state;
    }
}
