package com.vibrationsentinel.flink;

import com.vibrationsentinel.core.calibration.ThresholdState;
import com.vibrationsentinel.core.config.PipelineConfig;
import com.vibrationsentinel.core.detection.MissingModelDetector;
import com.vibrationsentinel.core.ensemble.AlertCuts;
import com.vibrationsentinel.core.ensemble.EnsembleScorer;
import com.vibrationsentinel.core.normalization.Normalizer;
import com.vibrationsentinel.core.pipeline.AssetPipeline;
import com.vibrationsentinel.core.pipeline.AssetState;
import com.vibrationsentinel.core.pipeline.PipelineComponents;
import com.vibrationsentinel.core.state.ArtifactCodec;
import com.vibrationsentinel.core.state.ArtifactKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AssetPipelines}.
 */
class AssetPipelinesTest {

    private static final String ASSET = "pump-1";

    private final ArtifactCodec codec = new ArtifactCodec();
    private ExecutorService executor;
    private AssetPipelines pipelines;

    @BeforeEach
    void setUp() {
        executor = EnsembleScorer.newDetectorExecutor(1);
        PipelineComponents components = PipelineComponents.builder()
                .config(new PipelineConfig())
                .normalizer(new Normalizer())
                .detectors(List.of(new MissingModelDetector("reconstruction", "not published")))
                .executor(executor)
                .build();
        pipelines = new AssetPipelines(components, codec);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("A new asset starts on bootstrap cuts")
    void newAssetStartsOnBootstrapCuts() {
        Optional<AssetPipeline> pipeline = pipelines.pipelineFor(ASSET, null);

        assertThat(pipeline).isPresent();
        assertThat(pipeline.get().currentCuts()).isEqualTo(AlertCuts.BOOTSTRAP);
        assertThat(pipelines.pipelineFor(ASSET, null)).containsSame(pipeline.get());
    }

    @Test
    @DisplayName("Checkpointed cuts are restored")
    void restoresCheckpointedCuts() {
        AssetState state = new AssetState();
        state.setAssetId(ASSET);
        state.setThreshold(new ThresholdState(0.4, 0.8));

        Optional<AssetPipeline> pipeline = pipelines.pipelineFor(ASSET, CheckpointedAssetState.of(state, codec));

        assertThat(pipeline).hasValueSatisfying(p -> {
            assertThat(p.currentCuts().getWarningCut()).isEqualTo(0.4);
            assertThat(p.currentCuts().getCriticalCut()).isEqualTo(0.8);
        });
    }

    @Test
    @DisplayName("An asset whose cuts violate their invariants is never rebuilt on bootstrap cuts")
    void corruptCutsKeepAssetFailed() {
        AssetState state = new AssetState();
        state.setAssetId(ASSET);
        state.setThreshold(new ThresholdState(0.8, 0.5));
        CheckpointedAssetState stored = CheckpointedAssetState.of(state, codec);

        assertThat(pipelines.pipelineFor(ASSET, stored)).isEmpty();
        assertThat(pipelines.isCorrupt(ASSET)).isTrue();
        assertThat(pipelines.pipelineFor(ASSET, stored)).isEmpty();
        assertThat(pipelines.pipelineFor(ASSET, null)).isEmpty();
        assertThat(pipelines.size()).isZero();
    }

    @Test
    @DisplayName("A threshold envelope of the wrong kind keeps the asset failed")
    void wrongEnvelopeKeepsAssetFailed() {
        CheckpointedAssetState stored = new CheckpointedAssetState();
        stored.setAssetId(ASSET);
        stored.setThresholdArtifact(codec.encode(ArtifactKind.DRIFT_STATE, new ThresholdState(0.3, 0.7)));

        assertThat(pipelines.pipelineFor(ASSET, stored)).isEmpty();
        assertThat(pipelines.isCorrupt(ASSET)).isTrue();
    }

    @Test
    @DisplayName("Corruption of one asset leaves the others running")
    void otherAssetsUnaffected() {
        AssetState state = new AssetState();
        state.setAssetId(ASSET);
        state.setThreshold(new ThresholdState(0.8, 0.5));

        pipelines.pipelineFor(ASSET, CheckpointedAssetState.of(state, codec));

        assertThat(pipelines.pipelineFor("fan-2", null)).isPresent();
        assertThat(pipelines.isCorrupt("fan-2")).isFalse();
    }
}
