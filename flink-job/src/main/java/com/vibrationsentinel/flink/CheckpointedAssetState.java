package com.vibrationsentinel.flink;

import com.vibrationsentinel.core.calibration.ThresholdState;
import com.vibrationsentinel.core.drift.DriftState;
import com.vibrationsentinel.core.error.StateCorruptionException;
import com.vibrationsentinel.core.model.EnsembleResult;
import com.vibrationsentinel.core.model.FeatureVector;
import com.vibrationsentinel.core.pipeline.AssetState;
import com.vibrationsentinel.core.rul.HealthPoint;
import com.vibrationsentinel.core.state.ArtifactCodec;
import com.vibrationsentinel.core.state.ArtifactKind;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keyed-state form of an {@link AssetState}.
 *
 * <p>
 * Adaptive cuts and drift reference are held as versioned artifact envelopes
 * so a checkpoint written by another release is checked for kind, version
 * and invariants on restore instead of being trusted field by field. The
 * partial window is not part of it: the function keeps the assembler in its
 * own keyed state.
 * </p>
 *
 * @since 1.0.0
 */
public class CheckpointedAssetState implements Serializable {

    private static final long serialVersionUID = 1L;

    private String assetId;
    private String thresholdArtifact;
    private String driftArtifact;
    private List<FeatureVector> featureHistory = new ArrayList<>();
    private List<HealthPoint> health = new ArrayList<>();
    private Map<String, Double> lastGoodScores = new LinkedHashMap<>();
    private EnsembleResult lastResult;

    public CheckpointedAssetState() {
    }

    public static CheckpointedAssetState of(AssetState state, ArtifactCodec codec) {
        CheckpointedAssetState c = new CheckpointedAssetState();
        c.assetId = state.getAssetId();
        c.thresholdArtifact = state.getThreshold() != null
                ? codec.encode(ArtifactKind.THRESHOLD_STATE, state.getThreshold())
                : null;
        c.driftArtifact = state.getDrift() != null
                ? codec.encode(ArtifactKind.DRIFT_STATE, state.getDrift())
                : null;
        c.featureHistory = new ArrayList<>(state.getFeatureHistory());
        c.health = new ArrayList<>(state.getHealth());
        c.lastGoodScores = new LinkedHashMap<>(state.getLastGoodScores());
        c.lastResult = state.getLastResult();
        return c;
    }

    /**
     * @return the pipeline snapshot, without a partial window
     * @throws StateCorruptionException if an envelope has the wrong kind or
     *                                  version, or does not parse
     */
    public AssetState toAssetState(ArtifactCodec codec) {
        if (assetId == null) {
            throw new StateCorruptionException("Checkpointed asset state has no asset id");
        }
        AssetState state = new AssetState();
        state.setAssetId(assetId);
        if (thresholdArtifact != null) {
            state.setThreshold(codec.decode(thresholdArtifact, ArtifactKind.THRESHOLD_STATE, ThresholdState.class));
        }
        if (driftArtifact != null) {
            state.setDrift(codec.decode(driftArtifact, ArtifactKind.DRIFT_STATE, DriftState.class));
        }
        state.setFeatureHistory(new ArrayList<>(featureHistory));
        state.setHealth(new ArrayList<>(health));
        state.setLastGoodScores(new LinkedHashMap<>(lastGoodScores));
        state.setLastResult(lastResult);
        return state;
    }

    public String getAssetId() {
        return assetId;
    }

    public void setAssetId(String assetId) {
        this.assetId = assetId;
    }

    public String getThresholdArtifact() {
        return thresholdArtifact;
    }

    public void setThresholdArtifact(String thresholdArtifact) {
        this.thresholdArtifact = thresholdArtifact;
    }

    public String getDriftArtifact() {
        return driftArtifact;
    }

    public void setDriftArtifact(String driftArtifact) {
        this.driftArtifact = driftArtifact;
    }

    public List<FeatureVector> getFeatureHistory() {
        return featureHistory;
    }

    public void setFeatureHistory(List<FeatureVector> featureHistory) {
        this.featureHistory = featureHistory;
    }

    public List<HealthPoint> getHealth() {
        return health;
    }

    public void setHealth(List<HealthPoint> health) {
        this.health = health;
    }

    public Map<String, Double> getLastGoodScores() {
        return lastGoodScores;
    }

    public void setLastGoodScores(Map<String, Double> lastGoodScores) {
        this.lastGoodScores = lastGoodScores;
    }

    public EnsembleResult getLastResult() {
        return lastResult;
    }

    public void setLastResult(EnsembleResult lastResult) {
        this.lastResult = lastResult;
    }
}
