package com.vibrationsentinel.core.pipeline;

import com.vibrationsentinel.core.calibration.ThresholdState;
import com.vibrationsentinel.core.drift.DriftState;
import com.vibrationsentinel.core.model.EnsembleResult;
import com.vibrationsentinel.core.model.FeatureVector;
import com.vibrationsentinel.core.rul.HealthPoint;
import com.vibrationsentinel.core.signal.WindowAssembler;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one {@link AssetPipeline} needs to resume after a restart.
 * Produced by {@link AssetPipeline#snapshot()}; streaming hosts keep it in
 * checkpointed keyed state.
 */
public class AssetState implements Serializable {

    private static final long serialVersionUID = 1L;

    private String assetId;
    private WindowAssembler assembler;
    private List<FeatureVector> featureHistory = new ArrayList<>();
    private ThresholdState threshold;
    private DriftState drift;
    private List<HealthPoint> health = new ArrayList<>();
    private Map<String, Double> lastGoodScores = new LinkedHashMap<>();
    private EnsembleResult lastResult;

    public AssetState() {
    }

    public String getAssetId() {
        return assetId;
    }

    public void setAssetId(String assetId) {
        this.assetId = assetId;
    }

    public WindowAssembler getAssembler() {
        return assembler;
    }

    public void setAssembler(WindowAssembler assembler) {
        this.assembler = assembler;
    }

    public List<FeatureVector> getFeatureHistory() {
        return featureHistory;
    }

    public void setFeatureHistory(List<FeatureVector> featureHistory) {
        this.featureHistory = featureHistory;
    }

    public ThresholdState getThreshold() {
        return threshold;
    }

    public void setThreshold(ThresholdState threshold) {
        this.threshold = threshold;
    }

    public DriftState getDrift() {
        return drift;
    }

    public void setDrift(DriftState drift) {
        this.drift = drift;
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
