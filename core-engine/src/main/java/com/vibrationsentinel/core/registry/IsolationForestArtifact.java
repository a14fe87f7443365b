package com.vibrationsentinel.core.registry;

import com.vibrationsentinel.core.detection.FeatureLayout;
import com.vibrationsentinel.core.detection.IsolationDetector;
import com.vibrationsentinel.core.detection.IsolationForestModel;
import com.vibrationsentinel.core.detection.IsolationTree;
import com.vibrationsentinel.core.detection.PercentileScaler;

import java.util.ArrayList;
import java.util.List;

/**
 * Persisted form of the isolation detector.
 */
public class IsolationForestArtifact {

    private List<String> featureNames = new ArrayList<>();
    private List<IsolationTree> trees = new ArrayList<>();
    private int sampleSize = 256;
    private PercentileScaler scaler;

    public IsolationForestArtifact() {
    }

    public IsolationForestArtifact(List<String> featureNames, List<IsolationTree> trees, int sampleSize,
            PercentileScaler scaler) {
        this.featureNames = featureNames;
        this.trees = trees;
        this.sampleSize = sampleSize;
        this.scaler = scaler;
    }

    public IsolationDetector toDetector() {
        if (scaler == null) {
            throw new IllegalArgumentException("Isolation forest artifact has no scaler");
        }
        if (featureNames == null || featureNames.isEmpty()) {
            throw new IllegalArgumentException("Isolation forest artifact does not name its input features");
        }
        return new IsolationDetector(new FeatureLayout(featureNames),
                new IsolationForestModel(trees, sampleSize), scaler);
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }

    public void setFeatureNames(List<String> featureNames) {
        this.featureNames = featureNames;
    }

    public List<IsolationTree> getTrees() {
        return trees;
    }

    public void setTrees(List<IsolationTree> trees) {
        this.trees = trees;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public void setSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
    }

    public PercentileScaler getScaler() {
        return scaler;
    }

    public void setScaler(PercentileScaler scaler) {
        this.scaler = scaler;
    }
}
