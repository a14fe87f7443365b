package com.vibrationsentinel.core.registry;

import com.vibrationsentinel.core.detection.DenseAutoencoder;
import com.vibrationsentinel.core.detection.DenseLayer;
import com.vibrationsentinel.core.detection.FeatureLayout;
import com.vibrationsentinel.core.detection.PercentileScaler;
import com.vibrationsentinel.core.detection.ReconstructionDetector;

import java.util.ArrayList;
import java.util.List;

/**
 * Persisted form of the reconstruction detector: input feature names,
 * autoencoder layers and the healthy-error scaler.
 */
public class AutoencoderArtifact {

    private List<String> featureNames = new ArrayList<>();
    private List<DenseLayer> layers = new ArrayList<>();
    private PercentileScaler scaler;

    public AutoencoderArtifact() {
    }

    public AutoencoderArtifact(List<String> featureNames, List<DenseLayer> layers, PercentileScaler scaler) {
        this.featureNames = featureNames;
        this.layers = layers;
        this.scaler = scaler;
    }

    public ReconstructionDetector toDetector() {
        if (scaler == null) {
            throw new IllegalArgumentException("Autoencoder artifact has no scaler");
        }
        if (featureNames == null || featureNames.isEmpty()) {
            throw new IllegalArgumentException("Autoencoder artifact does not name its input features");
        }
        return new ReconstructionDetector(new FeatureLayout(featureNames), new DenseAutoencoder(layers),
                scaler);
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }

    public void setFeatureNames(List<String> featureNames) {
        this.featureNames = featureNames;
    }

    public List<DenseLayer> getLayers() {
        return layers;
    }

    public void setLayers(List<DenseLayer> layers) {
        this.layers = layers;
    }

    public PercentileScaler getScaler() {
        return scaler;
    }

    public void setScaler(PercentileScaler scaler) {
        this.scaler = scaler;
    }
}
