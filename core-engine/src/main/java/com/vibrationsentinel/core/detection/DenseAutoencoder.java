package com.vibrationsentinel.core.detection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Feed-forward autoencoder made of stacked {@link DenseLayer}s whose last
 * layer outputs as many values as the first consumes.
 */
public final class DenseAutoencoder implements ReconstructionModel {

    private final List<DenseLayer> layers;

    public DenseAutoencoder(List<DenseLayer> layers) {
        Objects.requireNonNull(layers, "layers must not be null");
        if (layers.isEmpty()) {
            throw new IllegalArgumentException("Autoencoder needs at least one layer");
        }
        for (int i = 1; i < layers.size(); i++) {
            if (layers.get(i).inputSize() != layers.get(i - 1).outputSize()) {
                throw new IllegalArgumentException("Layer " + i + " expects " + layers.get(i).inputSize()
                        + " inputs but previous layer outputs " + layers.get(i - 1).outputSize());
            }
        }
        int in = layers.get(0).inputSize();
        int out = layers.get(layers.size() - 1).outputSize();
        if (in != out) {
            throw new IllegalArgumentException("Autoencoder output size " + out + " != input size " + in);
        }
        this.layers = Collections.unmodifiableList(new ArrayList<>(layers));
    }

    @Override
    public int inputSize() {
        return layers.get(0).inputSize();
    }

    @Override
    public double[] reconstruct(double[] input) {
        double[] x = input;
        for (DenseLayer layer : layers) {
            x = layer.forward(x);
        }
        return x;
    }

    public List<DenseLayer> getLayers() {
        return layers;
    }
}
