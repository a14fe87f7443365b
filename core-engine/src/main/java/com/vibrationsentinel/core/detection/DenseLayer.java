package com.vibrationsentinel.core.detection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Fully connected layer {@code y = act(W x + b)} with {@code W} stored
 * row-major as {@code [outputs][inputs]}.
 */
public final class DenseLayer {

    private final double[][] weights;
    private final double[] bias;
    private final Activation activation;

    @JsonCreator
    public DenseLayer(
            @JsonProperty("weights") double[][] weights,
            @JsonProperty("bias") double[] bias,
            @JsonProperty("activation") Activation activation) {
        Objects.requireNonNull(weights, "weights must not be null");
        Objects.requireNonNull(bias, "bias must not be null");
        if (weights.length == 0 || weights.length != bias.length) {
            throw new IllegalArgumentException("Layer needs one bias per output row: rows="
                    + weights.length + ", bias=" + bias.length);
        }
        int inputs = weights[0].length;
        for (double[] row : weights) {
            if (row.length != inputs) {
                throw new IllegalArgumentException("Ragged weight matrix");
            }
        }
        this.weights = weights;
        this.bias = bias;
        this.activation = activation == null ? Activation.LINEAR : activation;
    }

    public int inputSize() {
        return weights[0].length;
    }

    public int outputSize() {
        return weights.length;
    }

    public double[] forward(double[] x) {
        if (x.length != inputSize()) {
            throw new IllegalArgumentException("Expected " + inputSize() + " inputs, got " + x.length);
        }
        double[] y = new double[weights.length];
        for (int o = 0; o < weights.length; o++) {
            double sum = bias[o];
            double[] row = weights[o];
            for (int i = 0; i < row.length; i++) {
                sum += row[i] * x[i];
            }
            y[o] = activation.apply(sum);
        }
        return y;
    }

    public double[][] getWeights() {
        return weights;
    }

    public double[] getBias() {
        return bias;
    }

    public Activation getActivation() {
        return activation;
    }
}
