package com.vibrationsentinel.core.detection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Long short-term memory layer.
 *
 * <p>
 * Weight layout follows the common Keras export: {@code kernel} is
 * {@code [inputs][4 * units]}, {@code recurrentKernel} is
 * {@code [units][4 * units]} and {@code bias} is {@code [4 * units]}, with
 * gate blocks ordered input, forget, cell, output.
 * </p>
 */
public final class LstmLayer {

    private final double[][] kernel;
    private final double[][] recurrentKernel;
    private final double[] bias;
    private final int units;

    @JsonCreator
    public LstmLayer(
            @JsonProperty("kernel") double[][] kernel,
            @JsonProperty("recurrentKernel") double[][] recurrentKernel,
            @JsonProperty("bias") double[] bias) {
        Objects.requireNonNull(kernel, "kernel must not be null");
        Objects.requireNonNull(recurrentKernel, "recurrentKernel must not be null");
        Objects.requireNonNull(bias, "bias must not be null");
        if (bias.length == 0 || bias.length % 4 != 0) {
            throw new IllegalArgumentException("bias length must be a positive multiple of 4, got: " + bias.length);
        }
        int u = bias.length / 4;
        if (recurrentKernel.length != u) {
            throw new IllegalArgumentException("recurrentKernel must have " + u + " rows, got: "
                    + recurrentKernel.length);
        }
        if (kernel.length == 0) {
            throw new IllegalArgumentException("kernel must have at least one row");
        }
        for (double[] row : kernel) {
            if (row.length != 4 * u) {
                throw new IllegalArgumentException("kernel rows must have " + 4 * u + " columns");
            }
        }
        for (double[] row : recurrentKernel) {
            if (row.length != 4 * u) {
                throw new IllegalArgumentException("recurrentKernel rows must have " + 4 * u + " columns");
            }
        }
        this.kernel = kernel;
        this.recurrentKernel = recurrentKernel;
        this.bias = bias;
        this.units = u;
    }

    public int inputSize() {
        return kernel.length;
    }

    public int units() {
        return units;
    }

    /**
     * Run the layer over a sequence from a zero initial state.
     *
     * @param sequence {@code [timesteps][inputs]}
     * @return hidden state at every timestep, {@code [timesteps][units]}
     */
    public double[][] forward(double[][] sequence) {
        double[] h = new double[units];
        double[] c = new double[units];
        double[][] outputs = new double[sequence.length][];
        double[] z = new double[4 * units];
        for (int t = 0; t < sequence.length; t++) {
            double[] x = sequence[t];
            if (x.length != kernel.length) {
                throw new IllegalArgumentException("Expected " + kernel.length + " inputs at step " + t
                        + ", got " + x.length);
            }
            System.arraycopy(bias, 0, z, 0, z.length);
            for (int i = 0; i < x.length; i++) {
                double xi = x[i];
                double[] row = kernel[i];
                for (int j = 0; j < z.length; j++) {
                    z[j] += xi * row[j];
                }
            }
            for (int i = 0; i < units; i++) {
                double hi = h[i];
                double[] row = recurrentKernel[i];
                for (int j = 0; j < z.length; j++) {
                    z[j] += hi * row[j];
                }
            }
            double[] next = new double[units];
            for (int k = 0; k < units; k++) {
                double in = Activation.SIGMOID.apply(z[k]);
                double forget = Activation.SIGMOID.apply(z[units + k]);
                double cell = Math.tanh(z[2 * units + k]);
                double out = Activation.SIGMOID.apply(z[3 * units + k]);
                c[k] = forget * c[k] + in * cell;
                next[k] = out * Math.tanh(c[k]);
            }
            h = next;
            outputs[t] = next;
        }
        return outputs;
    }

    public double[][] getKernel() {
        return kernel;
    }

    public double[][] getRecurrentKernel() {
        return recurrentKernel;
    }

    public double[] getBias() {
        return bias;
    }
}
